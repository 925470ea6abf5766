package ai.asr.trn.cli;

import ai.asr.trn.config.Config;
import ai.asr.trn.config.ConfigLoader;
import ai.asr.trn.config.SystemEnvironmentReader;
import ai.asr.trn.logging.LoggingConfigurator;
import ai.asr.trn.read.TrnReadException;
import ai.asr.trn.read.TrnReader;
import ai.asr.trn.score.ScoringInput;
import ai.asr.trn.score.ScoringInputException;
import ai.asr.trn.score.ScoringInputPreparer;
import ai.asr.trn.transcript.Transcript;
import ai.asr.trn.transcript.TranscriptFormatter;
import ai.asr.trn.transcript.UtteranceRecord;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.Map;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and trn reader.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_FAILURE = 1;

    private final ConfigLoader configLoader;
    private final PrintWriter out;
    private final PrintWriter err;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()),
                new PrintWriter(System.out, true),
                new PrintWriter(System.err, true));
    }

    CliApplication(ConfigLoader configLoader, PrintWriter out, PrintWriter err) {
        this.configLoader = configLoader;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);
        commandLine.setOut(out);
        commandLine.setErr(err);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            err.println(ex.getMessage());
            commandLine.usage(err);
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(out);
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(out);
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            err.println(ex.getMessage());
            commandLine.usage(err);
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat());
        LOGGER.info("Running in {} mode: reference={} workers={} chunkSize={}",
                config.mode(), config.referencePath(), config.readOptions().workers(), config.readOptions().chunkSize());

        TrnReader reader = new TrnReader(config.readOptions());
        try {
            return switch (config.mode()) {
                case DUMP -> dump(reader, config);
                case PAIR -> pair(reader, config);
            };
        } catch (TrnReadException | ScoringInputException | UncheckedIOException ex) {
            LOGGER.error("Failed to process trn input: {}", ex.getMessage());
            return EXIT_FAILURE;
        } finally {
            out.flush();
        }
    }

    private int dump(TrnReader reader, Config config) {
        TranscriptFormatter formatter = new TranscriptFormatter();
        long count = 0;
        long withAlternates = 0;
        try (Stream<UtteranceRecord> records = reader.stream(config.referencePath())) {
            for (Iterator<UtteranceRecord> iterator = records.iterator(); iterator.hasNext(); ) {
                UtteranceRecord record = iterator.next();
                out.println(formatter.format(record));
                count++;
                if (record.hasAlternates()) {
                    withAlternates++;
                }
            }
        }
        LOGGER.info("Read {} utterances from {} ({} with alternates)", count, config.referencePath(), withAlternates);
        return 0;
    }

    private int pair(TrnReader reader, Config config) {
        Map<String, Transcript> references = reader.readMap(config.referencePath());
        Map<String, Transcript> hypotheses = reader.readMap(config.hypothesisPath().orElseThrow());
        ScoringInput input = new ScoringInputPreparer().prepare(references, hypotheses);
        for (int i = 0; i < input.size(); i++) {
            out.println(input.utteranceIds().get(i) + "\t" + input.references().get(i) + "\t" + input.hypotheses().get(i));
        }
        return 0;
    }
}
