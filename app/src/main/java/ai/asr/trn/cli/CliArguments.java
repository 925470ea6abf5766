package ai.asr.trn.cli;

import ai.asr.trn.config.LogFormat;
import ai.asr.trn.config.Mode;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "trn-reader", mixinStandardHelpOptions = true, version = "trn-reader 0.1.0",
        description = "Reads NIST sclite trn transcript files")
public class CliArguments {

    @CommandLine.Option(names = "--mode", converter = ModeConverter.class, description = "Execution mode: dump or pair")
    private Mode mode;

    @CommandLine.Option(names = "--workers", description = "Parser threads; 0 parses in the reading thread", paramLabel = "COUNT")
    private Integer workers;

    @CommandLine.Option(names = "--chunk-size", description = "Lines handed to a parser thread at a time", paramLabel = "LINES")
    private Integer chunkSize;

    @CommandLine.Option(names = "--no-warn", description = "Do not warn about utterances containing alternates")
    private boolean noWarn;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Parameters(arity = "1..2", paramLabel = "FILE", description = "Reference trn file, then the hypothesis trn file in pair mode")
    private List<Path> files = new ArrayList<>();

    public Mode mode() {
        return mode;
    }

    public Integer workers() {
        return workers;
    }

    public Integer chunkSize() {
        return chunkSize;
    }

    public boolean noWarn() {
        return noWarn;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public List<Path> files() {
        return files == null ? List.of() : List.copyOf(files);
    }
}
