package ai.asr.trn.config;

import ai.asr.trn.cli.CliArguments;
import ai.asr.trn.read.ReadOptions;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_MODE = "TRN_MODE";
    static final String ENV_WORKERS = "TRN_WORKERS";
    static final String ENV_CHUNK_SIZE = "TRN_CHUNK_SIZE";
    static final String ENV_WARN_ALTERNATES = "TRN_WARN_ALTERNATES";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    private static final int DEFAULT_WORKERS = 0;

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        Mode mode = resolveMode(arguments);

        List<Path> files = arguments.files();
        if (files.isEmpty()) {
            throw new IllegalArgumentException("a reference trn file must be provided");
        }
        if (files.size() > 2) {
            throw new IllegalArgumentException("at most a reference and a hypothesis trn file may be provided");
        }
        Path referencePath = files.get(0);
        Optional<Path> hypothesisPath = files.size() > 1 ? Optional.of(files.get(1)) : Optional.empty();

        int workers = resolveInteger(arguments.workers(), ENV_WORKERS, DEFAULT_WORKERS, 0, "workers");
        int chunkSize = resolveInteger(arguments.chunkSize(), ENV_CHUNK_SIZE, ReadOptions.DEFAULT_CHUNK_SIZE, 1, "chunk size");
        boolean warnOnAlternates = resolveWarnOnAlternates(arguments);
        LogFormat logFormat = resolveLogFormat(arguments);

        return new Config(mode, referencePath, hypothesisPath,
                new ReadOptions(warnOnAlternates, workers, chunkSize), logFormat);
    }

    private Mode resolveMode(CliArguments arguments) {
        Mode cliMode = arguments.mode();
        if (cliMode != null) {
            return cliMode;
        }
        return environmentReader.getNonBlank(ENV_MODE)
                .map(Mode::from)
                .orElse(Mode.DUMP);
    }

    private boolean resolveWarnOnAlternates(CliArguments arguments) {
        if (arguments.noWarn()) {
            return false;
        }
        return environmentReader.getNonBlank(ENV_WARN_ALTERNATES)
                .map(value -> !(value.equalsIgnoreCase("false") || value.equals("0")))
                .orElse(true);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.getNonBlank(ENV_LOG_FORMAT)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private int resolveInteger(Integer cliValue, String envKey, int defaultValue, int minimum, String name) {
        int value;
        if (cliValue != null) {
            value = cliValue;
        } else {
            value = environmentReader.getNonBlank(envKey)
                    .map(raw -> parseInteger(raw, envKey))
                    .orElse(defaultValue);
        }
        if (value < minimum) {
            throw new IllegalArgumentException(name + " must be at least " + minimum);
        }
        return value;
    }

    private static int parseInteger(String raw, String envKey) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(envKey + " must be an integer", ex);
        }
    }
}
