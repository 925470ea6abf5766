package ai.asr.trn.config;

import ai.asr.trn.read.ReadOptions;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        Mode mode,
        Path referencePath,
        Optional<Path> hypothesisPath,
        ReadOptions readOptions,
        LogFormat logFormat
) {

    public Config {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(referencePath, "referencePath");
        hypothesisPath = hypothesisPath == null ? Optional.empty() : hypothesisPath;
        Objects.requireNonNull(readOptions, "readOptions");
        logFormat = logFormat == null ? LogFormat.TEXT : logFormat;
        if (mode.needsHypothesis() && hypothesisPath.isEmpty()) {
            throw new IllegalArgumentException("pair mode requires a hypothesis trn file");
        }
        if (!mode.needsHypothesis() && hypothesisPath.isPresent()) {
            throw new IllegalArgumentException("a hypothesis trn file can only be used in pair mode");
        }
    }
}
