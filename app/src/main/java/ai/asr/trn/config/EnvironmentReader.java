package ai.asr.trn.config;

import java.util.Optional;

@FunctionalInterface
public interface EnvironmentReader {

    Optional<String> get(String key);

    /**
     * Trimmed value of {@code key}, treating blank values as unset.
     */
    default Optional<String> getNonBlank(String key) {
        return get(key)
                .map(String::trim)
                .filter(value -> !value.isEmpty());
    }
}
