package ai.asr.trn.config;

import java.util.Map;
import java.util.Optional;

/**
 * Reads environment variables of the running process.
 */
public class SystemEnvironmentReader implements EnvironmentReader {

    private final Map<String, String> environment;

    public SystemEnvironmentReader() {
        this(System.getenv());
    }

    SystemEnvironmentReader(Map<String, String> environment) {
        this.environment = Map.copyOf(environment);
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(environment.get(key));
    }
}
