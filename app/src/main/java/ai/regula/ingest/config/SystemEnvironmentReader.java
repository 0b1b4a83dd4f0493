package ai.regula.ingest.config;

import java.util.Optional;

/**
 * Reads settings from the process environment.
 */
public class SystemEnvironmentReader implements EnvironmentReader {

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(System.getenv(key));
    }
}
