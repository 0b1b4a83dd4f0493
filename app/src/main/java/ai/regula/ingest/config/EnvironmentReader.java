package ai.regula.ingest.config;

import java.util.Optional;

/**
 * Source of named settings, normally the process environment.
 */
@FunctionalInterface
public interface EnvironmentReader {

    Optional<String> get(String key);

    /**
     * Trimmed value of {@code key}; a variable that is set but blank counts as unset.
     */
    default Optional<String> value(String key) {
        return get(key)
                .map(String::trim)
                .filter(value -> !value.isEmpty());
    }
}
