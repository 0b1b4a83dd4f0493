package ai.regula.ingest.pattern;

import java.util.Optional;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds a {@link PatternRegistry} implementation registered through {@link ServiceLoader}. Without one, format
 * detection relies on the built-in indicator table.
 */
public final class PatternRegistries {

    private static final Logger LOGGER = LoggerFactory.getLogger(PatternRegistries.class);

    private PatternRegistries() {
    }

    public static Optional<PatternRegistry> discover() {
        return discover(PatternRegistries.class.getClassLoader());
    }

    public static Optional<PatternRegistry> discover(ClassLoader classLoader) {
        try {
            Optional<PatternRegistry> registry = ServiceLoader.load(PatternRegistry.class, classLoader).findFirst();
            registry.ifPresentOrElse(
                    found -> LOGGER.debug("Using pattern registry {}", found.getClass().getName()),
                    () -> LOGGER.debug("No pattern registry registered; using indicator detection"));
            return registry;
        } catch (ServiceConfigurationError ex) {
            LOGGER.warn("Ignoring misconfigured pattern registry: {}", ex.getMessage());
            return Optional.empty();
        }
    }
}
