package ai.regula.ingest.config;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable runtime configuration assembled from CLI arguments, environment values and defaults.
 *
 * @param input                 document path, or {@code -} for standard input
 * @param output                destination file; standard output when empty
 * @param registryMinConfidence minimum registry confidence below which generic inference is used
 */
public record Config(
        String input,
        Optional<Path> output,
        FormatOption format,
        boolean statsOnly,
        boolean pretty,
        LogFormat logFormat,
        double registryMinConfidence
) {

    public static final String STDIN = "-";

    public Config {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("input must be provided");
        }
        output = output == null ? Optional.empty() : output;
        format = Objects.requireNonNullElse(format, FormatOption.AUTO);
        logFormat = Objects.requireNonNullElse(logFormat, LogFormat.TEXT);
        if (Double.isNaN(registryMinConfidence) || registryMinConfidence < 0.0 || registryMinConfidence > 1.0) {
            throw new IllegalArgumentException("registryMinConfidence must be between 0.0 and 1.0");
        }
    }

    public boolean readsStdin() {
        return STDIN.equals(input);
    }

    public Optional<Path> inputPath() {
        return readsStdin() ? Optional.empty() : Optional.of(Path.of(input));
    }
}
