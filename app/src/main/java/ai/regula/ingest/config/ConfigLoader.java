package ai.regula.ingest.config;

import ai.regula.ingest.cli.CliArguments;
import ai.regula.ingest.detect.FormatDetector;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults. CLI values
 * win over the environment.
 */
public class ConfigLoader {

    static final String ENV_FORMAT = "INGEST_FORMAT";
    static final String ENV_OUTPUT = "INGEST_OUTPUT";
    static final String ENV_PRETTY = "INGEST_PRETTY";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";
    static final String ENV_REGISTRY_MIN_CONFIDENCE = "REGISTRY_MIN_CONFIDENCE";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        return new Config(
                arguments.input(),
                resolveOutput(arguments),
                resolveFormat(arguments),
                arguments.statsOnly(),
                resolvePretty(arguments),
                resolveLogFormat(arguments),
                resolveMinConfidence());
    }

    private FormatOption resolveFormat(CliArguments arguments) {
        FormatOption cliFormat = arguments.format();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.value(ENV_FORMAT)
                .map(FormatOption::from)
                .orElse(FormatOption.AUTO);
    }

    private Optional<Path> resolveOutput(CliArguments arguments) {
        if (arguments.output() != null) {
            return Optional.of(arguments.output());
        }
        return environmentReader.value(ENV_OUTPUT)
                .map(Path::of);
    }

    private boolean resolvePretty(CliArguments arguments) {
        if (arguments.pretty()) {
            return true;
        }
        return environmentReader.value(ENV_PRETTY)
                .map(value -> value.equalsIgnoreCase("true") || value.equals("1"))
                .orElse(false);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.value(ENV_LOG_FORMAT)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private double resolveMinConfidence() {
        return environmentReader.value(ENV_REGISTRY_MIN_CONFIDENCE)
                .map(ConfigLoader::parseConfidence)
                .orElse(FormatDetector.DEFAULT_MIN_CONFIDENCE);
    }

    private static double parseConfidence(String raw) {
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(ENV_REGISTRY_MIN_CONFIDENCE + " must be a number: " + raw, ex);
        }
    }
}
