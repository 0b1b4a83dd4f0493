package ai.regula.ingest.cli;

import ai.regula.ingest.config.FormatOption;
import ai.regula.ingest.config.LogFormat;
import java.util.function.Function;
import picocli.CommandLine;

/**
 * picocli converters for the enum-valued options. A rejected value is reported with the enum's own message so the
 * usage error reads {@code Invalid value for option '--format': Unsupported format: fr}.
 */
public final class OptionConverters {

    private OptionConverters() {
    }

    public static final class FormatOptionConverter implements CommandLine.ITypeConverter<FormatOption> {
        @Override
        public FormatOption convert(String value) {
            return OptionConverters.convert(value, FormatOption::from);
        }
    }

    public static final class LogFormatConverter implements CommandLine.ITypeConverter<LogFormat> {
        @Override
        public LogFormat convert(String value) {
            return OptionConverters.convert(value, LogFormat::from);
        }
    }

    private static <T> T convert(String value, Function<String, T> factory) {
        try {
            return factory.apply(value);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.TypeConversionException(ex.getMessage());
        }
    }
}
