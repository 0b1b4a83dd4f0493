package ai.regula.ingest.config;

import ai.regula.ingest.model.DocumentFormat;
import java.util.Optional;

/**
 * Parser selection: automatic detection or a forced document format.
 */
public enum FormatOption {
    AUTO(null),
    EU(DocumentFormat.EU),
    US(DocumentFormat.US),
    UK(DocumentFormat.UK),
    GENERIC(DocumentFormat.GENERIC);

    private final DocumentFormat format;

    FormatOption(DocumentFormat format) {
        this.format = format;
    }

    public Optional<DocumentFormat> forcedFormat() {
        return Optional.ofNullable(format);
    }

    public static FormatOption from(String raw) {
        if (raw == null || raw.isBlank()) {
            return AUTO;
        }
        for (FormatOption option : values()) {
            if (option.name().equalsIgnoreCase(raw.trim())) {
                return option;
            }
        }
        throw new IllegalArgumentException("Unsupported format: " + raw);
    }
}
