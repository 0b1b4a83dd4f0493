package ai.regula.ingest.model;

import java.util.Locale;

/**
 * Structural drafting convention detected for a document.
 */
public enum DocumentFormat {
    EU,
    US,
    UK,
    GENERIC,
    UNKNOWN;

    public static DocumentFormat from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Document format must be provided");
        }
        for (DocumentFormat format : values()) {
            if (format.name().equalsIgnoreCase(raw.trim())) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unsupported document format: " + raw);
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
