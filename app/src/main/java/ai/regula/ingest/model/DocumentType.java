package ai.regula.ingest.model;

import java.util.Locale;

/**
 * Kind of legal instrument a document represents.
 */
public enum DocumentType {
    REGULATION,
    DIRECTIVE,
    DECISION,
    STATUTE,
    ACT,
    UNKNOWN;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
