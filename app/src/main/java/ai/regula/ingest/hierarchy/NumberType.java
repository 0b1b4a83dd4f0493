package ai.regula.ingest.hierarchy;

/**
 * Numbering style of a leveled section label.
 */
public enum NumberType {
    ARABIC,
    LOWER_LETTER,
    UPPER_LETTER,
    LOWER_ROMAN,
    UPPER_ROMAN,
    UNKNOWN
}
