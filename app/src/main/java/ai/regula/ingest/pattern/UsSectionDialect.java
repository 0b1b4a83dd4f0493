package ai.regula.ingest.pattern;

import java.util.regex.Pattern;

/**
 * Numeric shapes of US statute section headers, in the order they are tried. The first dialect that matches a line
 * decides the leaf number for that line.
 */
public enum UsSectionDialect {

    /** {@code Section 59.1-575}: number after the hyphen. */
    VIRGINIA("^(?:Section|§)\\s*(\\d+\\.\\d+)-(\\d+)\\.?$", 2, false),

    /** {@code Section 6-1-1303}: third hyphen segment. */
    COLORADO_UTAH("^(?:Section|§)\\s*(\\d+)-(\\d+)-(\\d+)\\.?$", 3, true),

    /** {@code Section 715D.1}: numeric suffix after the lettered segment. */
    IOWA("^(?:Section|§)\\s*(\\d+[A-Z])\\.(\\d+)$", 2, true),

    /** {@code Section 1798.100}: subsection part after the dot. */
    CALIFORNIA_TEXAS("^Section\\s+(\\d+)\\.(\\d+)$", 2, false);

    private final Pattern defaultPattern;
    private final int numberGroup;
    private final boolean synthesizesChapter;

    UsSectionDialect(String regex, int numberGroup, boolean synthesizesChapter) {
        this.defaultPattern = Pattern.compile(regex);
        this.numberGroup = numberGroup;
        this.synthesizesChapter = synthesizesChapter;
    }

    public Pattern defaultPattern() {
        return defaultPattern;
    }

    public int numberGroup() {
        return numberGroup;
    }

    /**
     * Whether a default chapter {@code "1"} is opened when this dialect appears before any chapter header.
     */
    public boolean synthesizesChapter() {
        return synthesizesChapter;
    }

    /**
     * Dialect whose pattern a bridge-supplied section pattern replaces for the given jurisdiction.
     */
    public static UsSectionDialect forJurisdiction(String jurisdiction) {
        if (jurisdiction == null) {
            return CALIFORNIA_TEXAS;
        }
        return switch (jurisdiction) {
            case "US-VA", "US-CT" -> VIRGINIA;
            case "US-CO", "US-UT" -> COLORADO_UTAH;
            case "US-IA" -> IOWA;
            default -> CALIFORNIA_TEXAS;
        };
    }
}
