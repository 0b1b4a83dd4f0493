package ai.regula.ingest.pattern;

import ai.regula.ingest.model.DocumentFormat;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Immutable pattern set used for one parse: built-in defaults, with the levels a {@link PatternBridge} defines
 * replaced by the bridge's compiled patterns.
 */
public record ParserConfig(
        Pattern euChapter,
        Pattern euSection,
        Pattern euArticle,
        Pattern usChapter,
        Pattern usArticle,
        Map<UsSectionDialect, Pattern> usSections,
        Pattern ukPart,
        Pattern ukSection,
        Pattern ukSchedule,
        Pattern recital,
        Optional<Pattern> preambleEnd,
        Pattern euDefinition,
        Pattern usDefinition,
        Pattern ukDefinition,
        Optional<PatternBridge> bridge
) {

    static final Pattern EU_CHAPTER = Pattern.compile("^CHAPTER\\s+([IVX]+)$");
    static final Pattern EU_SECTION = Pattern.compile("^Section\\s+(\\d+)$");
    static final Pattern EU_ARTICLE = Pattern.compile("^Article\\s+(\\d+)$");
    static final Pattern US_CHAPTER = Pattern.compile("^CHAPTER\\s+(\\d+)$");
    static final Pattern US_ARTICLE = Pattern.compile("^Article\\s+(\\d+)$");
    static final Pattern UK_PART = Pattern.compile("^PART\\s+(\\d+)\\s*$");
    static final Pattern UK_SECTION = Pattern.compile("^(\\d+)\\.\\s*[-—]?\\s*(.+)$");
    static final Pattern UK_SCHEDULE = Pattern.compile("^SCHEDULE\\s+(\\d+)\\s*$");
    static final Pattern RECITAL = Pattern.compile("^\\((\\d+)\\)\\s+(.*)$");
    static final Pattern EU_DEFINITION =
            Pattern.compile("^\\((\\d+)\\)\\s+['‘’\"]([^'‘’\"]+)['‘’\"].*means");
    static final Pattern US_DEFINITION =
            Pattern.compile("^\\(([a-z])\\)\\s+['‘’\"]([^'‘’\"]+)['‘’\"]\\s+means");
    static final Pattern UK_DEFINITION = Pattern.compile(
            "(?m)^(?:\\(\\d+\\)\\s+)?[“”\"]([^“”\"]+)[“”\"]\\s+(?:means?|has\\s+the\\s+(?:same\\s+)?meaning)");

    private static final ParserConfig DEFAULTS = new Builder().build();

    public ParserConfig {
        Objects.requireNonNull(euChapter, "euChapter");
        Objects.requireNonNull(euSection, "euSection");
        Objects.requireNonNull(euArticle, "euArticle");
        Objects.requireNonNull(usChapter, "usChapter");
        Objects.requireNonNull(usArticle, "usArticle");
        Objects.requireNonNull(ukPart, "ukPart");
        Objects.requireNonNull(ukSection, "ukSection");
        Objects.requireNonNull(ukSchedule, "ukSchedule");
        Objects.requireNonNull(recital, "recital");
        Objects.requireNonNull(euDefinition, "euDefinition");
        Objects.requireNonNull(usDefinition, "usDefinition");
        Objects.requireNonNull(ukDefinition, "ukDefinition");
        EnumMap<UsSectionDialect, Pattern> sections = new EnumMap<>(UsSectionDialect.class);
        for (UsSectionDialect dialect : UsSectionDialect.values()) {
            sections.put(dialect, dialect.defaultPattern());
        }
        if (usSections != null) {
            sections.putAll(usSections);
        }
        usSections = Collections.unmodifiableMap(sections);
        preambleEnd = preambleEnd == null ? Optional.empty() : preambleEnd;
        bridge = bridge == null ? Optional.empty() : bridge;
    }

    public static ParserConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Builds the pattern set for a format. Only the levels relevant to that format are taken from the bridge.
     */
    public static ParserConfig forFormat(DocumentFormat format, Optional<PatternBridge> bridge) {
        if (bridge == null || bridge.isEmpty()) {
            return DEFAULTS;
        }
        PatternBridge source = bridge.get();
        Builder builder = new Builder();
        builder.bridge = source;
        switch (format) {
            case EU -> {
                source.hierarchyPattern(PatternBridge.LEVEL_CHAPTER).ifPresent(value -> builder.euChapter = value);
                source.hierarchyPattern(PatternBridge.LEVEL_SECTION).ifPresent(value -> builder.euSection = value);
                source.hierarchyPattern(PatternBridge.LEVEL_ARTICLE).ifPresent(value -> builder.euArticle = value);
                source.definitionPattern().ifPresent(value -> builder.euDefinition = value);
                source.recitalPattern().ifPresent(value -> builder.recital = value);
                builder.preambleEnd = source.preambleEndPattern().orElse(null);
            }
            case US -> {
                source.hierarchyPattern(PatternBridge.LEVEL_CHAPTER).ifPresent(value -> builder.usChapter = value);
                // Colorado and Utah divide into parts rather than chapters.
                source.hierarchyPattern(PatternBridge.LEVEL_PART).ifPresent(value -> builder.usChapter = value);
                source.hierarchyPattern(PatternBridge.LEVEL_ARTICLE).ifPresent(value -> builder.usArticle = value);
                source.hierarchyPattern(PatternBridge.LEVEL_SECTION).ifPresent(value ->
                        builder.usSections.put(UsSectionDialect.forJurisdiction(source.jurisdiction()), value));
                source.definitionPattern().ifPresent(value -> builder.usDefinition = value);
            }
            case UK -> {
                source.hierarchyPattern(PatternBridge.LEVEL_PART).ifPresent(value -> builder.ukPart = value);
                source.hierarchyPattern(PatternBridge.LEVEL_SECTION).ifPresent(value -> builder.ukSection = value);
                source.hierarchyPattern(PatternBridge.LEVEL_SCHEDULE).ifPresent(value -> builder.ukSchedule = value);
                source.definitionPattern().ifPresent(value -> builder.ukDefinition = value);
            }
            default -> {
            }
        }
        return builder.build();
    }

    public Pattern usSection(UsSectionDialect dialect) {
        return usSections.get(dialect);
    }

    private static final class Builder {
        private Pattern euChapter = EU_CHAPTER;
        private Pattern euSection = EU_SECTION;
        private Pattern euArticle = EU_ARTICLE;
        private Pattern usChapter = US_CHAPTER;
        private Pattern usArticle = US_ARTICLE;
        private final Map<UsSectionDialect, Pattern> usSections = new EnumMap<>(UsSectionDialect.class);
        private Pattern ukPart = UK_PART;
        private Pattern ukSection = UK_SECTION;
        private Pattern ukSchedule = UK_SCHEDULE;
        private Pattern recital = RECITAL;
        private Pattern preambleEnd;
        private Pattern euDefinition = EU_DEFINITION;
        private Pattern usDefinition = US_DEFINITION;
        private Pattern ukDefinition = UK_DEFINITION;
        private PatternBridge bridge;

        private ParserConfig build() {
            return new ParserConfig(euChapter, euSection, euArticle, usChapter, usArticle, usSections,
                    ukPart, ukSection, ukSchedule, recital, Optional.ofNullable(preambleEnd),
                    euDefinition, usDefinition, ukDefinition, Optional.ofNullable(bridge));
        }
    }
}
