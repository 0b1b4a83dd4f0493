package ai.regula.ingest.pattern;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Compiled jurisdiction-specific patterns supplied by a {@link PatternRegistry}. Any accessor may come back empty,
 * in which case the parser keeps its built-in default for that concern.
 */
public interface PatternBridge {

    String LEVEL_CHAPTER = "chapter";
    String LEVEL_SECTION = "section";
    String LEVEL_ARTICLE = "article";
    String LEVEL_PART = "part";
    String LEVEL_SCHEDULE = "schedule";

    /**
     * Jurisdiction code such as {@code EU}, {@code US-CA} or {@code GB}.
     */
    String jurisdiction();

    Optional<Pattern> hierarchyPattern(String levelName);

    Optional<Pattern> definitionPattern();

    Optional<Pattern> recitalPattern();

    Optional<Pattern> preambleEndPattern();

    List<DefinitionLocation> definitionLocations();
}
