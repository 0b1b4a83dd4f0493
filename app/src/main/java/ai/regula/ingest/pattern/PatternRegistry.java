package ai.regula.ingest.pattern;

import java.util.List;

/**
 * Registry of jurisdiction patterns loaded from external definitions.
 */
public interface PatternRegistry {

    /**
     * Scores every registered format against the text.
     *
     * @return matches whose confidence is at least {@code minConfidence}, best first
     */
    List<FormatMatch> detectWithThreshold(String text, double minConfidence);
}
