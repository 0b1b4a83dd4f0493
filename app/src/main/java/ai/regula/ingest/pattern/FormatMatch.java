package ai.regula.ingest.pattern;

import java.util.Objects;
import java.util.Optional;

/**
 * One registered format scored against a document.
 *
 * @param formatId   registry identifier of the format
 * @param confidence score between 0.0 and 1.0
 * @param bridge     compiled patterns of the format, empty when the format could not be compiled
 */
public record FormatMatch(String formatId, double confidence, Optional<PatternBridge> bridge) {

    public FormatMatch {
        Objects.requireNonNull(formatId, "formatId");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0");
        }
        bridge = bridge == null ? Optional.empty() : bridge;
    }
}
