package ai.regula.ingest.pattern;

import java.util.List;
import java.util.Optional;

/**
 * Helpers for choosing a {@link PatternBridge} out of registry detection results.
 */
public final class PatternBridges {

    private PatternBridges() {
    }

    public static List<FormatMatch> detectWithThreshold(PatternRegistry registry, String text, double minConfidence) {
        List<FormatMatch> matches = registry.detectWithThreshold(text, minConfidence);
        return matches == null ? List.of() : matches;
    }

    /**
     * Generic inference is needed when nothing matched or the best match is below the threshold.
     */
    public static boolean shouldUseGeneric(List<FormatMatch> matches, double minConfidence) {
        if (matches == null || matches.isEmpty()) {
            return true;
        }
        return matches.get(0).confidence() < minConfidence;
    }

    public static Optional<PatternBridge> detectAndBridge(PatternRegistry registry, String text, double minConfidence) {
        List<FormatMatch> matches = detectWithThreshold(registry, text, minConfidence);
        if (matches.isEmpty()) {
            return Optional.empty();
        }
        return matches.get(0).bridge();
    }
}
