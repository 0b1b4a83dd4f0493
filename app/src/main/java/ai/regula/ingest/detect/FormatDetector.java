package ai.regula.ingest.detect;

import ai.regula.ingest.model.DocumentFormat;
import ai.regula.ingest.pattern.ParserConfig;
import ai.regula.ingest.pattern.PatternBridge;
import ai.regula.ingest.pattern.PatternBridges;
import ai.regula.ingest.pattern.PatternRegistry;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides which structural parser a document needs.
 *
 * <p>With a {@link PatternRegistry}, the best registry match above the confidence threshold wins and its bridge is
 * returned. Without one, or when the winning jurisdiction maps to no known format, lines are scored against the
 * {@link IndicatorRule} table.</p>
 */
public class FormatDetector {

    public static final double DEFAULT_MIN_CONFIDENCE = 0.3;
    static final int MINIMUM_INDICATOR_SCORE = 2;

    private static final Logger LOGGER = LoggerFactory.getLogger(FormatDetector.class);

    private final PatternRegistry registry;
    private final double minConfidence;
    private final List<IndicatorRule> rules;

    public FormatDetector() {
        this(null, DEFAULT_MIN_CONFIDENCE);
    }

    public FormatDetector(PatternRegistry registry, double minConfidence) {
        this(registry, minConfidence, IndicatorRule.defaultTable(ParserConfig.defaults()));
    }

    FormatDetector(PatternRegistry registry, double minConfidence, List<IndicatorRule> rules) {
        if (minConfidence < 0.0 || minConfidence > 1.0) {
            throw new IllegalArgumentException("minConfidence must be between 0.0 and 1.0");
        }
        this.registry = registry;
        this.minConfidence = minConfidence;
        this.rules = List.copyOf(rules);
    }

    public FormatDetection detect(List<String> lines) {
        if (registry != null) {
            String content = String.join("\n", lines);
            if (PatternBridges.shouldUseGeneric(
                    PatternBridges.detectWithThreshold(registry, content, minConfidence), minConfidence)) {
                LOGGER.debug("No registry pattern reached confidence {}; using generic inference", minConfidence);
                return FormatDetection.of(DocumentFormat.GENERIC);
            }
            Optional<PatternBridge> bridge = PatternBridges.detectAndBridge(registry, content, minConfidence);
            if (bridge.isPresent()) {
                DocumentFormat format = formatForJurisdiction(bridge.get().jurisdiction());
                if (format != DocumentFormat.UNKNOWN) {
                    LOGGER.debug("Registry matched jurisdiction {} as {}", bridge.get().jurisdiction(), format);
                    return new FormatDetection(format, bridge);
                }
                LOGGER.debug("Jurisdiction {} has no structural parser; scoring indicators",
                        bridge.get().jurisdiction());
            }
        }
        return FormatDetection.of(detectByIndicators(lines));
    }

    /**
     * Scores lines against the indicator table. UK must beat both other scores outright, US must beat EU, and EU is
     * the default among formats that reached the minimum score.
     */
    public DocumentFormat detectByIndicators(List<String> lines) {
        Map<DocumentFormat, Integer> scores = score(lines);
        int eu = scores.get(DocumentFormat.EU);
        int us = scores.get(DocumentFormat.US);
        int uk = scores.get(DocumentFormat.UK);
        LOGGER.debug("Indicator scores eu={} us={} uk={}", eu, us, uk);

        if (Math.max(eu, Math.max(us, uk)) < MINIMUM_INDICATOR_SCORE) {
            return DocumentFormat.GENERIC;
        }
        if (uk > eu && uk > us) {
            return DocumentFormat.UK;
        }
        if (us > eu) {
            return DocumentFormat.US;
        }
        return DocumentFormat.EU;
    }

    Map<DocumentFormat, Integer> score(List<String> lines) {
        Map<DocumentFormat, Integer> scores = new EnumMap<>(DocumentFormat.class);
        scores.put(DocumentFormat.EU, 0);
        scores.put(DocumentFormat.US, 0);
        scores.put(DocumentFormat.UK, 0);
        for (String line : lines) {
            for (IndicatorRule rule : rules) {
                if (rule.matches(line)) {
                    scores.merge(rule.format(), rule.weight(), Integer::sum);
                }
            }
        }
        return scores;
    }

    static DocumentFormat formatForJurisdiction(String jurisdiction) {
        if (jurisdiction == null) {
            return DocumentFormat.UNKNOWN;
        }
        return switch (jurisdiction) {
            case "EU" -> DocumentFormat.EU;
            case "US", "US-Federal", "US-CA", "US-VA", "US-CO", "US-CT", "US-UT", "US-IA", "US-TX" -> DocumentFormat.US;
            case "GB", "GB-SCT" -> DocumentFormat.UK;
            default -> DocumentFormat.UNKNOWN;
        };
    }
}
