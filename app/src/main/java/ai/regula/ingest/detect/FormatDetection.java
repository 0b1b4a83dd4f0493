package ai.regula.ingest.detect;

import ai.regula.ingest.model.DocumentFormat;
import ai.regula.ingest.pattern.PatternBridge;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of format detection: the format and, when a registry pattern won, the bridge carrying its patterns.
 */
public record FormatDetection(DocumentFormat format, Optional<PatternBridge> bridge) {

    public FormatDetection {
        Objects.requireNonNull(format, "format");
        bridge = bridge == null ? Optional.empty() : bridge;
    }

    public static FormatDetection of(DocumentFormat format) {
        return new FormatDetection(format, Optional.empty());
    }
}
