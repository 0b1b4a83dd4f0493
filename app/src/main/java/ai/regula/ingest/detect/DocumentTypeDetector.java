package ai.regula.ingest.detect;

import ai.regula.ingest.model.DocumentType;
import java.util.List;
import java.util.Locale;

/**
 * Classifies the instrument from keywords in its opening lines.
 */
public final class DocumentTypeDetector {

    private static final int SCAN_LINES = 20;

    private DocumentTypeDetector() {
    }

    public static DocumentType detect(List<String> lines) {
        for (int i = 0; i < Math.min(SCAN_LINES, lines.size()); i++) {
            String upper = lines.get(i).toUpperCase(Locale.ROOT);
            if (upper.contains("REGULATION")) {
                return DocumentType.REGULATION;
            }
            if (upper.contains("DIRECTIVE")) {
                return DocumentType.DIRECTIVE;
            }
            if (upper.contains("DECISION")) {
                return DocumentType.DECISION;
            }
            if (upper.contains("ACT")) {
                return DocumentType.ACT;
            }
            if (upper.contains("CODE") || upper.contains("STATUTE")) {
                return DocumentType.STATUTE;
            }
        }
        return DocumentType.UNKNOWN;
    }
}
