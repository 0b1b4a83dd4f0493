package ai.regula.ingest.parse;

import java.util.List;

/**
 * Line helpers shared by the structural parsers.
 */
final class Lines {

    static final int TITLE_LOOKAHEAD = 4;

    private Lines() {
    }

    /**
     * First non-blank line among the {@value #TITLE_LOOKAHEAD} lines after {@code index}, stripped.
     */
    static String lookaheadTitle(List<String> lines, int index) {
        for (int j = index + 1; j < lines.size() && j <= index + TITLE_LOOKAHEAD; j++) {
            String candidate = lines.get(j).strip();
            if (!candidate.isEmpty()) {
                return candidate;
            }
        }
        return "";
    }

    /**
     * Like {@link #lookaheadTitle(List, int)} but only skips lines that are exactly empty and keeps the raw text.
     */
    static String lookaheadRawTitle(List<String> lines, int index) {
        for (int j = index + 1; j < lines.size() && j <= index + TITLE_LOOKAHEAD; j++) {
            if (!lines.get(j).isEmpty()) {
                return lines.get(j);
            }
        }
        return "";
    }
}
