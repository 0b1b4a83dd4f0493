package ai.regula.ingest.definition;

import java.util.regex.Matcher;

final class DefinitionText {

    private DefinitionText() {
    }

    /**
     * Text of the line after the matched term and verb, e.g. the meaning itself.
     */
    static String remainder(String line, Matcher matcher) {
        return line.substring(matcher.end()).strip();
    }
}
