package ai.regula.ingest.pattern;

import java.util.regex.Matcher;

/**
 * Group access that tolerates bridge-supplied patterns with fewer groups than the built-in ones.
 */
public final class MatchGroups {

    private MatchGroups() {
    }

    /**
     * Group text, or empty when the pattern has no such group or it did not participate.
     */
    public static String group(Matcher matcher, int group) {
        if (group > matcher.groupCount()) {
            return "";
        }
        String value = matcher.group(group);
        return value == null ? "" : value;
    }

    /**
     * Group parsed as an int, 0 when absent or not a number.
     */
    public static int intGroup(Matcher matcher, int group) {
        try {
            return Integer.parseInt(group(matcher, group).strip());
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
