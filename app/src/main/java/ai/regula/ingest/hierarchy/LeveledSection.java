package ai.regula.ingest.hierarchy;

import java.util.Objects;

/**
 * Section produced by generic hierarchy inference: a nesting depth without Chapter/Section/Article terminology.
 *
 * @param level      0 for top-level divisions, 1 for mid-level, 2 or more for leaves
 * @param number     label as printed ({@code "1"}, {@code "IV"}, {@code "b"}), may be empty
 * @param title      text following the label on the same line
 * @param content    body lines up to the next section
 * @param numberType detected numbering style
 */
public record LeveledSection(int level, String number, String title, String content, NumberType numberType) {

    public LeveledSection {
        if (level < 0) {
            throw new IllegalArgumentException("level must be zero or greater");
        }
        number = Objects.requireNonNullElse(number, "");
        title = Objects.requireNonNullElse(title, "");
        content = Objects.requireNonNullElse(content, "");
        numberType = Objects.requireNonNullElse(numberType, NumberType.UNKNOWN);
    }

    public LeveledSection(int level, String number, String title, String content) {
        this(level, number, title, content, NumberType.UNKNOWN);
    }
}
