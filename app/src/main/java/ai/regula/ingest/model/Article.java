package ai.regula.ingest.model;

import java.util.List;
import java.util.Objects;

/**
 * Leaf provision of the document tree. US sections and UK sections are modelled as articles too.
 *
 * @param number    ordinal of the article within the source numbering
 * @param title     heading text, empty when the source has none
 * @param text      body text with structural lines removed, may be empty
 * @param paragraphs paragraph breakdown, empty unless a caller populated it
 * @param sectionId raw label from generic hierarchy inference, empty for format-specific parsers
 */
public record Article(int number, String title, String text, List<Paragraph> paragraphs, String sectionId) {

    public Article {
        title = Objects.requireNonNullElse(title, "");
        text = Objects.requireNonNullElse(text, "");
        paragraphs = paragraphs == null ? List.of() : List.copyOf(paragraphs);
        sectionId = Objects.requireNonNullElse(sectionId, "");
    }

    public Article(int number, String title, String text) {
        this(number, title, text, List.of(), "");
    }
}
