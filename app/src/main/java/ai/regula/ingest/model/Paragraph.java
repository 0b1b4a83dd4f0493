package ai.regula.ingest.model;

import java.util.List;
import java.util.Objects;

/**
 * Numbered paragraph of an article.
 */
public record Paragraph(int number, String text, List<Point> points) {

    public Paragraph {
        text = Objects.requireNonNullElse(text, "");
        points = points == null ? List.of() : List.copyOf(points);
    }
}
