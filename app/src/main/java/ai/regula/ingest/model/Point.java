package ai.regula.ingest.model;

import java.util.Objects;

/**
 * Lettered point inside a paragraph, e.g. {@code (a)}.
 */
public record Point(String letter, String text) {

    public Point {
        letter = Objects.requireNonNullElse(letter, "");
        text = Objects.requireNonNullElse(text, "");
    }
}
