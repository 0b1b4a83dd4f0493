package ai.regula.ingest.model;

import java.util.List;
import java.util.Objects;

/**
 * Intermediate container between a chapter and its articles.
 */
public record Section(int number, String title, List<Article> articles) {

    public Section {
        title = Objects.requireNonNullElse(title, "");
        articles = articles == null ? List.of() : List.copyOf(articles);
    }
}
