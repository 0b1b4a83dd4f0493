package ai.regula.ingest.model;

import java.util.List;
import java.util.Objects;

/**
 * Top-level division of a document. UK Parts map to chapters, and UK Schedules to chapters numbered {@code S<n>}.
 *
 * <p>Articles held directly by the chapter and articles held by its sections never overlap.</p>
 */
public record Chapter(String number, String title, List<Section> sections, List<Article> articles) {

    public Chapter {
        number = Objects.requireNonNullElse(number, "");
        title = Objects.requireNonNullElse(title, "");
        sections = sections == null ? List.of() : List.copyOf(sections);
        articles = articles == null ? List.of() : List.copyOf(articles);
    }
}
