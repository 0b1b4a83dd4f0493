package ai.regula.ingest.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Root of the parsed document tree. Instances are immutable; every parse produces a fresh tree.
 */
public record Document(
        String title,
        DocumentType type,
        String identifier,
        Optional<Preamble> preamble,
        List<Chapter> chapters,
        List<Definition> definitions
) {

    public Document {
        title = Objects.requireNonNullElse(title, "");
        type = Objects.requireNonNullElse(type, DocumentType.UNKNOWN);
        identifier = Objects.requireNonNullElse(identifier, "");
        preamble = preamble == null ? Optional.empty() : preamble;
        chapters = chapters == null ? List.of() : List.copyOf(chapters);
        definitions = definitions == null ? List.of() : List.copyOf(definitions);
    }

    public static Document empty() {
        return new Document("", DocumentType.UNKNOWN, "", Optional.empty(), List.of(), List.of());
    }

    public Document withTitle(String newTitle) {
        return new Document(newTitle, type, identifier, preamble, chapters, definitions);
    }

    public Document withDefinitions(List<Definition> newDefinitions) {
        return new Document(title, type, identifier, preamble, chapters, newDefinitions);
    }

    /**
     * Counts every element of the tree. Articles are counted both at chapter level and inside sections.
     */
    public Statistics statistics() {
        int sections = 0;
        int articles = 0;
        for (Chapter chapter : chapters) {
            sections += chapter.sections().size();
            articles += chapter.articles().size();
            for (Section section : chapter.sections()) {
                articles += section.articles().size();
            }
        }
        int recitals = preamble.map(value -> value.recitals().size()).orElse(0);
        return new Statistics(chapters.size(), sections, articles, definitions.size(), recitals);
    }

    /**
     * Returns the first article with the given number in document order, chapter-level articles first.
     */
    public Optional<Article> article(int number) {
        for (Chapter chapter : chapters) {
            for (Article article : chapter.articles()) {
                if (article.number() == number) {
                    return Optional.of(article);
                }
            }
            for (Section section : chapter.sections()) {
                for (Article article : section.articles()) {
                    if (article.number() == number) {
                        return Optional.of(article);
                    }
                }
            }
        }
        return Optional.empty();
    }

    public Optional<Chapter> chapter(String number) {
        return chapters.stream()
                .filter(chapter -> chapter.number().equals(number))
                .findFirst();
    }

    /**
     * Flattens the tree: for each chapter its own articles, then the articles of each of its sections.
     */
    public List<Article> allArticles() {
        List<Article> articles = new ArrayList<>();
        for (Chapter chapter : chapters) {
            articles.addAll(chapter.articles());
            for (Section section : chapter.sections()) {
                articles.addAll(section.articles());
            }
        }
        return Collections.unmodifiableList(articles);
    }
}
