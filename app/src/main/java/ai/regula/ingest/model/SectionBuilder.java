package ai.regula.ingest.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Section under construction.
 */
public final class SectionBuilder {

    private final int number;
    private final String title;
    private final List<Article> articles = new ArrayList<>();

    public SectionBuilder(int number, String title) {
        this.number = number;
        this.title = title;
    }

    public SectionBuilder addArticle(Article article) {
        articles.add(article);
        return this;
    }

    public Section build() {
        return new Section(number, title, articles);
    }
}
