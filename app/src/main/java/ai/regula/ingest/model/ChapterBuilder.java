package ai.regula.ingest.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Chapter under construction. Sections stay open until the chapter is built, so articles can still be added to them.
 */
public final class ChapterBuilder {

    private final String number;
    private final String title;
    private final List<SectionBuilder> sections = new ArrayList<>();
    private final List<Article> articles = new ArrayList<>();

    public ChapterBuilder(String number, String title) {
        this.number = number;
        this.title = title;
    }

    public String number() {
        return number;
    }

    public ChapterBuilder addSection(SectionBuilder section) {
        sections.add(section);
        return this;
    }

    public ChapterBuilder addArticle(Article article) {
        articles.add(article);
        return this;
    }

    public int sectionCount() {
        return sections.size();
    }

    public Chapter build() {
        List<Section> builtSections = new ArrayList<>(sections.size());
        for (SectionBuilder section : sections) {
            builtSections.add(section.build());
        }
        return new Chapter(number, title, builtSections, articles);
    }

    public static List<Chapter> buildAll(List<ChapterBuilder> chapters) {
        List<Chapter> built = new ArrayList<>(chapters.size());
        for (ChapterBuilder chapter : chapters) {
            built.add(chapter.build());
        }
        return built;
    }
}
