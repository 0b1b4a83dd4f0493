package ai.regula.ingest.parse;

import ai.regula.ingest.model.ArticleBuilder;
import ai.regula.ingest.model.Chapter;
import ai.regula.ingest.model.ChapterBuilder;
import ai.regula.ingest.model.SectionBuilder;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the open chapter, section and article while a parser walks the lines. An article is attached to its
 * container when the next marker arrives or the input ends.
 */
final class TreeAssembler {

    static final String DEFAULT_CHAPTER = "1";

    private static final Logger LOGGER = LoggerFactory.getLogger(TreeAssembler.class);

    private final List<ChapterBuilder> chapters = new ArrayList<>();
    private ChapterBuilder chapter;
    private SectionBuilder section;
    private ArticleBuilder article;

    void startChapter(String number, String title) {
        flushArticle();
        chapter = new ChapterBuilder(number, title);
        chapters.add(chapter);
        section = null;
    }

    void startSection(int number, String title) {
        flushArticle();
        ensureChapter();
        section = new SectionBuilder(number, title);
        chapter.addSection(section);
    }

    ArticleBuilder startArticle(int number, String title) {
        flushArticle();
        article = new ArticleBuilder(number, title);
        return article;
    }

    /**
     * Opens the default chapter when no chapter has been seen yet.
     */
    void ensureChapter() {
        if (chapter == null) {
            LOGGER.debug("No chapter open; synthesizing chapter {}", DEFAULT_CHAPTER);
            chapter = new ChapterBuilder(DEFAULT_CHAPTER, "");
            chapters.add(chapter);
        }
    }

    void flushArticle() {
        if (article == null) {
            return;
        }
        ensureChapter();
        if (section != null) {
            section.addArticle(article.build());
        } else {
            chapter.addArticle(article.build());
        }
        article = null;
    }

    ArticleBuilder article() {
        return article;
    }

    List<Chapter> finish() {
        flushArticle();
        return ChapterBuilder.buildAll(chapters);
    }
}
