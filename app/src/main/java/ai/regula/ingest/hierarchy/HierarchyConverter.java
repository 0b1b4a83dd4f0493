package ai.regula.ingest.hierarchy;

import ai.regula.ingest.model.Article;
import ai.regula.ingest.model.ArticleBuilder;
import ai.regula.ingest.model.ChapterBuilder;
import ai.regula.ingest.model.Definition;
import ai.regula.ingest.model.Document;
import ai.regula.ingest.model.DocumentType;
import ai.regula.ingest.model.SectionBuilder;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps a flat list of leveled sections onto the Chapter, Section, Article tree.
 *
 * <ul>
 *   <li>level 0 starts a chapter; its body, if any, becomes the chapter's article 1</li>
 *   <li>level 1 starts a section in the current chapter</li>
 *   <li>level 2 and deeper become articles of the current section, else of the current chapter</li>
 * </ul>
 * Missing parents are synthesized, so no entry is dropped.
 */
public class HierarchyConverter {

    private static final Logger LOGGER = LoggerFactory.getLogger(HierarchyConverter.class);

    public Document convert(GenericDocument genericDocument) {
        if (genericDocument == null) {
            return Document.empty();
        }
        Document converted = convert(genericDocument.sections(), genericDocument.definitions());
        return converted.withTitle(genericDocument.title());
    }

    public Document convert(List<LeveledSection> sections, List<GenericDefinition> genericDefinitions) {
        List<Definition> definitions = convertDefinitions(genericDefinitions);
        if (sections == null || sections.isEmpty()) {
            return new Document("", DocumentType.UNKNOWN, "", Optional.empty(), List.of(), definitions);
        }

        List<ChapterBuilder> chapters = new ArrayList<>();
        ChapterBuilder currentChapter = null;
        SectionBuilder currentSection = null;
        int chapterIndex = 0;
        int sectionIndex = 0;
        int articleIndex = 0;

        for (LeveledSection section : sections) {
            if (section.level() == 0) {
                chapterIndex++;
                sectionIndex = 0;
                articleIndex = 0;
                currentChapter = chapterFrom(section, chapterIndex);
                currentSection = null;
                chapters.add(currentChapter);
            } else if (section.level() == 1) {
                if (currentChapter == null) {
                    chapterIndex++;
                    currentChapter = new ChapterBuilder(String.valueOf(chapterIndex), "");
                    chapters.add(currentChapter);
                    LOGGER.debug("Synthesized chapter {} for section '{}'", chapterIndex, section.number());
                }
                sectionIndex++;
                articleIndex = 0;
                currentSection = new SectionBuilder(
                        NumberingConverter.toOrdinal(section.number(), sectionIndex), section.title());
                currentChapter.addSection(currentSection);
            } else {
                articleIndex++;
                Article article = articleFrom(section, articleIndex);
                if (currentSection != null) {
                    currentSection.addArticle(article);
                } else if (currentChapter != null) {
                    currentChapter.addArticle(article);
                } else {
                    chapterIndex++;
                    currentChapter = new ChapterBuilder(String.valueOf(chapterIndex), "");
                    currentChapter.addArticle(article);
                    chapters.add(currentChapter);
                    LOGGER.debug("Synthesized chapter {} for article '{}'", chapterIndex, section.number());
                }
            }
        }

        if (chapters.isEmpty()) {
            ChapterBuilder implicitChapter = new ChapterBuilder("1", "");
            for (int i = 0; i < sections.size(); i++) {
                implicitChapter.addArticle(articleFrom(sections.get(i), i + 1));
            }
            chapters.add(implicitChapter);
        }

        return new Document("", DocumentType.UNKNOWN, "", Optional.empty(), ChapterBuilder.buildAll(chapters),
                definitions);
    }

    private static ChapterBuilder chapterFrom(LeveledSection section, int chapterIndex) {
        String number = section.number().isEmpty() ? String.valueOf(chapterIndex) : section.number();
        ChapterBuilder chapter = new ChapterBuilder(number, section.title());
        if (!section.content().isEmpty()) {
            chapter.addArticle(new Article(1, section.title(), section.content()));
        }
        return chapter;
    }

    private static Article articleFrom(LeveledSection section, int articleIndex) {
        return new ArticleBuilder(NumberingConverter.toOrdinal(section.number(), articleIndex), section.title())
                .sectionId(section.number())
                .text(section.content())
                .build();
    }

    private static List<Definition> convertDefinitions(List<GenericDefinition> genericDefinitions) {
        if (genericDefinitions == null || genericDefinitions.isEmpty()) {
            return List.of();
        }
        List<Definition> definitions = new ArrayList<>(genericDefinitions.size());
        for (int i = 0; i < genericDefinitions.size(); i++) {
            GenericDefinition definition = genericDefinitions.get(i);
            definitions.add(new Definition(i + 1, definition.term(), definition.definition()));
        }
        return definitions;
    }
}
