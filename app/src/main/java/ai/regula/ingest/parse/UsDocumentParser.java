package ai.regula.ingest.parse;

import ai.regula.ingest.definition.DefinitionExtractor;
import ai.regula.ingest.definition.UsDefinitionExtractor;
import ai.regula.ingest.model.ArticleBuilder;
import ai.regula.ingest.model.Document;
import ai.regula.ingest.model.DocumentFormat;
import ai.regula.ingest.pattern.MatchGroups;
import ai.regula.ingest.pattern.ParserConfig;
import ai.regula.ingest.pattern.UsSectionDialect;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * Parses US state codes. Each code section becomes an article; "Article" headers only group sections and are
 * skipped.
 */
public class UsDocumentParser implements StructuralParser {

    private final DefinitionExtractor definitions;

    public UsDocumentParser() {
        this(new UsDefinitionExtractor());
    }

    public UsDocumentParser(DefinitionExtractor definitions) {
        this.definitions = definitions;
    }

    @Override
    public DocumentFormat format() {
        return DocumentFormat.US;
    }

    @Override
    public Document parse(DocumentHeader header, List<String> lines, ParserConfig config) {
        TreeAssembler tree = new TreeAssembler();
        ArticleBuilder awaitingTitle = null;

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).strip();

            Matcher chapter = config.usChapter().matcher(line);
            if (chapter.find()) {
                tree.startChapter(MatchGroups.group(chapter, 1), Lines.lookaheadTitle(lines, i));
                awaitingTitle = null;
                continue;
            }

            if (config.usArticle().matcher(line).find()) {
                tree.flushArticle();
                awaitingTitle = null;
                continue;
            }

            ArticleBuilder section = startSection(line, config, tree);
            if (section != null) {
                awaitingTitle = section;
                continue;
            }

            if (awaitingTitle != null && !line.isEmpty()) {
                awaitingTitle.title(line);
                awaitingTitle = null;
                continue;
            }

            ArticleBuilder current = tree.article();
            if (current != null && !line.isEmpty() && !line.equals(current.title())) {
                current.appendLine(line);
            }
        }

        Document document = new Document(header.title(), header.type(), header.identifier(),
                Optional.empty(), tree.finish(), List.of());
        return document.withDefinitions(definitions.extract(document, config));
    }

    /**
     * Tries the section dialects in order and opens an article for the first that matches.
     */
    private static ArticleBuilder startSection(String line, ParserConfig config, TreeAssembler tree) {
        for (UsSectionDialect dialect : UsSectionDialect.values()) {
            Matcher matcher = config.usSection(dialect).matcher(line);
            if (!matcher.find()) {
                continue;
            }
            ArticleBuilder article = tree.startArticle(MatchGroups.intGroup(matcher, dialect.numberGroup()), "");
            if (dialect.synthesizesChapter()) {
                tree.ensureChapter();
            }
            return article;
        }
        return null;
    }
}
