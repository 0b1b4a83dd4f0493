package ai.regula.ingest.definition;

import static org.assertj.core.api.Assertions.assertThat;

import ai.regula.ingest.model.Article;
import ai.regula.ingest.model.Chapter;
import ai.regula.ingest.model.Definition;
import ai.regula.ingest.model.Document;
import ai.regula.ingest.model.DocumentFormat;
import ai.regula.ingest.model.DocumentType;
import ai.regula.ingest.pattern.DefinitionLocation;
import ai.regula.ingest.pattern.ParserConfig;
import ai.regula.ingest.pattern.StubPatternBridge;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class UkDefinitionExtractorTest {

    private static final String BODY = String.join("\n",
            "In these Regulations—",
            "“the Act” means the Data Protection Act 2018;",
            "(2) “controller” has the same meaning as in the UK GDPR;");

    private final UkDefinitionExtractor extractor = new UkDefinitionExtractor();

    @Test
    void interpretationTitleIsFoundByDefault() {
        Document document = document(new Article(1, "Citation", "Text."), new Article(2, "Interpretation", BODY));

        assertThat(extractor.extract(document, ParserConfig.defaults())).containsExactly(
                new Definition(1, "the Act", "the Data Protection Act 2018;"),
                new Definition(2, "controller", "as in the UK GDPR;"));
    }

    @Test
    void bridgeNumberAndTitleHints() {
        StubPatternBridge bridge = new StubPatternBridge("GB")
                .location(DefinitionLocation.ofSection(7))
                .location(DefinitionLocation.ofTitle("(?i)meaning of terms"));
        ParserConfig config = ParserConfig.forFormat(DocumentFormat.UK, Optional.of(bridge));

        assertThat(extractor.extract(document(new Article(7, "Misc", BODY)), config)).hasSize(2);
        assertThat(extractor.extract(document(new Article(3, "Meaning of terms", BODY)), config)).hasSize(2);
        assertThat(extractor.extract(document(new Article(3, "Interpretation", BODY)), config)).isEmpty();
    }

    @Test
    void invalidTitleHintIsSkipped() {
        StubPatternBridge bridge = new StubPatternBridge("GB").location(DefinitionLocation.ofTitle("(unclosed"));
        ParserConfig config = ParserConfig.forFormat(DocumentFormat.UK, Optional.of(bridge));

        assertThat(extractor.extract(document(new Article(2, "Interpretation", BODY)), config)).hasSize(2);
    }

    @Test
    void emptyBodyYieldsNothing() {
        assertThat(extractor.extract(document(new Article(2, "Interpretation", "")), ParserConfig.defaults()))
                .isEmpty();
    }

    private static Document document(Article... articles) {
        Chapter chapter = new Chapter("1", "", List.of(), List.of(articles));
        return new Document("", DocumentType.ACT, "", Optional.empty(), List.of(chapter), List.of());
    }
}
