package ai.regula.ingest.parse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import ai.regula.ingest.model.Article;
import ai.regula.ingest.model.Chapter;
import ai.regula.ingest.model.Document;
import ai.regula.ingest.model.DocumentFormat;
import ai.regula.ingest.model.DocumentType;
import ai.regula.ingest.pattern.FormatMatch;
import ai.regula.ingest.pattern.StubPatternBridge;
import ai.regula.ingest.pattern.StubPatternRegistry;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DocumentParserTest {

    private static final String GDPR_EXCERPT = String.join("\n",
            "REGULATION (EU) 2016/679 OF THE EUROPEAN PARLIAMENT AND OF THE COUNCIL",
            "HAVE ADOPTED THIS REGULATION:",
            "CHAPTER I",
            "GENERAL PROVISIONS",
            "Article 1",
            "Subject-matter",
            "",
            "1.   This lays down rules.");

    private final DocumentParser parser = new DocumentParser();

    @TempDir
    Path tempDir;

    @Test
    void parsesEuFileWithHeaderFields() throws IOException {
        Path input = tempDir.resolve("gdpr.txt");
        Files.writeString(input, GDPR_EXCERPT, StandardCharsets.UTF_8);

        Document document = parser.parse(input);

        assertThat(document.title())
                .isEqualTo("REGULATION (EU) 2016/679 OF THE EUROPEAN PARLIAMENT AND OF THE COUNCIL");
        assertThat(document.type()).isEqualTo(DocumentType.REGULATION);
        assertThat(document.identifier()).isEqualTo("(EU) 2016/679");
        assertThat(document.chapters()).extracting(Chapter::number).containsExactly("I");
        assertThat(document.article(1)).map(Article::title).contains("Subject-matter");
    }

    @Test
    void missingFileIsReportedAsParseFailure() {
        Path missing = tempDir.resolve("absent.txt");

        assertThatThrownBy(() -> parser.parse(missing))
                .isInstanceOf(DocumentParseException.class)
                .hasMessageContaining("absent.txt")
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void readerAndStreamInputsAgree() {
        Document fromReader = parser.parse(new StringReader(GDPR_EXCERPT));
        Document fromStream = parser.parse(new ByteArrayInputStream(GDPR_EXCERPT.getBytes(StandardCharsets.UTF_8)));

        assertThat(fromStream).isEqualTo(fromReader);
    }

    @Test
    void unrecognisedTextFallsBackToGenericInference() {
        List<String> lines = List.of(
                "COMMUNITY GARDEN RULES",
                "",
                "1. Eligibility",
                "Residents may apply.",
                "2. Fees",
                "Fees are due in March.");

        ParseResult result = parser.parseDetailed(lines);

        assertThat(result.format()).isEqualTo(DocumentFormat.GENERIC);
        assertThat(result.document().title()).isEqualTo("COMMUNITY GARDEN RULES");
        assertThat(result.document().chapters()).extracting(Chapter::title).contains("Eligibility", "Fees");
        assertThat(result.document().allArticles()).extracting(Article::text).contains("Residents may apply.");
    }

    @Test
    void forcedFormatSkipsDetection() {
        List<String> lines = List.of("Section 1798.100", "General duties", "A business shall inform consumers.");

        ParseResult result = parser.parseAs(lines, DocumentFormat.US);

        assertThat(result.format()).isEqualTo(DocumentFormat.US);
        assertThat(result.document().identifier()).isEqualTo("Cal. Civ. Code § 1798");
        assertThat(result.document().allArticles()).extracting(Article::number).containsExactly(100);
    }

    @Test
    void unknownFormatCannotBeForced() {
        assertThatThrownBy(() -> parser.parseAs(List.of("text"), DocumentFormat.UNKNOWN))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void registryBridgeDrivesUsParsing() {
        StubPatternBridge bridge = new StubPatternBridge("US-CO")
                .level("section", "^§\\s*(\\d+)-(\\d+)-(\\d+)$");
        StubPatternRegistry registry = new StubPatternRegistry(
                List.of(new FormatMatch("us-co-cpa", 0.9, Optional.of(bridge))));
        DocumentParser bridged = new DocumentParser(registry);

        ParseResult result = bridged.parseDetailed(List.of(
                "Colorado Privacy Act",
                "§ 6-1-1304",
                "Applicability"));

        assertThat(result.format()).isEqualTo(DocumentFormat.US);
        assertThat(result.document().identifier()).isEqualTo("C.R.S. § 6-1-1304");
        assertThat(result.document().allArticles())
                .extracting(Article::number, Article::title)
                .containsExactly(tuple(1304, "Applicability"));
    }

    @Test
    void emptyInputYieldsEmptyDocument() {
        Document document = parser.parse(List.of());

        assertThat(document.title()).isEmpty();
        assertThat(document.chapters()).isEmpty();
    }
}
