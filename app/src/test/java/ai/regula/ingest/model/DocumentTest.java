package ai.regula.ingest.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class DocumentTest {

    private final Document document = new Document(
            "Sample Regulation",
            DocumentType.REGULATION,
            "(EU) 1/2024",
            Optional.of(Preamble.ofRecitals(List.of(new Recital(1, "First."), new Recital(2, "Second.")))),
            List.of(
                    new Chapter("I", "General", List.of(), List.of(new Article(1, "Scope", ""))),
                    new Chapter("II", "Duties",
                            List.of(new Section(1, "Controllers", List.of(
                                    new Article(3, "Responsibility", ""),
                                    new Article(4, "Second article four", "")))),
                            List.of(new Article(2, "Principles", "")))),
            List.of(new Definition(1, "data")));

    @Test
    void statisticsCountEveryLevel() {
        assertThat(document.statistics()).isEqualTo(new Statistics(2, 1, 4, 1, 2));
        assertThat(Document.empty().statistics()).isEqualTo(new Statistics(0, 0, 0, 0, 0));
    }

    @Test
    void allArticlesListsChapterArticlesBeforeSectionArticles() {
        assertThat(document.allArticles()).extracting(Article::number).containsExactly(1, 2, 3, 4);
    }

    @Test
    void lookupsReturnFirstMatch() {
        assertThat(document.article(2)).map(Article::title).contains("Principles");
        assertThat(document.article(4)).map(Article::title).contains("Second article four");
        assertThat(document.article(99)).isEmpty();
        assertThat(document.chapter("II")).map(Chapter::title).contains("Duties");
        assertThat(document.chapter("III")).isEmpty();
    }

    @Test
    void nullComponentsAreNormalised() {
        Document normalised = new Document(null, null, null, null, null, null);

        assertThat(normalised).isEqualTo(Document.empty());
    }

    @Test
    void builderJoinsBodyLines() {
        Article article = new ArticleBuilder(5, "Title")
                .appendLine("first")
                .appendLine("second  ")
                .build();

        assertThat(article.text()).isEqualTo("first\nsecond");
        assertThat(article.paragraphs()).isEmpty();
    }
}
