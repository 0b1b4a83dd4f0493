package ai.regula.ingest.model;

/**
 * Article under construction. Body lines are joined with newlines and trimmed when the article is built.
 */
public final class ArticleBuilder {

    private final int number;
    private String title;
    private String sectionId = "";
    private final StringBuilder text = new StringBuilder();

    public ArticleBuilder(int number, String title) {
        this.number = number;
        this.title = title == null ? "" : title;
    }

    public int number() {
        return number;
    }

    public String title() {
        return title;
    }

    public ArticleBuilder title(String value) {
        this.title = value == null ? "" : value;
        return this;
    }

    public ArticleBuilder sectionId(String value) {
        this.sectionId = value == null ? "" : value;
        return this;
    }

    public ArticleBuilder appendLine(String line) {
        if (text.length() > 0) {
            text.append('\n');
        }
        text.append(line);
        return this;
    }

    public ArticleBuilder text(String value) {
        text.setLength(0);
        if (value != null) {
            text.append(value);
        }
        return this;
    }

    public Article build() {
        return new Article(number, title, text.toString().trim(), null, sectionId);
    }
}
