package ai.regula.ingest.output;

import ai.regula.ingest.model.Article;
import ai.regula.ingest.model.Chapter;
import ai.regula.ingest.model.Definition;
import ai.regula.ingest.model.Document;
import ai.regula.ingest.model.Paragraph;
import ai.regula.ingest.model.Point;
import ai.regula.ingest.model.Preamble;
import ai.regula.ingest.model.Recital;
import ai.regula.ingest.model.Section;
import ai.regula.ingest.model.Statistics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;

/**
 * Renders a {@link Document} as JSON. Empty optional parts (preamble without recitals, definitions, citations,
 * chapter sections or articles, article text and paragraphs) are left out.
 */
public class DocumentJsonWriter {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final boolean pretty;

    public DocumentJsonWriter() {
        this(false);
    }

    public DocumentJsonWriter(boolean pretty) {
        this.pretty = pretty;
    }

    public String write(Document document) {
        return render(toTree(document));
    }

    public void write(Document document, Writer out) throws IOException {
        out.write(write(document));
        out.write(System.lineSeparator());
        out.flush();
    }

    public String write(Statistics statistics) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("chapters", statistics.chapters());
        node.put("sections", statistics.sections());
        node.put("articles", statistics.articles());
        node.put("definitions", statistics.definitions());
        node.put("recitals", statistics.recitals());
        return render(node);
    }

    public ObjectNode toTree(Document document) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("title", document.title());
        root.put("type", document.type().label());
        root.put("identifier", document.identifier());
        document.preamble()
                .filter(preamble -> !preamble.recitals().isEmpty())
                .ifPresent(preamble -> root.set("preamble", preamble(preamble)));
        ArrayNode chapters = root.putArray("chapters");
        for (Chapter chapter : document.chapters()) {
            chapters.add(chapter(chapter));
        }
        if (!document.definitions().isEmpty()) {
            ArrayNode definitions = root.putArray("definitions");
            for (Definition definition : document.definitions()) {
                ObjectNode node = definitions.addObject();
                node.put("number", definition.number());
                node.put("term", definition.term());
                if (!definition.text().isEmpty()) {
                    node.put("text", definition.text());
                }
            }
        }
        return root;
    }

    private static ObjectNode preamble(Preamble preamble) {
        ObjectNode node = MAPPER.createObjectNode();
        if (!preamble.citations().isEmpty()) {
            ArrayNode citations = node.putArray("citations");
            preamble.citations().forEach(citations::add);
        }
        ArrayNode recitals = node.putArray("recitals");
        for (Recital recital : preamble.recitals()) {
            ObjectNode entry = recitals.addObject();
            entry.put("number", recital.number());
            entry.put("text", recital.text());
        }
        return node;
    }

    private static ObjectNode chapter(Chapter chapter) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("number", chapter.number());
        node.put("title", chapter.title());
        if (!chapter.sections().isEmpty()) {
            ArrayNode sections = node.putArray("sections");
            for (Section section : chapter.sections()) {
                ObjectNode entry = sections.addObject();
                entry.put("number", section.number());
                entry.put("title", section.title());
                ArrayNode articles = entry.putArray("articles");
                section.articles().forEach(article -> articles.add(article(article)));
            }
        }
        if (!chapter.articles().isEmpty()) {
            ArrayNode articles = node.putArray("articles");
            chapter.articles().forEach(article -> articles.add(article(article)));
        }
        return node;
    }

    private static ObjectNode article(Article article) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("number", article.number());
        node.put("title", article.title());
        if (!article.paragraphs().isEmpty()) {
            ArrayNode paragraphs = node.putArray("paragraphs");
            for (Paragraph paragraph : article.paragraphs()) {
                ObjectNode entry = paragraphs.addObject();
                entry.put("number", paragraph.number());
                entry.put("text", paragraph.text());
                if (!paragraph.points().isEmpty()) {
                    ArrayNode points = entry.putArray("points");
                    for (Point point : paragraph.points()) {
                        ObjectNode pointNode = points.addObject();
                        pointNode.put("letter", point.letter());
                        pointNode.put("text", point.text());
                    }
                }
            }
        }
        if (!article.text().isEmpty()) {
            node.put("text", article.text());
        }
        return node;
    }

    private String render(ObjectNode node) {
        try {
            return pretty
                    ? MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(node)
                    : MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
