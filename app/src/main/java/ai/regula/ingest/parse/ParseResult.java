package ai.regula.ingest.parse;

import ai.regula.ingest.model.Document;
import ai.regula.ingest.model.DocumentFormat;
import java.util.Objects;

/**
 * Parsed document together with the format that was used to read it.
 */
public record ParseResult(Document document, DocumentFormat format) {

    public ParseResult {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(format, "format");
    }
}
