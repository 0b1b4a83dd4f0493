package ai.regula.ingest.parse;

import ai.regula.ingest.model.DocumentType;
import java.util.Objects;

/**
 * Metadata taken from the opening lines before structural parsing starts.
 */
public record DocumentHeader(String title, DocumentType type, String identifier) {

    public DocumentHeader {
        title = Objects.requireNonNullElse(title, "");
        type = Objects.requireNonNullElse(type, DocumentType.UNKNOWN);
        identifier = Objects.requireNonNullElse(identifier, "");
    }
}
