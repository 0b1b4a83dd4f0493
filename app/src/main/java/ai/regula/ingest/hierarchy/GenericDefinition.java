package ai.regula.ingest.hierarchy;

import java.util.Objects;

/**
 * Defined term found by generic inference, with the text that follows the defining phrase.
 */
public record GenericDefinition(String term, String definition) {

    public GenericDefinition {
        term = Objects.requireNonNull(term, "term");
        definition = Objects.requireNonNullElse(definition, "");
    }
}
