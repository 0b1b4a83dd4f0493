package ai.regula.ingest.model;

import java.util.Objects;

/**
 * Defined term extracted from a definitions provision.
 */
public record Definition(int number, String term, String text) {

    public Definition {
        term = Objects.requireNonNull(term, "term");
        text = Objects.requireNonNullElse(text, "");
    }

    public Definition(int number, String term) {
        this(number, term, "");
    }
}
