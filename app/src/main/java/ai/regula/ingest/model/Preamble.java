package ai.regula.ingest.model;

import java.util.List;

/**
 * Preamble block preceding the enacting terms: citations followed by recitals.
 */
public record Preamble(List<String> citations, List<Recital> recitals) {

    public Preamble {
        citations = citations == null ? List.of() : List.copyOf(citations);
        recitals = recitals == null ? List.of() : List.copyOf(recitals);
    }

    public static Preamble ofRecitals(List<Recital> recitals) {
        return new Preamble(List.of(), recitals);
    }
}
