package ai.regula.ingest.model;

import java.util.Objects;

/**
 * Numbered preambular clause of an EU-style instrument.
 */
public record Recital(int number, String text) {

    public Recital {
        text = Objects.requireNonNullElse(text, "");
    }
}
