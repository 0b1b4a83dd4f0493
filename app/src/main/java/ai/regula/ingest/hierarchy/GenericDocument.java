package ai.regula.ingest.hierarchy;

import java.util.List;
import java.util.Objects;

/**
 * Result of generic hierarchy inference.
 *
 * @param title       detected title, empty when none was found
 * @param sections    leveled sections in document order
 * @param definitions definitions detected anywhere in the text
 * @param warnings    notes about structure that could not be inferred
 */
public record GenericDocument(String title, List<LeveledSection> sections, List<GenericDefinition> definitions,
                              List<String> warnings) {

    public GenericDocument {
        title = Objects.requireNonNullElse(title, "");
        sections = sections == null ? List.of() : List.copyOf(sections);
        definitions = definitions == null ? List.of() : List.copyOf(definitions);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public GenericDocument(String title, List<LeveledSection> sections) {
        this(title, sections, List.of(), List.of());
    }
}
