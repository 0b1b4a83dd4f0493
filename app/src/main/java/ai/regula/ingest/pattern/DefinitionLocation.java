package ai.regula.ingest.pattern;

import java.util.Objects;

/**
 * Hint telling where a jurisdiction keeps its definitions provision.
 *
 * @param sectionNumber     leaf number of the provision, 0 when unknown
 * @param sectionTitleRegex regular expression matched against provision titles, empty when unknown
 */
public record DefinitionLocation(int sectionNumber, String sectionTitleRegex) {

    public DefinitionLocation {
        sectionTitleRegex = Objects.requireNonNullElse(sectionTitleRegex, "");
    }

    public static DefinitionLocation ofSection(int sectionNumber) {
        return new DefinitionLocation(sectionNumber, "");
    }

    public static DefinitionLocation ofTitle(String sectionTitleRegex) {
        return new DefinitionLocation(0, sectionTitleRegex);
    }
}
