package ai.regula.ingest.model;

/**
 * Element counts of a parsed document, used to judge parse quality.
 */
public record Statistics(int chapters, int sections, int articles, int definitions, int recitals) {
}
