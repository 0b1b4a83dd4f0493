package ai.regula.ingest.hierarchy;

/**
 * Infers structural levels from whitespace and numbering when a document follows no known format.
 */
@FunctionalInterface
public interface GenericHierarchyParser {

    GenericDocument parse(String text);
}
