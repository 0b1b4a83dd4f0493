package ai.regula.ingest.definition;

import ai.regula.ingest.model.Definition;
import ai.regula.ingest.model.Document;
import ai.regula.ingest.pattern.ParserConfig;
import java.util.List;

/**
 * Locates the definitions provision of a parsed document and reads the defined terms from its body.
 */
@FunctionalInterface
public interface DefinitionExtractor {

    /**
     * Returns the defined terms, or an empty list when no definitions provision is found or it has no body.
     */
    List<Definition> extract(Document document, ParserConfig config);
}
