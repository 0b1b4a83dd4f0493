package ai.regula.ingest.parse;

import ai.regula.ingest.model.Document;
import ai.regula.ingest.model.DocumentFormat;
import ai.regula.ingest.pattern.ParserConfig;
import java.util.List;

/**
 * Turns the flat line sequence of one document format into a document tree.
 */
public interface StructuralParser {

    DocumentFormat format();

    Document parse(DocumentHeader header, List<String> lines, ParserConfig config);
}
