package ai.regula.ingest.parse;

import ai.regula.ingest.hierarchy.GenericDocument;
import ai.regula.ingest.hierarchy.GenericHierarchyParser;
import ai.regula.ingest.hierarchy.HierarchyConverter;
import ai.regula.ingest.model.Document;
import ai.regula.ingest.model.DocumentFormat;
import ai.regula.ingest.pattern.ParserConfig;
import java.util.List;
import java.util.Optional;

/**
 * Fallback for text that matches no known format. Levels come from the generic hierarchy parser and are mapped
 * onto chapters, sections and articles by the {@link HierarchyConverter}.
 */
public class GenericDocumentParser implements StructuralParser {

    private final GenericHierarchyParser hierarchyParser;
    private final HierarchyConverter converter;

    public GenericDocumentParser(GenericHierarchyParser hierarchyParser, HierarchyConverter converter) {
        this.hierarchyParser = hierarchyParser;
        this.converter = converter;
    }

    @Override
    public DocumentFormat format() {
        return DocumentFormat.GENERIC;
    }

    @Override
    public Document parse(DocumentHeader header, List<String> lines, ParserConfig config) {
        GenericDocument generic = hierarchyParser.parse(String.join("\n", lines));
        Document converted = converter.convert(generic);
        String title = generic != null && !generic.title().isEmpty() ? generic.title() : header.title();
        return new Document(title, header.type(), header.identifier(), Optional.empty(),
                converted.chapters(), converted.definitions());
    }
}
