package ai.regula.ingest.parse;

import ai.regula.ingest.detect.DocumentTypeDetector;
import ai.regula.ingest.detect.FormatDetection;
import ai.regula.ingest.detect.FormatDetector;
import ai.regula.ingest.detect.IdentifierExtractor;
import ai.regula.ingest.hierarchy.DefaultGenericHierarchyParser;
import ai.regula.ingest.hierarchy.GenericHierarchyParser;
import ai.regula.ingest.hierarchy.HierarchyConverter;
import ai.regula.ingest.model.Document;
import ai.regula.ingest.model.DocumentFormat;
import ai.regula.ingest.model.DocumentType;
import ai.regula.ingest.pattern.ParserConfig;
import ai.regula.ingest.pattern.PatternBridge;
import ai.regula.ingest.pattern.PatternRegistry;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point: reads the text, detects its format and hands the lines to the matching structural parser.
 *
 * <p>Format, bridge and pattern set are derived per call, so one instance can serve concurrent parses.</p>
 */
public class DocumentParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentParser.class);

    private final FormatDetector detector;
    private final Map<DocumentFormat, StructuralParser> parsers;

    public DocumentParser() {
        this(null);
    }

    public DocumentParser(PatternRegistry registry) {
        this(registry, new DefaultGenericHierarchyParser(), FormatDetector.DEFAULT_MIN_CONFIDENCE);
    }

    public DocumentParser(PatternRegistry registry, GenericHierarchyParser genericParser, double minConfidence) {
        this(new FormatDetector(registry, minConfidence), List.of(
                new EuDocumentParser(),
                new UsDocumentParser(),
                new UkDocumentParser(),
                new GenericDocumentParser(genericParser, new HierarchyConverter())));
    }

    DocumentParser(FormatDetector detector, List<StructuralParser> structuralParsers) {
        this.detector = detector;
        this.parsers = new EnumMap<>(DocumentFormat.class);
        for (StructuralParser parser : structuralParsers) {
            parsers.put(parser.format(), parser);
        }
    }

    public Document parse(List<String> lines) {
        return parseDetailed(lines).document();
    }

    public Document parse(Reader reader) {
        return parse(readLines(reader));
    }

    public Document parse(InputStream input) {
        return parse(new InputStreamReader(input, StandardCharsets.UTF_8));
    }

    public Document parse(Path path) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return parse(reader);
        } catch (IOException e) {
            throw new DocumentParseException("Failed to read " + path, e);
        }
    }

    /**
     * Detects the format and parses, reporting which format was chosen.
     */
    public ParseResult parseDetailed(List<String> lines) {
        FormatDetection detection = detector.detect(lines);
        LOGGER.debug("Detected format {} (bridge: {})", detection.format(),
                detection.bridge().map(PatternBridge::jurisdiction).orElse("none"));
        return parse(lines, detection.format(), detection.bridge());
    }

    /**
     * Parses with a caller-chosen format, skipping detection. No pattern bridge is applied.
     */
    public ParseResult parseAs(List<String> lines, DocumentFormat format) {
        if (format == DocumentFormat.UNKNOWN) {
            throw new IllegalArgumentException("Cannot parse as " + format);
        }
        return parse(lines, format, Optional.empty());
    }

    private ParseResult parse(List<String> lines, DocumentFormat format, Optional<PatternBridge> bridge) {
        StructuralParser parser = parsers.getOrDefault(format, parsers.get(DocumentFormat.EU));
        ParserConfig config = ParserConfig.forFormat(parser.format(), bridge);
        DocumentHeader header = header(lines, parser.format(), bridge);
        Document document = parser.parse(header, lines, config);
        LOGGER.debug("Parsed {} document: {}", parser.format().label(), document.statistics());
        return new ParseResult(document, parser.format());
    }

    private static DocumentHeader header(List<String> lines, DocumentFormat format, Optional<PatternBridge> bridge) {
        if (lines.isEmpty()) {
            return new DocumentHeader("", DocumentType.UNKNOWN, IdentifierExtractor.extract(format, bridge, lines));
        }
        return new DocumentHeader(lines.get(0), DocumentTypeDetector.detect(lines),
                IdentifierExtractor.extract(format, bridge, lines));
    }

    /**
     * Reads every line of the source. Line terminators are dropped.
     */
    public static List<String> readLines(Reader reader) {
        BufferedReader buffered = reader instanceof BufferedReader b ? b : new BufferedReader(reader);
        List<String> lines = new ArrayList<>();
        try {
            String line;
            while ((line = buffered.readLine()) != null) {
                lines.add(line);
            }
        } catch (IOException e) {
            throw new DocumentParseException("Failed to read document input", e);
        }
        return lines;
    }
}
