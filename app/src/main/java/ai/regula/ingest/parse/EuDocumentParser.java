package ai.regula.ingest.parse;

import ai.regula.ingest.definition.DefinitionExtractor;
import ai.regula.ingest.definition.EuDefinitionExtractor;
import ai.regula.ingest.model.ArticleBuilder;
import ai.regula.ingest.model.Document;
import ai.regula.ingest.model.DocumentFormat;
import ai.regula.ingest.model.Preamble;
import ai.regula.ingest.model.Recital;
import ai.regula.ingest.pattern.MatchGroups;
import ai.regula.ingest.pattern.ParserConfig;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses EU regulations and directives: recitals up to the adoption clause, then chapters, sections and articles.
 */
public class EuDocumentParser implements StructuralParser {

    static final String ADOPTION_CLAUSE = "HAVE ADOPTED THIS";
    static final String RECITALS_START = "Whereas:";

    private static final Logger LOGGER = LoggerFactory.getLogger(EuDocumentParser.class);
    private static final char NO_BREAK_SPACE = '\u00a0';

    private final DefinitionExtractor definitions;

    public EuDocumentParser() {
        this(new EuDefinitionExtractor());
    }

    public EuDocumentParser(DefinitionExtractor definitions) {
        this.definitions = definitions;
    }

    @Override
    public DocumentFormat format() {
        return DocumentFormat.EU;
    }

    @Override
    public Document parse(DocumentHeader header, List<String> lines, ParserConfig config) {
        int bodyStart = bodyStart(lines, config);
        // the adoption clause itself is neither recital nor body
        Optional<Preamble> preamble = parsePreamble(lines.subList(0, Math.max(0, bodyStart - 1)), config);
        TreeAssembler tree = new TreeAssembler();
        parseBody(lines.subList(bodyStart, lines.size()), config, tree);

        Document document = new Document(header.title(), header.type(), header.identifier(),
                preamble, tree.finish(), List.of());
        return document.withDefinitions(definitions.extract(document, config));
    }

    /**
     * Index of the first line after the adoption clause, or 0 when there is none.
     */
    static int bodyStart(List<String> lines, ParserConfig config) {
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            boolean end = config.preambleEnd()
                    .map(pattern -> pattern.matcher(line).find())
                    .orElseGet(() -> line.contains(ADOPTION_CLAUSE));
            if (end) {
                return i + 1;
            }
        }
        LOGGER.debug("No adoption clause found; treating the whole text as body");
        return 0;
    }

    /**
     * Recitals following the {@value #RECITALS_START} line, or empty when that line never appears.
     */
    static Optional<Preamble> parsePreamble(List<String> lines, ParserConfig config) {
        List<Recital> recitals = new ArrayList<>();
        boolean inRecitals = false;
        int number = 0;
        StringBuilder text = null;

        for (String line : lines) {
            if (line.startsWith(RECITALS_START)) {
                inRecitals = true;
                continue;
            }
            if (!inRecitals) {
                continue;
            }
            Matcher matcher = config.recital().matcher(line);
            if (matcher.find()) {
                if (text != null) {
                    recitals.add(new Recital(number, text.toString().strip()));
                }
                number = MatchGroups.intGroup(matcher, 1);
                text = new StringBuilder(MatchGroups.group(matcher, 2));
            } else if (text != null && !line.isEmpty()) {
                text.append(' ').append(line);
            }
        }
        if (!inRecitals) {
            return Optional.empty();
        }
        if (text != null) {
            recitals.add(new Recital(number, text.toString().strip()));
        }
        return Optional.of(Preamble.ofRecitals(recitals));
    }

    private void parseBody(List<String> lines, ParserConfig config, TreeAssembler tree) {
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);

            Matcher chapter = config.euChapter().matcher(line);
            if (chapter.find()) {
                tree.startChapter(MatchGroups.group(chapter, 1), Lines.lookaheadRawTitle(lines, i));
                continue;
            }

            Matcher section = config.euSection().matcher(line);
            if (section.find()) {
                tree.startSection(MatchGroups.intGroup(section, 1), Lines.lookaheadRawTitle(lines, i));
                continue;
            }

            Matcher article = config.euArticle().matcher(line);
            if (article.find()) {
                tree.startArticle(MatchGroups.intGroup(article, 1), collectTitle(lines, i, config));
                continue;
            }

            ArticleBuilder current = tree.article();
            if (current != null && !line.isEmpty() && !current.title().contains(line)) {
                current.appendLine(line);
            }
        }
    }

    /**
     * Joins the lines after an article header that form its title. Blank lines before any title text are skipped;
     * a blank line after title text ends the title. Paragraph numbers, point markers and structural headers end it
     * as well.
     */
    static String collectTitle(List<String> lines, int headerIndex, ParserConfig config) {
        List<String> title = new ArrayList<>();
        boolean blankAfterTitle = false;
        for (int j = headerIndex + 1; j < lines.size(); j++) {
            String line = lines.get(j);
            if (line.isEmpty()) {
                if (!title.isEmpty()) {
                    blankAfterTitle = true;
                }
                continue;
            }
            if (startsWithParagraphNumber(line) || startsWithPointOrDefinition(line)) {
                break;
            }
            if (matches(config.euArticle(), line) || matches(config.euSection(), line)
                    || matches(config.euChapter(), line)) {
                break;
            }
            if (blankAfterTitle) {
                break;
            }
            title.add(line);
        }
        return String.join(" ", title);
    }

    /**
     * True for {@code "1.   text"}: digits, a period, then at least two spaces or no-break spaces.
     */
    static boolean startsWithParagraphNumber(String line) {
        if (line.length() < 3) {
            return false;
        }
        int i = 0;
        while (i < line.length() && line.charAt(i) >= '0' && line.charAt(i) <= '9') {
            i++;
        }
        if (i == 0 || i >= line.length() || line.charAt(i) != '.') {
            return false;
        }
        i++;
        int whitespace = 0;
        while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == NO_BREAK_SPACE)) {
            whitespace++;
            i++;
        }
        return whitespace >= 2;
    }

    /**
     * True for {@code "(1) "}, {@code "(26) "} or {@code "(a) "}.
     */
    static boolean startsWithPointOrDefinition(String line) {
        if (line.length() < 4 || line.charAt(0) != '(') {
            return false;
        }
        int close = line.indexOf(')');
        if (close < 2 || close > 4 || close + 1 >= line.length()) {
            return false;
        }
        return line.charAt(close + 1) == ' ';
    }

    private static boolean matches(Pattern pattern, String line) {
        return pattern.matcher(line).find();
    }
}
