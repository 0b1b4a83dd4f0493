package ai.regula.ingest.parse;

import ai.regula.ingest.definition.DefinitionExtractor;
import ai.regula.ingest.definition.UkDefinitionExtractor;
import ai.regula.ingest.model.ArticleBuilder;
import ai.regula.ingest.model.Document;
import ai.regula.ingest.model.DocumentFormat;
import ai.regula.ingest.pattern.MatchGroups;
import ai.regula.ingest.pattern.ParserConfig;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses UK Acts and Statutory Instruments. Parts and schedules become chapters, numbered sections or regulations
 * become articles.
 */
public class UkDocumentParser implements StructuralParser {

    static final Pattern ENACTING_CLAUSE = Pattern.compile("(?i)BE\\s+IT\\s+ENACTED");
    static final Pattern MADE_LINE = Pattern.compile("(?i)^Made\\s+\\d");
    static final String SCHEDULE_PREFIX = "S";

    private final DefinitionExtractor definitions;

    public UkDocumentParser() {
        this(new UkDefinitionExtractor());
    }

    public UkDocumentParser(DefinitionExtractor definitions) {
        this.definitions = definitions;
    }

    @Override
    public DocumentFormat format() {
        return DocumentFormat.UK;
    }

    @Override
    public Document parse(DocumentHeader header, List<String> lines, ParserConfig config) {
        TreeAssembler tree = new TreeAssembler();
        ArticleBuilder awaitingTitle = null;

        for (int i = bodyStart(lines); i < lines.size(); i++) {
            String line = lines.get(i).strip();

            Matcher part = config.ukPart().matcher(line);
            if (part.find()) {
                tree.startChapter(MatchGroups.group(part, 1), Lines.lookaheadTitle(lines, i));
                awaitingTitle = null;
                continue;
            }

            Matcher schedule = config.ukSchedule().matcher(line);
            if (schedule.find()) {
                tree.startChapter(SCHEDULE_PREFIX + MatchGroups.group(schedule, 1), Lines.lookaheadTitle(lines, i));
                awaitingTitle = null;
                continue;
            }

            Matcher section = config.ukSection().matcher(line);
            if (section.find()) {
                String title = inlineTitle(MatchGroups.group(section, 2));
                ArticleBuilder article = tree.startArticle(MatchGroups.intGroup(section, 1), title);
                tree.ensureChapter();
                awaitingTitle = title.isEmpty() ? article : null;
                continue;
            }

            if (awaitingTitle != null && !line.isEmpty()) {
                awaitingTitle.title(line);
                awaitingTitle = null;
                continue;
            }

            ArticleBuilder current = tree.article();
            if (current != null && !line.isEmpty() && !line.equals(current.title())) {
                current.appendLine(line);
            }
        }

        Document document = new Document(header.title(), header.type(), header.identifier(),
                Optional.empty(), tree.finish(), List.of());
        return document.withDefinitions(definitions.extract(document, config));
    }

    /**
     * Index of the line after the enacting clause or the "Made" date, or 0 when neither appears.
     */
    static int bodyStart(List<String> lines) {
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (ENACTING_CLAUSE.matcher(line).find() || MADE_LINE.matcher(line).find()) {
                return i + 1;
            }
        }
        return 0;
    }

    /**
     * Strips the dash or em-dash that follows the section number, as in {@code 1.—(1) Citation}.
     */
    static String inlineTitle(String raw) {
        String title = raw.strip();
        int start = 0;
        while (start < title.length() && (title.charAt(start) == '—' || title.charAt(start) == '-')) {
            start++;
        }
        return title.substring(start).strip();
    }
}
