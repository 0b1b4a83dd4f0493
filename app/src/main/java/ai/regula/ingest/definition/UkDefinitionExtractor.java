package ai.regula.ingest.definition;

import ai.regula.ingest.model.Article;
import ai.regula.ingest.model.Chapter;
import ai.regula.ingest.model.Definition;
import ai.regula.ingest.model.Document;
import ai.regula.ingest.pattern.DefinitionLocation;
import ai.regula.ingest.pattern.MatchGroups;
import ai.regula.ingest.pattern.ParserConfig;
import ai.regula.ingest.pattern.PatternBridge;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads {@code "term" means ...} entries from the interpretation section of a UK Act or Statutory Instrument.
 */
public class UkDefinitionExtractor implements DefinitionExtractor {

    static final Pattern DEFAULT_TITLE = Pattern.compile("(?i)interpretation|definitions?|terms");

    private static final Logger LOGGER = LoggerFactory.getLogger(UkDefinitionExtractor.class);

    @Override
    public List<Definition> extract(Document document, ParserConfig config) {
        List<Integer> numbers = new ArrayList<>();
        List<Pattern> titles = new ArrayList<>();
        for (DefinitionLocation location : config.bridge().map(PatternBridge::definitionLocations).orElse(List.of())) {
            if (location.sectionNumber() > 0) {
                numbers.add(location.sectionNumber());
            }
            if (!location.sectionTitleRegex().isEmpty()) {
                try {
                    titles.add(Pattern.compile(location.sectionTitleRegex()));
                } catch (PatternSyntaxException e) {
                    LOGGER.debug("Skipping definition title hint {}: {}", location.sectionTitleRegex(), e.getMessage());
                }
            }
        }
        if (titles.isEmpty()) {
            titles.add(DEFAULT_TITLE);
        }

        Article source = findSource(document, numbers, titles);
        if (source == null || source.text().isEmpty()) {
            return List.of();
        }

        List<Definition> definitions = new ArrayList<>();
        for (String line : source.text().split("\n")) {
            Matcher matcher = config.ukDefinition().matcher(line);
            if (matcher.find()) {
                definitions.add(new Definition(
                        definitions.size() + 1,
                        MatchGroups.group(matcher, 1).strip(),
                        DefinitionText.remainder(line, matcher)));
            }
        }
        return definitions;
    }

    private static Article findSource(Document document, List<Integer> numbers, List<Pattern> titles) {
        for (Chapter chapter : document.chapters()) {
            for (Article article : chapter.articles()) {
                if (numbers.contains(article.number())) {
                    return article;
                }
                for (Pattern title : titles) {
                    if (title.matcher(article.title()).find()) {
                        return article;
                    }
                }
            }
        }
        return null;
    }
}
