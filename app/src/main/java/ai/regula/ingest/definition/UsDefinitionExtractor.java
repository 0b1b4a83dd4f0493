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
import java.util.Locale;
import java.util.regex.Matcher;

/**
 * US statutes put definitions in a section whose number depends on the state code, or whose title mentions
 * definitions. Terms are numbered in order of appearance.
 */
public class UsDefinitionExtractor implements DefinitionExtractor {

    /**
     * Definitions sections of the CCPA, VCDPA, CPA, CTDPA, TDPSA/ICDPA and UCPA.
     */
    static final List<Integer> DEFAULT_SECTIONS = List.of(110, 575, 1303, 515, 1, 101);

    @Override
    public List<Definition> extract(Document document, ParserConfig config) {
        List<Integer> candidates = candidateSections(config);
        Article source = null;
        for (Chapter chapter : document.chapters()) {
            for (Article article : chapter.articles()) {
                if (candidates.contains(article.number())
                        || article.title().toLowerCase(Locale.ROOT).contains("definition")) {
                    source = article;
                    break;
                }
            }
            if (source != null) {
                break;
            }
        }
        if (source == null || source.text().isEmpty()) {
            return List.of();
        }

        List<Definition> definitions = new ArrayList<>();
        for (String line : source.text().split("\n")) {
            Matcher matcher = config.usDefinition().matcher(line);
            if (matcher.find()) {
                definitions.add(new Definition(
                        definitions.size() + 1,
                        MatchGroups.group(matcher, 2).strip(),
                        DefinitionText.remainder(line, matcher)));
            }
        }
        return definitions;
    }

    static List<Integer> candidateSections(ParserConfig config) {
        List<DefinitionLocation> locations = config.bridge()
                .map(PatternBridge::definitionLocations)
                .orElse(List.of());
        if (locations.isEmpty()) {
            return DEFAULT_SECTIONS;
        }
        List<Integer> numbers = new ArrayList<>();
        for (DefinitionLocation location : locations) {
            if (location.sectionNumber() > 0) {
                numbers.add(location.sectionNumber());
            }
        }
        return numbers;
    }
}
