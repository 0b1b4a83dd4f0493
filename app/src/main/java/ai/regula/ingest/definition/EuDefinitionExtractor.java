package ai.regula.ingest.definition;

import ai.regula.ingest.model.Article;
import ai.regula.ingest.model.Definition;
import ai.regula.ingest.model.Document;
import ai.regula.ingest.pattern.MatchGroups;
import ai.regula.ingest.pattern.ParserConfig;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * EU instruments keep their definitions in Article 4. Terms keep the number printed in the source.
 */
public class EuDefinitionExtractor implements DefinitionExtractor {

    static final int DEFINITIONS_ARTICLE = 4;

    @Override
    public List<Definition> extract(Document document, ParserConfig config) {
        Optional<Article> article = document.article(DEFINITIONS_ARTICLE);
        if (article.isEmpty() || article.get().text().isEmpty()) {
            return List.of();
        }
        List<Definition> definitions = new ArrayList<>();
        for (String line : article.get().text().split("\n")) {
            Matcher matcher = config.euDefinition().matcher(line);
            if (matcher.find()) {
                definitions.add(new Definition(
                        MatchGroups.intGroup(matcher, 1),
                        MatchGroups.group(matcher, 2).strip(),
                        DefinitionText.remainder(line, matcher)));
            }
        }
        return definitions;
    }
}
