package ai.regula.ingest.detect;

import ai.regula.ingest.model.DocumentFormat;
import ai.regula.ingest.pattern.ParserConfig;
import ai.regula.ingest.pattern.UsSectionDialect;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * One row of the indicator weight table: when {@code signal} holds for a line, {@code weight} is added to the score
 * of {@code format}.
 */
public record IndicatorRule(String name, DocumentFormat format, int weight, Predicate<String> signal) {

    private static final Pattern UK_CHAPTER_CITATION = Pattern.compile("\\[\\d{4}\\s+c\\.\\s*\\d+\\]");
    private static final Pattern UK_SI_NUMBER = Pattern.compile("S\\.?I\\.?\\s+\\d{4}/\\d+");

    public IndicatorRule {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(signal, "signal");
        if (weight <= 0) {
            throw new IllegalArgumentException("weight must be positive");
        }
    }

    public boolean matches(String line) {
        return signal.test(line);
    }

    /**
     * The weight table used for documents no registry pattern claimed. Header rules use the patterns of
     * {@code config}.
     */
    public static List<IndicatorRule> defaultTable(ParserConfig config) {
        return List.of(
                new IndicatorRule("eu-chapter-header", DocumentFormat.EU, 2, finds(config.euChapter())),
                new IndicatorRule("eu-article-header", DocumentFormat.EU, 1, finds(config.euArticle())),
                new IndicatorRule("eu-adoption-clause", DocumentFormat.EU, 3,
                        line -> line.contains("HAVE ADOPTED THIS REGULATION")),
                new IndicatorRule("eu-ec-marker", DocumentFormat.EU, 2,
                        line -> line.contains("(EU)") || line.contains("(EC)")),

                new IndicatorRule("us-chapter-header", DocumentFormat.US, 2, finds(config.usChapter())),
                new IndicatorRule("us-dotted-section", DocumentFormat.US, 2,
                        finds(config.usSection(UsSectionDialect.CALIFORNIA_TEXAS))),
                new IndicatorRule("us-california", DocumentFormat.US, 2, upperContains("CALIFORNIA")),
                new IndicatorRule("us-virginia", DocumentFormat.US, 2, upperContains("VIRGINIA")),
                new IndicatorRule("us-ccpa-citation", DocumentFormat.US, 3,
                        line -> line.contains("TITLE 1.81") || line.contains("Section 1798")),
                new IndicatorRule("us-vcdpa-citation", DocumentFormat.US, 3,
                        line -> line.contains("Section 59.1-") || line.contains("§ 59.1-")),

                new IndicatorRule("uk-enacting-clause", DocumentFormat.UK, 3, upperContains("BE IT ENACTED")),
                new IndicatorRule("uk-statutory-instrument", DocumentFormat.UK, 3,
                        upperContains("STATUTORY INSTRUMENT")),
                new IndicatorRule("uk-royal-assent", DocumentFormat.UK, 2, upperContains("ROYAL ASSENT")),
                new IndicatorRule("uk-lords", DocumentFormat.UK, 2, upperContains("LORDS SPIRITUAL AND TEMPORAL")),
                new IndicatorRule("uk-commons", DocumentFormat.UK, 2, upperContains("HOUSE OF COMMONS")),
                new IndicatorRule("uk-part-header", DocumentFormat.UK, 1, findsTrimmed(config.ukPart())),
                new IndicatorRule("uk-schedule-header", DocumentFormat.UK, 1, findsTrimmed(config.ukSchedule())),
                new IndicatorRule("uk-chapter-citation", DocumentFormat.UK, 3, finds(UK_CHAPTER_CITATION)),
                new IndicatorRule("uk-si-number", DocumentFormat.UK, 3, finds(UK_SI_NUMBER)));
    }

    private static Predicate<String> finds(Pattern pattern) {
        return line -> pattern.matcher(line).find();
    }

    private static Predicate<String> findsTrimmed(Pattern pattern) {
        return line -> pattern.matcher(line.trim()).find();
    }

    private static Predicate<String> upperContains(String phrase) {
        return line -> line.trim().toUpperCase(Locale.ROOT).contains(phrase);
    }
}
