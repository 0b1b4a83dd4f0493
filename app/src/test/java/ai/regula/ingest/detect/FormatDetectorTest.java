package ai.regula.ingest.detect;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import ai.regula.ingest.model.DocumentFormat;
import ai.regula.ingest.pattern.FormatMatch;
import ai.regula.ingest.pattern.ParserConfig;
import ai.regula.ingest.pattern.StubPatternBridge;
import ai.regula.ingest.pattern.StubPatternRegistry;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class FormatDetectorTest {

    private final FormatDetector detector = new FormatDetector();

    @Test
    void lowScoresFallBackToGeneric() {
        List<String> lines = List.of("Community garden rules", "Article 1", "Members must water their plots.");

        assertThat(detector.detect(lines).format()).isEqualTo(DocumentFormat.GENERIC);
    }

    @Test
    void euRegulation() {
        List<String> lines = List.of(
                "REGULATION (EU) 2016/679 OF THE EUROPEAN PARLIAMENT AND OF THE COUNCIL",
                "HAVE ADOPTED THIS REGULATION:",
                "CHAPTER I",
                "Article 1");

        FormatDetection detection = detector.detect(lines);

        assertThat(detection.format()).isEqualTo(DocumentFormat.EU);
        assertThat(detection.bridge()).isEmpty();
    }

    @Test
    void californiaStatute() {
        List<String> lines = List.of(
                "CALIFORNIA CONSUMER PRIVACY ACT OF 2018",
                "TITLE 1.81.5",
                "Section 1798.100",
                "General Duties of Businesses that Collect Personal Information");

        assertThat(detector.detect(lines).format()).isEqualTo(DocumentFormat.US);
    }

    @Test
    void ukWinsOnlyWhenAheadOfBoth() {
        List<String> lines = List.of(
                "Data Protection Act 2018",
                "2018 CHAPTER 12",
                "BE IT ENACTED by the King's most Excellent Majesty",
                "PART 1");

        assertThat(detector.score(lines))
                .containsEntry(DocumentFormat.UK, 4)
                .containsEntry(DocumentFormat.EU, 0);
        assertThat(detector.detect(lines).format()).isEqualTo(DocumentFormat.UK);
    }

    @Test
    void ukOutscoringBothBeatsUsEvenWhenUsBeatsEu() {
        List<String> lines = List.of(
                "CALIFORNIA",
                "BE IT ENACTED",
                "ROYAL ASSENT");

        Map<DocumentFormat, Integer> scores = detector.score(lines);

        assertThat(scores).containsEntry(DocumentFormat.US, 2).containsEntry(DocumentFormat.UK, 5);
        assertThat(detector.detectByIndicators(lines)).isEqualTo(DocumentFormat.UK);
    }

    @Test
    void tiesGoToUsOverEuAndToEuOverUk() {
        assertThat(detector.detectByIndicators(List.of("CHAPTER I", "VIRGINIA"))).isEqualTo(DocumentFormat.EU);
        assertThat(detector.detectByIndicators(List.of("(EU) text", "ROYAL ASSENT"))).isEqualTo(DocumentFormat.EU);
        assertThat(detector.detectByIndicators(List.of("CHAPTER I", "CALIFORNIA", "Section 1.2")))
                .isEqualTo(DocumentFormat.US);
    }

    @Test
    void registryMatchSuppliesBridge() {
        StubPatternBridge bridge = new StubPatternBridge("US-CO");
        StubPatternRegistry registry = new StubPatternRegistry(
                List.of(new FormatMatch("us-co-cpa", 0.8, Optional.of(bridge))));

        FormatDetection detection = new FormatDetector(registry, 0.3).detect(List.of("anything"));

        assertThat(detection.format()).isEqualTo(DocumentFormat.US);
        assertThat(detection.bridge()).containsSame(bridge);
    }

    @Test
    void weakRegistryMatchMeansGeneric() {
        StubPatternRegistry registry = new StubPatternRegistry(
                List.of(new FormatMatch("eu-gdpr", 0.1, Optional.of(new StubPatternBridge("EU")))));

        FormatDetection detection = new FormatDetector(registry, 0.3)
                .detect(List.of("CHAPTER I", "HAVE ADOPTED THIS REGULATION"));

        assertThat(detection.format()).isEqualTo(DocumentFormat.GENERIC);
    }

    @Test
    void unknownJurisdictionFallsBackToIndicators() {
        StubPatternRegistry registry = new StubPatternRegistry(
                List.of(new FormatMatch("au-privacy", 0.9, Optional.of(new StubPatternBridge("AU")))));

        FormatDetection detection = new FormatDetector(registry, 0.3)
                .detect(List.of("CHAPTER I", "HAVE ADOPTED THIS REGULATION"));

        assertThat(detection.format()).isEqualTo(DocumentFormat.EU);
        assertThat(detection.bridge()).isEmpty();
    }

    @Test
    void jurisdictionMapping() {
        assertThat(FormatDetector.formatForJurisdiction("EU")).isEqualTo(DocumentFormat.EU);
        assertThat(FormatDetector.formatForJurisdiction("US-Federal")).isEqualTo(DocumentFormat.US);
        assertThat(FormatDetector.formatForJurisdiction("US-TX")).isEqualTo(DocumentFormat.US);
        assertThat(FormatDetector.formatForJurisdiction("GB-SCT")).isEqualTo(DocumentFormat.UK);
        assertThat(FormatDetector.formatForJurisdiction("US-NY")).isEqualTo(DocumentFormat.UNKNOWN);
    }

    @Test
    void rejectsThresholdOutsideUnitRange() {
        Throwable thrown = catchThrowable(() -> new FormatDetector(null, 1.5));

        assertThat(thrown).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void weightTableHasEveryRow() {
        assertThat(IndicatorRule.defaultTable(ParserConfig.defaults()))
                .hasSize(19)
                .extracting(IndicatorRule::weight)
                .containsOnly(1, 2, 3);
    }
}
