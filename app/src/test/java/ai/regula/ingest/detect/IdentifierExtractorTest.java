package ai.regula.ingest.detect;

import static org.assertj.core.api.Assertions.assertThat;

import ai.regula.ingest.model.DocumentFormat;
import ai.regula.ingest.pattern.StubPatternBridge;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class IdentifierExtractorTest {

    @Test
    void euRegulationNumber() {
        List<String> lines = List.of("REGULATION (EU) 2016/679 OF THE EUROPEAN PARLIAMENT");

        assertThat(IdentifierExtractor.extract(DocumentFormat.EU, Optional.empty(), lines))
                .isEqualTo("(EU) 2016/679");
        assertThat(IdentifierExtractor.extractEu(List.of("Regulation (EC) No 45/2001"))).isEqualTo("(EU) 45/2001");
    }

    @Test
    void ukCitations() {
        assertThat(IdentifierExtractor.extractUk(List.of("Data Protection Act 2018", "[2018 c. 12]")))
                .isEqualTo("2018 c. 12");
        assertThat(IdentifierExtractor.extractUk(List.of("S.I. 2019/419")))
                .isEqualTo("S.I. 2019/419");
        assertThat(IdentifierExtractor.extractUk(List.of("STATUTORY INSTRUMENTS 2019 No. 419")))
                .isEqualTo("S.I. 2019/419");
        assertThat(IdentifierExtractor.extractUk(List.of("no citation here"))).isEmpty();
    }

    @Test
    void stateSectionCitationsUseJurisdictionPrefix() {
        assertThat(IdentifierExtractor.extractUs("US-CO", List.of("Section 6-1-1303")))
                .isEqualTo("C.R.S. § 6-1-1303");
        assertThat(IdentifierExtractor.extractUs("US-IA", List.of("Section 715D.2")))
                .isEqualTo("Iowa Code § 715D.2");
        assertThat(IdentifierExtractor.extractUs("US-TX", List.of("Sec. 541.002")))
                .isEqualTo("Tex. Bus. & Com. Code § 541.002");
    }

    @Test
    void stateMarkerWithoutSectionFallsBackToCanonicalCitation() {
        assertThat(IdentifierExtractor.extractUs("US-CT", List.of("Conn. Gen. Stat. chapter 743jj")))
                .isEqualTo("Conn. Gen. Stat. § 42-515 et seq.");
        assertThat(IdentifierExtractor.extractUs("US-UT", List.of("Utah Code Title 13")))
                .isEqualTo("U.C.A. § 13-61-101 et seq.");
    }

    @Test
    void virginiaAndCaliforniaWithoutJurisdiction() {
        assertThat(IdentifierExtractor.extractUs("", List.of("Title 59.1 Chapter 53")))
                .isEqualTo("Va. Code Ann. § 59.1-575 et seq.");
        assertThat(IdentifierExtractor.extractUs("", List.of("Title 59.1 Chapter 52")))
                .isEqualTo("Va. Code Ann. Title 59.1 Chapter 52");
        assertThat(IdentifierExtractor.extractUs("", List.of("§ 59.1-576")))
                .isEqualTo("Va. Code Ann. § 59.1");
        assertThat(IdentifierExtractor.extractUs("", List.of("TITLE 1.81.5")))
                .isEqualTo("Cal. Civ. Code Title 1.81.5");
        assertThat(IdentifierExtractor.extractUs("", List.of("Section 1798.100")))
                .isEqualTo("Cal. Civ. Code § 1798");
    }

    @Test
    void usJurisdictionComesFromBridge() {
        List<String> lines = List.of("Section 13-61-101");

        assertThat(IdentifierExtractor.extract(DocumentFormat.US, Optional.of(new StubPatternBridge("US-UT")), lines))
                .isEqualTo("U.C.A. § 13-61-101");
        assertThat(IdentifierExtractor.extract(DocumentFormat.US, Optional.empty(), lines)).isEmpty();
    }
}
