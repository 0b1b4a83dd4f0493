package ai.regula.ingest.detect;

import static org.assertj.core.api.Assertions.assertThat;

import ai.regula.ingest.model.DocumentType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

class DocumentTypeDetectorTest {

    @Test
    void firstKeywordInPriorityOrderWins() {
        assertThat(DocumentTypeDetector.detect(List.of("Regulation (EU) 2016/679 amending Directive 95/46/EC")))
                .isEqualTo(DocumentType.REGULATION);
        assertThat(DocumentTypeDetector.detect(List.of("COMMISSION DECISION of 4 June 2021")))
                .isEqualTo(DocumentType.DECISION);
        assertThat(DocumentTypeDetector.detect(List.of("Data Protection Act 2018")))
                .isEqualTo(DocumentType.ACT);
        assertThat(DocumentTypeDetector.detect(List.of("Iowa Code chapter 715D")))
                .isEqualTo(DocumentType.STATUTE);
    }

    @Test
    void earlierLineDecidesBeforeLaterKeywords() {
        List<String> lines = List.of("DIRECTIVE (EU) 2019/790", "implementing regulation");

        assertThat(DocumentTypeDetector.detect(lines)).isEqualTo(DocumentType.DIRECTIVE);
    }

    @Test
    void onlyTheOpeningLinesAreScanned() {
        List<String> lines = new ArrayList<>(Collections.nCopies(20, "Lorem ipsum"));
        lines.add("REGULATION");

        assertThat(DocumentTypeDetector.detect(lines)).isEqualTo(DocumentType.UNKNOWN);
        assertThat(DocumentTypeDetector.detect(List.of())).isEqualTo(DocumentType.UNKNOWN);
    }
}
