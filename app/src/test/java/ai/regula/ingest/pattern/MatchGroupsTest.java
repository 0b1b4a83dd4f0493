package ai.regula.ingest.pattern;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.junit.jupiter.api.Test;

class MatchGroupsTest {

    @Test
    void missingOrSkippedGroupsReadAsEmpty() {
        Matcher matcher = Pattern.compile("^Article\\s+(\\d+)(?:\\s+(\\w+))?$").matcher("Article 12");

        assertThat(matcher.find()).isTrue();
        assertThat(MatchGroups.group(matcher, 1)).isEqualTo("12");
        assertThat(MatchGroups.group(matcher, 2)).isEmpty();
        assertThat(MatchGroups.group(matcher, 3)).isEmpty();
    }

    @Test
    void intGroupFallsBackToZero() {
        Matcher matcher = Pattern.compile("^PART\\s+(\\w+)$").matcher("PART IV");

        assertThat(matcher.find()).isTrue();
        assertThat(MatchGroups.intGroup(matcher, 1)).isZero();
        assertThat(MatchGroups.intGroup(matcher, 2)).isZero();
    }
}
