package ai.regula.ingest.pattern;

import static org.assertj.core.api.Assertions.assertThat;

import java.net.URL;
import java.net.URLClassLoader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PatternRegistriesTest {

    @TempDir
    Path tempDir;

    @Test
    void emptyWhenNothingIsRegistered() throws Exception {
        try (URLClassLoader isolated = new URLClassLoader(new URL[0], null)) {
            assertThat(PatternRegistries.discover(isolated)).isEmpty();
        }
    }

    @Test
    void loadsRegisteredImplementation() throws Exception {
        writeRegistration(EmptyPatternRegistry.class.getName());

        try (URLClassLoader loader = loaderOverTempDir()) {
            assertThat(PatternRegistries.discover(loader)).get().isInstanceOf(EmptyPatternRegistry.class);
        }
    }

    @Test
    void misconfiguredRegistrationIsIgnored() throws Exception {
        writeRegistration("ai.regula.ingest.pattern.NoSuchRegistry");

        try (URLClassLoader loader = loaderOverTempDir()) {
            assertThat(PatternRegistries.discover(loader)).isEmpty();
        }
    }

    private void writeRegistration(String className) throws Exception {
        Path services = Files.createDirectories(tempDir.resolve("META-INF/services"));
        Files.writeString(services.resolve(PatternRegistry.class.getName()), className + "\n",
                StandardCharsets.UTF_8);
    }

    private URLClassLoader loaderOverTempDir() throws Exception {
        return new URLClassLoader(new URL[] {tempDir.toUri().toURL()}, getClass().getClassLoader());
    }

    public static final class EmptyPatternRegistry implements PatternRegistry {

        @Override
        public List<FormatMatch> detectWithThreshold(String text, double minConfidence) {
            return List.of();
        }
    }
}
