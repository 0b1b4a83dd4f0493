package ai.regula.ingest.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import ai.regula.ingest.config.FormatOption;
import ai.regula.ingest.config.LogFormat;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

class OptionConvertersTest {

    @Test
    void convertsCaseInsensitively() {
        CliArguments arguments = CommandLine.populateCommand(new CliArguments(),
                "act.txt", "--format", "Uk", "--log-format", "JSON");

        assertThat(arguments.format()).isEqualTo(FormatOption.UK);
        assertThat(arguments.logFormat()).isEqualTo(LogFormat.JSON);
    }

    @Test
    void rejectedValueReportsEnumMessage() {
        Throwable thrown = catchThrowable(() -> CommandLine.populateCommand(new CliArguments(),
                "act.txt", "--log-format", "xml"));

        assertThat(thrown)
                .isInstanceOf(CommandLine.ParameterException.class)
                .hasMessageContaining("Unsupported log format: xml")
                .hasMessageNotContaining(IllegalArgumentException.class.getName());
    }

    @Test
    void rejectedFormatReportsEnumMessage() {
        Throwable thrown = catchThrowable(() -> new OptionConverters.FormatOptionConverter().convert("fr"));

        assertThat(thrown)
                .isInstanceOf(CommandLine.TypeConversionException.class)
                .hasMessage("Unsupported format: fr");
    }
}
