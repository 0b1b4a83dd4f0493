package ai.regula.ingest.cli;

import ai.regula.ingest.config.FormatOption;
import ai.regula.ingest.config.LogFormat;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "regula-ingest", mixinStandardHelpOptions = true,
        description = "Parse plain-text regulations and statutes into a structured JSON document")
public class CliArguments {

    @CommandLine.Parameters(index = "0", paramLabel = "<input>", description = "Document file, or - for standard input")
    private String input;

    @CommandLine.Option(names = {"-o", "--output"}, description = "Write output to FILE instead of standard output", paramLabel = "FILE")
    private Path output;

    @CommandLine.Option(names = "--format", converter = OptionConverters.FormatOptionConverter.class, description = "Parser to use: auto, eu, us, uk or generic")
    private FormatOption format;

    @CommandLine.Option(names = "--stats", description = "Print parse statistics instead of the document")
    private boolean statsOnly;

    @CommandLine.Option(names = "--pretty", description = "Pretty-print JSON output")
    private boolean pretty;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = OptionConverters.LogFormatConverter.class)
    private LogFormat logFormat;

    public String input() {
        return input;
    }

    public Path output() {
        return output;
    }

    public FormatOption format() {
        return format;
    }

    public boolean statsOnly() {
        return statsOnly;
    }

    public boolean pretty() {
        return pretty;
    }

    public LogFormat logFormat() {
        return logFormat;
    }
}
