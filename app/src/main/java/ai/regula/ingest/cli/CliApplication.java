package ai.regula.ingest.cli;

import ai.regula.ingest.config.Config;
import ai.regula.ingest.config.ConfigLoader;
import ai.regula.ingest.config.SystemEnvironmentReader;
import ai.regula.ingest.hierarchy.DefaultGenericHierarchyParser;
import ai.regula.ingest.logging.LoggingConfigurator;
import ai.regula.ingest.output.DocumentJsonWriter;
import ai.regula.ingest.parse.DocumentParseException;
import ai.regula.ingest.parse.DocumentParser;
import ai.regula.ingest.parse.ParseResult;
import ai.regula.ingest.pattern.PatternRegistries;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and document parser.
 */
public final class CliApplication {

    static final int EXIT_OK = 0;
    static final int EXIT_IO_FAILURE = 1;

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    private final ConfigLoader configLoader;
    private final Function<Config, DocumentParser> parserFactory;
    private final InputStream stdin;
    private final PrintStream stdout;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), CliApplication::createParser, System.in, System.out);
    }

    CliApplication(ConfigLoader configLoader, Function<Config, DocumentParser> parserFactory,
                   InputStream stdin, PrintStream stdout) {
        this.configLoader = configLoader;
        this.parserFactory = parserFactory;
        this.stdin = stdin;
        this.stdout = stdout;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            commandLine.getErr().println(ex.getMessage());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat());

        try {
            ParseResult result = parse(config);
            LOGGER.info("Parsed {} as {} document: {}", config.input(), result.format().label(),
                    result.document().statistics());
            write(config, result);
            return EXIT_OK;
        } catch (DocumentParseException ex) {
            LOGGER.error("Could not read {}: {}", config.input(), ex.getMessage(), ex);
            return EXIT_IO_FAILURE;
        } catch (IOException ex) {
            LOGGER.error("Could not write output: {}", ex.getMessage(), ex);
            return EXIT_IO_FAILURE;
        }
    }

    private ParseResult parse(Config config) {
        List<String> lines = config.inputPath()
                .map(CliApplication::readFile)
                .orElseGet(() -> DocumentParser.readLines(new InputStreamReader(stdin, StandardCharsets.UTF_8)));
        DocumentParser parser = parserFactory.apply(config);
        return config.format().forcedFormat()
                .map(format -> parser.parseAs(lines, format))
                .orElseGet(() -> parser.parseDetailed(lines));
    }

    private void write(Config config, ParseResult result) throws IOException {
        DocumentJsonWriter writer = new DocumentJsonWriter(config.pretty());
        String payload = config.statsOnly()
                ? writer.write(result.document().statistics())
                : writer.write(result.document());
        if (config.output().isPresent()) {
            Path target = config.output().get();
            try (Writer out = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
                out.write(payload);
                out.write(System.lineSeparator());
            }
            LOGGER.info("Wrote {}", target);
        } else {
            Writer out = new BufferedWriter(new OutputStreamWriter(stdout, StandardCharsets.UTF_8));
            out.write(payload);
            out.write(System.lineSeparator());
            out.flush();
        }
    }

    private static List<String> readFile(Path path) {
        try (var reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return DocumentParser.readLines(reader);
        } catch (IOException ex) {
            throw new DocumentParseException("Failed to read " + path, ex);
        }
    }

    private static DocumentParser createParser(Config config) {
        return new DocumentParser(PatternRegistries.discover().orElse(null),
                new DefaultGenericHierarchyParser(), config.registryMinConfidence());
    }
}
