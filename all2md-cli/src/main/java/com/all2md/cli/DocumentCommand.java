package com.all2md.cli;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.all2md.core.All2MdException;
import com.all2md.core.ast.Document;
import com.all2md.core.config.All2MdConfig;
import com.all2md.core.config.ConfigLoader;
import com.all2md.core.parser.DocumentParser;

import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Base class for commands that read one input document.
 *
 * <p>Handles the shared {@code <file>}, {@code --from} and {@code --config} options, loads the
 * configuration, parses the input and turns failures into exit code 1 with a single error
 * line on stderr. Stack traces are logged at DEBUG only.
 */
abstract class DocumentCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(DocumentCommand.class);

    @Parameters(index = "0", description = "Input document")
    protected Path inputFile;

    @Option(
        names = {"-f", "--from"},
        description = "Input format id (default: detected from the file extension)"
    )
    protected String from;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: all2md.yaml)"
    )
    protected Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Override
    public Integer call() {
        try {
            All2MdConfig config = ConfigLoader.load(configPath);
            Document document = readDocument();
            return execute(document, config);
        } catch (All2MdException | IllegalArgumentException | IllegalStateException | IOException e) {
            log.debug("{} failed", commandName(), e);
            System.err.println("✗ " + commandName() + " failed for " + inputFile + ": " + e.getMessage());
            return 1;
        }
    }

    /**
     * Runs the command against the parsed input.
     *
     * @param document parsed input document
     * @param config loaded configuration
     * @return process exit code
     * @throws IOException if output cannot be written
     */
    protected abstract int execute(Document document, All2MdConfig config) throws IOException;

    /**
     * @return command name used in error messages
     */
    protected abstract String commandName();

    private Document readDocument() throws IOException {
        if (!Files.isRegularFile(inputFile)) {
            throw new IllegalArgumentException("File not found: " + inputFile);
        }
        DocumentParser parser = Plugins.parser(from, inputFile.getFileName().toString());
        log.debug("Reading {} with the {} parser", inputFile, parser.getId());
        String source = Files.readString(inputFile, StandardCharsets.UTF_8);
        return parser.parse(source);
    }

    /**
     * Prints text to stdout, or writes it to {@code output} when set.
     *
     * @param text text to emit
     * @param output target file, may be null
     * @throws IOException if the file cannot be written
     */
    protected static void emit(String text, Path output) throws IOException {
        if (output == null) {
            System.out.print(text);
            if (!text.endsWith("\n")) {
                System.out.println();
            }
            return;
        }
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(output, text, StandardCharsets.UTF_8);
        log.info("Wrote {}", output);
    }
}
