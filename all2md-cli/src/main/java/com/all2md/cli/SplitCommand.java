package com.all2md.cli;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.all2md.core.ast.Document;
import com.all2md.core.config.All2MdConfig;
import com.all2md.core.output.GeneratedFile;
import com.all2md.core.output.GeneratedOutput;
import com.all2md.core.output.OutputContext;
import com.all2md.core.output.OutputWriter;
import com.all2md.core.renderer.DocumentRenderer;
import com.all2md.core.section.DocumentSplitter;
import com.all2md.core.section.SplitResult;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Splits a document into several files.
 *
 * <p>Each piece is written as {@code NN-<slug>.<ext>}, where the slug comes from the piece's
 * title and the {@code slug} configuration section.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * all2md split book.md --by h2 -o chapters
 * all2md split book.md --by words:1500 --writer console
 * }</pre>
 */
@Command(
    name = "split",
    description = "Split a document by heading level, thematic break, word count or part count",
    mixinStandardHelpOptions = true
)
public class SplitCommand extends DocumentCommand {

    private static final Logger log = LoggerFactory.getLogger(SplitCommand.class);

    @Option(names = {"-b", "--by"}, defaultValue = "h1",
        description = "h1..h6, break, words:N or parts:N (default: ${DEFAULT-VALUE})")
    private String by;

    @Option(names = {"-o", "--output"}, description = "Output directory (overrides config)")
    private String outputDirectory;

    @Option(names = {"-w", "--writer"}, description = "Output writer id (overrides config)")
    private String writer;

    @Option(names = {"--to"}, defaultValue = "markdown", description = "Output format id (default: ${DEFAULT-VALUE})")
    private String to;

    @Override
    protected int execute(Document document, All2MdConfig config) {
        List<SplitResult> pieces = DocumentSplitter.split(document, by);
        DocumentRenderer renderer = Plugins.renderer(to);
        GeneratedOutput output = toOutput(pieces, renderer, config);

        OutputWriter outputWriter = Plugins.writer(writer != null ? writer : config.output().writer());
        String directory = outputDirectory != null ? outputDirectory : config.output().directory();
        outputWriter.write(output, new OutputContext(directory, null));

        log.info("Split {} into {} piece(s) with the {} writer", inputFile, pieces.size(), outputWriter.getId());
        if ("filesystem".equals(outputWriter.getId())) {
            System.out.println("✓ Wrote " + pieces.size() + " file(s) to " + directory);
        }
        return 0;
    }

    @Override
    protected String commandName() {
        return "split";
    }

    static GeneratedOutput toOutput(List<SplitResult> pieces, DocumentRenderer renderer, All2MdConfig config) {
        All2MdConfig.SlugConfig slug = config.slug();
        List<GeneratedFile> files = new ArrayList<>(pieces.size());
        for (SplitResult piece : pieces) {
            String name = piece.filenameSlug(slug.maxLength(), slug.separator());
            if (name.isEmpty()) {
                name = "part";
            }
            String path = String.format("%02d-%s.%s", piece.index(), name, renderer.getFileExtension());
            files.add(new GeneratedFile(path, renderer.render(piece.document(), config), contentType(renderer)));
        }
        return new GeneratedOutput(files);
    }

    private static String contentType(DocumentRenderer renderer) {
        return "json".equals(renderer.getFileExtension()) ? "application/json" : "text/markdown";
    }
}
