package com.all2md.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import com.all2md.core.ast.Document;
import com.all2md.core.ast.ListBlock;
import com.all2md.core.config.All2MdConfig;
import com.all2md.core.section.Sections;
import com.all2md.core.section.TocPosition;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Prints a table of contents, or the whole document with the table inserted.
 *
 * <p>Defaults for depth, position and title come from the {@code toc} configuration section.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * all2md toc guide.md --max-depth 2
 * all2md toc guide.md --flat
 * all2md toc guide.md --insert --position after_first_heading -o guide.md
 * }</pre>
 */
@Command(
    name = "toc",
    description = "Generate a table of contents",
    mixinStandardHelpOptions = true
)
public class TocCommand extends DocumentCommand {

    @Option(names = {"-d", "--max-depth"}, description = "Deepest heading level listed (1-6)")
    private Integer maxDepth;

    @Option(names = {"--insert"}, description = "Print the document with the table of contents inserted")
    private boolean insert;

    @Option(names = {"--position"}, description = "Insert position: start or after_first_heading")
    private String position;

    @Option(names = {"--flat"}, description = "List every heading at one level instead of nesting")
    private boolean flat;

    @Option(names = {"--title"}, description = "Title heading text; empty for none")
    private String title;

    @Option(names = {"--to"}, defaultValue = "markdown", description = "Output format id (default: ${DEFAULT-VALUE})")
    private String to;

    @Option(names = {"-o", "--output"}, description = "Output file (default: stdout)")
    private Path output;

    @Override
    protected int execute(Document document, All2MdConfig config) throws IOException {
        int depth = maxDepth != null ? maxDepth : config.toc().maxDepth();
        Document result;
        if (insert) {
            TocPosition tocPosition = TocPosition.fromValue(position != null ? position : config.toc().position());
            String tocTitle = title != null ? title : config.toc().title();
            result = Sections.insertToc(document, tocPosition, depth, tocTitle.isEmpty() ? null : tocTitle, flat);
        } else {
            ListBlock toc = Sections.generateToc(document, depth, flat);
            result = new Document(toc.items().isEmpty() ? List.of() : List.of(toc));
        }
        emit(Plugins.renderer(to).render(result, config), output);
        return 0;
    }

    @Override
    protected String commandName() {
        return "toc";
    }
}
