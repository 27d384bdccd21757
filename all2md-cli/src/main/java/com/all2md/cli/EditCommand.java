package com.all2md.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.all2md.core.ast.Block;
import com.all2md.core.ast.Document;
import com.all2md.core.config.All2MdConfig;
import com.all2md.core.section.InsertPosition;
import com.all2md.core.section.SectionTarget;
import com.all2md.core.section.Sections;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Applies one section edit to a document and prints the result.
 *
 * <p>Actions: {@code list-sections}, {@code extract}, {@code add:before}, {@code add:after},
 * {@code remove}, {@code replace}, {@code insert:start}, {@code insert:end} and
 * {@code insert:after_heading}. Every action except {@code list-sections} needs a
 * {@code --target}; actions that add content need {@code --content}, which is parsed as
 * Markdown.
 *
 * <p>{@code extract} also accepts a multi-section target: {@code #:1-3,5} selects headed
 * sections by 1-based position and a heading pattern with {@code *} or {@code ?} selects every
 * matching section. Selected sections are joined with a thematic break.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * all2md edit guide.md --action remove --target "Deprecated API"
 * all2md edit guide.md --action insert:end --target "#2" --content "See also [FAQ](faq.md)."
 * all2md edit guide.md --action extract --target install --to json -o install.json
 * all2md edit guide.md --action extract --target "#:1-2"
 * }</pre>
 */
@Command(
    name = "edit",
    description = "List, extract, add, remove, replace or insert into document sections",
    mixinStandardHelpOptions = true
)
public class EditCommand extends DocumentCommand {

    private static final Logger log = LoggerFactory.getLogger(EditCommand.class);

    static final String LIST_SECTIONS = "list-sections";

    private static final Set<String> CONTENT_ACTIONS = Set.of(
        "add:before", "add:after", "replace", "insert:start", "insert:end", "insert:after_heading");

    @Option(names = {"-a", "--action"}, required = true, description = "Edit action")
    private String action;

    @Option(names = {"-t", "--target"}, description = "Section selector: heading text (case-insensitive) or #<index>; "
        + "extract also takes #:<ranges> or a heading pattern with * and ?")
    private String target;

    @Option(names = {"--content"}, description = "Markdown content to add or insert")
    private String content;

    @Option(names = {"--to"}, defaultValue = "markdown", description = "Output format id (default: ${DEFAULT-VALUE})")
    private String to;

    @Option(names = {"-o", "--output"}, description = "Output file (default: stdout)")
    private Path output;

    @Override
    protected int execute(Document document, All2MdConfig config) throws IOException {
        String normalized = action.strip().toLowerCase(Locale.ROOT);
        if (LIST_SECTIONS.equals(normalized)) {
            emit(SectionsCommand.format(Sections.getAllSections(document)), output);
            return 0;
        }
        if (target == null || target.isBlank()) {
            throw new IllegalArgumentException("The '" + normalized + "' action requires --target (heading text or #<index>)");
        }
        if (CONTENT_ACTIONS.contains(normalized) && (content == null || content.isEmpty())) {
            throw new IllegalArgumentException("The '" + normalized + "' action requires --content");
        }

        if ("extract".equals(normalized) && Sections.isMultiSectionSpec(target)) {
            Document result = Sections.extractSections(document, target);
            log.info("Extracted sections matching {}", target.strip());
            emit(Plugins.renderer(to).render(result, config), output);
            return 0;
        }

        SectionTarget selector = SectionTarget.parse(target);
        Document result = apply(normalized, document, selector);
        log.info("Applied {} to {}", normalized, selector);
        emit(Plugins.renderer(to).render(result, config), output);
        return 0;
    }

    @Override
    protected String commandName() {
        return "edit";
    }

    private Document apply(String edit, Document document, SectionTarget selector) {
        return switch (edit) {
            case "extract" -> Sections.extractSection(document, selector);
            case "remove" -> Sections.removeSection(document, selector);
            case "add:before" -> Sections.addSectionBefore(document, selector, contentBlocks());
            case "add:after" -> Sections.addSectionAfter(document, selector, contentBlocks());
            case "replace" -> Sections.replaceSection(document, selector, contentBlocks());
            case "insert:start", "insert:end", "insert:after_heading" -> Sections.insertIntoSection(
                document, selector, contentBlocks(), InsertPosition.fromValue(edit.substring("insert:".length())));
            default -> throw new IllegalArgumentException("Invalid action: " + action);
        };
    }

    private List<Block> contentBlocks() {
        return Plugins.parser("markdown", "content.md").parse(content).children();
    }
}
