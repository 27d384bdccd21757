package com.all2md.cli;

import java.util.List;

import com.all2md.core.ast.Document;
import com.all2md.core.config.All2MdConfig;
import com.all2md.core.section.Section;
import com.all2md.core.section.Sections;

import picocli.CommandLine.Command;

/**
 * Lists a document's sections with the {@code #index} selectors other commands accept.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * all2md sections README.md
 *
 * Document Sections:
 * [#0] # Introduction (3 nodes)
 *   [#1] ## Install (2 nodes)
 * }</pre>
 */
@Command(
    name = "sections",
    description = "List the sections of a document",
    mixinStandardHelpOptions = true
)
public class SectionsCommand extends DocumentCommand {

    @Override
    protected int execute(Document document, All2MdConfig config) {
        System.out.println(format(Sections.getAllSections(document)));
        return 0;
    }

    @Override
    protected String commandName() {
        return "sections";
    }

    /**
     * Formats sections one per line, indented two spaces per heading level below 1.
     *
     * @param sections sections in index order
     * @return listing text without trailing newline
     */
    static String format(List<Section> sections) {
        if (sections.isEmpty()) {
            return "No sections found in document.";
        }
        StringBuilder out = new StringBuilder("Document Sections:");
        for (int i = 0; i < sections.size(); i++) {
            Section section = sections.get(i);
            out.append('\n');
            if (section.isPreamble()) {
                out.append("[#").append(i).append("] (preamble) (").append(section.content().size()).append(" nodes)");
                continue;
            }
            out.append("  ".repeat(section.level() - 1))
                .append("[#").append(i).append("] ")
                .append("#".repeat(section.level())).append(' ')
                .append(section.headingText())
                .append(" (").append(section.content().size()).append(" nodes)");
        }
        return out.toString();
    }
}
