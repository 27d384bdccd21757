package com.all2md.cli;

import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.all2md.core.output.OutputWriter;
import com.all2md.core.parser.DocumentParser;
import com.all2md.core.renderer.DocumentRenderer;

import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * Command to list available parsers, renderers, or output writers.
 *
 * <p>Discovers plugins via Java Service Provider Interface (SPI).
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * all2md list parsers
 * all2md list renderers
 * all2md list writers
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available parsers, renderers, or writers",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Parameters(
        index = "0",
        description = "Type to list: parsers, renderers, or writers"
    )
    private String type;

    @Override
    public Integer call() {
        return switch (type.toLowerCase()) {
            case "parsers", "parser" -> listParsers();
            case "renderers", "renderer" -> listRenderers();
            case "writers", "writer" -> listWriters();
            default -> {
                log.error("Unknown type: {}. Use: parsers, renderers, or writers", type);
                yield 1;
            }
        };
    }

    private int listParsers() {
        System.out.println("Available Parsers:");
        System.out.println();
        List<DocumentParser> parsers = Plugins.parsers();
        for (DocumentParser parser : parsers) {
            System.out.printf("  • %s%n", parser.getId());
            System.out.printf("    Extensions: %s%n", parser.getFileExtensions().stream().sorted().toList());
        }
        if (parsers.isEmpty()) {
            System.out.println("  No parsers found.");
        }
        return 0;
    }

    private int listRenderers() {
        System.out.println("Available Renderers:");
        System.out.println();
        List<DocumentRenderer> renderers = Plugins.renderers();
        for (DocumentRenderer renderer : renderers) {
            System.out.printf("  • %s%n", renderer.getId());
            System.out.printf("    File Extension: .%s%n", renderer.getFileExtension());
        }
        if (renderers.isEmpty()) {
            System.out.println("  No renderers found.");
        }
        return 0;
    }

    private int listWriters() {
        System.out.println("Available Writers:");
        System.out.println();
        List<OutputWriter> writers = Plugins.writers();
        for (OutputWriter writer : writers) {
            System.out.printf("  • %s%n", writer.getId());
        }
        if (writers.isEmpty()) {
            System.out.println("  No writers found.");
        }
        return 0;
    }
}
