package com.all2md.core.output.impl;

import com.all2md.core.output.GeneratedFile;
import com.all2md.core.output.GeneratedOutput;
import com.all2md.core.output.OutputContext;
import com.all2md.core.output.OutputWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Prints generated files to standard output, each preceded by a header line.
 *
 * <p><b>Settings:</b>
 * <ul>
 *   <li>{@code console.colors} - ANSI colored headers ("true"/"false", default: "false")</li>
 *   <li>{@code console.separator} - separator repeated between files (default: "---")</li>
 * </ul>
 */
public class ConsoleWriter implements OutputWriter {

    private static final Logger log = LoggerFactory.getLogger(ConsoleWriter.class);

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD_CYAN = "\u001B[1m\u001B[36m";
    private static final String ANSI_YELLOW = "\u001B[33m";
    private static final String DEFAULT_SEPARATOR = "---";
    private static final int LINE_WIDTH = 80;

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void write(GeneratedOutput output, OutputContext context) {
        boolean colors = Boolean.parseBoolean(context.getSettingOrDefault("console.colors", "false"));
        String separator = context.getSettingOrDefault("console.separator", DEFAULT_SEPARATOR);
        if (separator.isEmpty()) {
            separator = DEFAULT_SEPARATOR;
        }
        PrintStream out = System.out;
        int total = output.files().size();
        log.debug("Printing {} file(s) to console", total);

        for (int i = 0; i < total; i++) {
            GeneratedFile file = output.files().get(i);
            if (i > 0) {
                out.println(paint(separator.repeat(Math.max(1, LINE_WIDTH / separator.length())), ANSI_YELLOW, colors));
            }
            out.println(paint("File " + (i + 1) + "/" + total + ": " + file.relativePath(), ANSI_BOLD_CYAN, colors));
            out.println();
            out.println(file.content());
        }
        out.flush();
    }

    private static String paint(String text, String color, boolean colors) {
        return colors ? color + text + ANSI_RESET : text;
    }
}
