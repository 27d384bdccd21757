package com.all2md.cli;

import java.io.IOException;
import java.nio.file.Path;

import com.all2md.core.ast.Document;
import com.all2md.core.config.All2MdConfig;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Converts a document between registered formats, e.g. Markdown to the JSON tree and back.
 */
@Command(
    name = "convert",
    description = "Convert a document to another format",
    mixinStandardHelpOptions = true
)
public class ConvertCommand extends DocumentCommand {

    @Option(names = {"--to"}, required = true, description = "Output format id, e.g. markdown or json")
    private String to;

    @Option(names = {"-o", "--output"}, description = "Output file (default: stdout)")
    private Path output;

    @Override
    protected int execute(Document document, All2MdConfig config) throws IOException {
        emit(Plugins.renderer(to).render(document, config), output);
        return 0;
    }

    @Override
    protected String commandName() {
        return "convert";
    }
}
