package com.all2md.cli;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.all2md.core.output.OutputWriter;
import com.all2md.core.parser.DocumentParser;
import com.all2md.core.renderer.DocumentRenderer;

/**
 * Looks up parsers, renderers and output writers registered through {@link ServiceLoader}.
 */
final class Plugins {

    private static final Logger log = LoggerFactory.getLogger(Plugins.class);

    private Plugins() {
    }

    static List<DocumentParser> parsers() {
        return load(DocumentParser.class);
    }

    static List<DocumentRenderer> renderers() {
        return load(DocumentRenderer.class);
    }

    static List<OutputWriter> writers() {
        return load(OutputWriter.class);
    }

    /**
     * Picks a parser by id, or by the file's extension when {@code id} is null.
     *
     * @param id parser id, may be null
     * @param fileName input file name
     * @return matching parser; the Markdown parser when nothing else matches the extension
     * @throws IllegalArgumentException if {@code id} names no parser
     */
    static DocumentParser parser(String id, String fileName) {
        List<DocumentParser> parsers = parsers();
        if (id != null) {
            return parsers.stream()
                .filter(parser -> parser.getId().equalsIgnoreCase(id))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                    "Unknown input format: " + id + " (available: " + ids(parsers.stream().map(DocumentParser::getId).toList()) + ")"));
        }
        return parsers.stream()
            .filter(parser -> parser.supports(fileName))
            .findFirst()
            .orElseGet(() -> {
                log.debug("No parser registered for {}, assuming markdown", fileName);
                return parser("markdown", fileName);
            });
    }

    static DocumentRenderer renderer(String id) {
        List<DocumentRenderer> renderers = renderers();
        return renderers.stream()
            .filter(renderer -> renderer.getId().equalsIgnoreCase(id))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException(
                "Unknown output format: " + id + " (available: " + ids(renderers.stream().map(DocumentRenderer::getId).toList()) + ")"));
    }

    static OutputWriter writer(String id) {
        List<OutputWriter> writers = writers();
        return writers.stream()
            .filter(writer -> writer.getId().equalsIgnoreCase(id))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException(
                "Unknown output writer: " + id + " (available: " + ids(writers.stream().map(OutputWriter::getId).toList()) + ")"));
    }

    private static <T> List<T> load(Class<T> type) {
        List<T> plugins = new ArrayList<>();
        ServiceLoader.load(type).forEach(plugins::add);
        log.debug("Discovered {} {} implementation(s)", plugins.size(), type.getSimpleName());
        return plugins;
    }

    private static String ids(List<String> ids) {
        return ids.stream().collect(Collectors.joining(", "));
    }
}
