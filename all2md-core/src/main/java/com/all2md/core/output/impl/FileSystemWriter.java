package com.all2md.core.output.impl;

import com.all2md.core.output.GeneratedFile;
import com.all2md.core.output.GeneratedOutput;
import com.all2md.core.output.OutputContext;
import com.all2md.core.output.OutputWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Writes generated files below the output directory, creating directories as needed and
 * overwriting existing files. Paths that would escape the output directory are rejected.
 */
public class FileSystemWriter implements OutputWriter {

    private static final Logger log = LoggerFactory.getLogger(FileSystemWriter.class);

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public void write(GeneratedOutput output, OutputContext context) {
        Path outputDir = Paths.get(context.outputDirectory()).toAbsolutePath().normalize();
        log.info("Writing {} file(s) to {}", output.files().size(), outputDir);

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }
        for (GeneratedFile file : output.files()) {
            writeFile(outputDir, file);
        }
    }

    private void writeFile(Path outputDir, GeneratedFile file) {
        Path target = outputDir.resolve(file.relativePath()).normalize();
        if (!target.startsWith(outputDir)) {
            throw new IllegalArgumentException("File path escapes the output directory: " + file.relativePath());
        }
        try {
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, file.content(), StandardCharsets.UTF_8);
            log.debug("Wrote {} ({} chars)", target, file.content().length());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + file.relativePath(), e);
        }
    }
}
