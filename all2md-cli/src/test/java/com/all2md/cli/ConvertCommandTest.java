package com.all2md.cli;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ConvertCommand}.
 */
class ConvertCommandTest extends CommandTestSupport {

    @Test
    void convert_markdownToJsonAndBack_preservesContent() throws Exception {
        // Given
        Path guide = write("guide.md", GUIDE);
        Path json = tempDir.resolve("guide.json");

        // When
        int toJson = run("convert", guide.toString(), "-c", noConfig(), "--to", "json", "-o", json.toString());
        int toMarkdown = run("convert", json.toString(), "-c", noConfig(), "--to", "markdown");

        // Then
        assertThat(toJson).isZero();
        assertThat(toMarkdown).isZero();
        assertThat(Files.readString(json, StandardCharsets.UTF_8)).contains("\"Heading\"");
        assertThat(stdout()).contains("# Intro\n\nWelcome to the guide.\n\n## Install");
    }

    @Test
    void convert_withExplicitInputFormat_ignoresExtension() throws Exception {
        Path text = write("guide.txt", "# Title\n");

        int exitCode = run("convert", text.toString(), "-c", noConfig(), "--from", "markdown", "--to", "json");

        assertThat(exitCode).isZero();
        assertThat(stdout()).contains("\"schema_version\"");
    }

    @Test
    void convert_withUnknownFormat_listsAvailableFormats() throws Exception {
        Path guide = write("guide.md", GUIDE);

        int exitCode = run("convert", guide.toString(), "-c", noConfig(), "--to", "docx");

        assertThat(exitCode).isEqualTo(1);
        assertThat(stderr()).contains("Unknown output format: docx").contains("markdown").contains("json");
    }

    @Test
    void convert_withMalformedJson_fails() throws Exception {
        Path broken = write("broken.json", "{\"type\": \"Document\"");

        int exitCode = run("convert", broken.toString(), "-c", noConfig(), "--to", "markdown");

        assertThat(exitCode).isEqualTo(1);
        assertThat(stderr()).contains("✗ convert failed for");
    }
}
