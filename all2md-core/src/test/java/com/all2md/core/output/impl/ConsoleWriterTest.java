package com.all2md.core.output.impl;

import com.all2md.core.output.GeneratedFile;
import com.all2md.core.output.GeneratedOutput;
import com.all2md.core.output.OutputContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ConsoleWriter}.
 */
class ConsoleWriterTest {

    private ConsoleWriter writer;
    private final PrintStream originalOut = System.out;
    private ByteArrayOutputStream outputStream;

    @BeforeEach
    void setUp() {
        writer = new ConsoleWriter();
        outputStream = new ByteArrayOutputStream();
        System.setOut(new PrintStream(outputStream));
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
    }

    @Test
    void getId_returnsConsole() {
        assertThat(writer.getId()).isEqualTo("console");
    }

    @Test
    void write_withSingleFile_printsHeaderAndContent() {
        // Given
        String content = "# Part\n\nBody text.";
        GeneratedOutput output = new GeneratedOutput(List.of(new GeneratedFile("01-part.md", content, "text/markdown")));

        // When
        writer.write(output, new OutputContext("./out", Map.of()));

        // Then
        String console = outputStream.toString();
        assertThat(console).contains("File 1/1: 01-part.md");
        assertThat(console).contains(content);
        assertThat(console).doesNotContain("\u001B[");
    }

    @Test
    void write_withSeveralFiles_separatesThem() {
        GeneratedOutput output = new GeneratedOutput(List.of(
            new GeneratedFile("a.md", "A", "text/markdown"),
            new GeneratedFile("b.md", "B", "text/markdown")));

        writer.write(output, new OutputContext("./out", Map.of("console.separator", "=")));

        String console = outputStream.toString();
        assertThat(console).contains("File 2/2: b.md");
        assertThat(console).contains("=".repeat(80));
    }

    @Test
    void write_withColorsEnabled_usesAnsiCodes() {
        GeneratedOutput output = new GeneratedOutput(List.of(new GeneratedFile("a.md", "A", "text/markdown")));

        writer.write(output, new OutputContext("./out", Map.of("console.colors", "true")));

        assertThat(outputStream.toString()).contains("\u001B[36m");
    }
}
