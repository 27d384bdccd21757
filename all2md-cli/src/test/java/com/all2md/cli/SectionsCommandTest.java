package com.all2md.cli;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link SectionsCommand}.
 */
class SectionsCommandTest extends CommandTestSupport {

    @Test
    void sections_withHeadings_listsSelectorsAndIndentsSubsections() throws Exception {
        Path guide = write("guide.md", GUIDE);

        int exitCode = run("sections", guide.toString(), "-c", noConfig());

        assertThat(exitCode).isZero();
        assertThat(stdout())
            .startsWith("Document Sections:")
            .contains("[#0] # Intro (")
            .contains("\n  [#1] ## Install (")
            .contains("\n[#2] # Usage (");
    }

    @Test
    void sections_withPreamble_listsItFirst() throws Exception {
        Path notes = write("notes.md", "Before any heading.\n\n# Only\n");

        run("sections", notes.toString(), "-c", noConfig());

        assertThat(stdout()).contains("[#0] (preamble) (1 nodes)").contains("[#1] # Only (");
    }

    @Test
    void sections_withoutHeadings_printsNotice() throws Exception {
        Path plain = write("plain.md", "");

        int exitCode = run("sections", plain.toString(), "-c", noConfig());

        assertThat(exitCode).isZero();
        assertThat(stdout()).contains("No sections found in document.");
    }

    @Test
    void sections_withMissingFile_failsWithMessage() {
        int exitCode = run("sections", tempDir.resolve("nope.md").toString(), "-c", noConfig());

        assertThat(exitCode).isEqualTo(1);
        assertThat(stderr()).contains("✗ sections failed for").contains("File not found");
    }
}
