package com.all2md.cli;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ListCommand}.
 */
class ListCommandTest extends CommandTestSupport {

    @Test
    void list_parsers_showsIdsAndExtensions() {
        int exitCode = run("list", "parsers");

        assertThat(exitCode).isZero();
        assertThat(stdout())
            .contains("Available Parsers:")
            .contains("  • markdown")
            .contains("  • json")
            .contains("Extensions: [markdown, md]");
    }

    @Test
    void list_renderers_showsExtensions() {
        run("list", "renderers");

        assertThat(stdout()).contains("  • markdown").contains("File Extension: .md").contains("File Extension: .json");
    }

    @Test
    void list_writers_showsBothWriters() {
        run("list", "writers");

        assertThat(stdout()).contains("  • filesystem").contains("  • console");
    }

    @Test
    void list_unknownType_returnsError() {
        assertThat(run("list", "widgets")).isEqualTo(1);
    }
}
