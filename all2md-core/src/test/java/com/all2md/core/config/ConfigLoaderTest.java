package com.all2md.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve("all2md.yaml");
        Files.writeString(configFile, """
            slug:
              maxLength: 60
              separator: "_"

            footnotes:
              autoNumberStart: 10
              fallbackPrefix: fn
              notePriority: [endnote, footnote]

            toc:
              maxDepth: 2
              position: after_first_heading
              title: "Contents"

            serialization:
              pretty: false

            validation:
              allowRawHtml: true

            output:
              directory: "./build/docs"
              writer: console

            markdown:
              frontMatter: false
              escapeSpecial: false
              bulletSymbols: "*"
            """);

        All2MdConfig config = ConfigLoader.load(configFile);

        assertThat(config.slug().maxLength()).isEqualTo(60);
        assertThat(config.slug().separator()).isEqualTo("_");
        assertThat(config.footnotes().autoNumberStart()).isEqualTo(10);
        assertThat(config.footnotes().fallbackPrefix()).isEqualTo("fn");
        assertThat(config.footnotes().notePriority()).containsExactly("endnote", "footnote");
        assertThat(config.toc().maxDepth()).isEqualTo(2);
        assertThat(config.toc().position()).isEqualTo("after_first_heading");
        assertThat(config.toc().title()).isEqualTo("Contents");
        assertThat(config.serialization().pretty()).isFalse();
        assertThat(config.validation().allowRawHtml()).isTrue();
        assertThat(config.output().directory()).isEqualTo("./build/docs");
        assertThat(config.output().writer()).isEqualTo("console");
        assertThat(config.markdown().frontMatter()).isFalse();
        assertThat(config.markdown().escapeSpecial()).isFalse();
        assertThat(config.markdown().bulletSymbols()).isEqualTo("*");
    }

    @Test
    void load_partialYaml_fillsDefaults() throws IOException {
        Path configFile = tempDir.resolve("all2md.yaml");
        Files.writeString(configFile, """
            toc:
              title: "Overview"
            unknownSection:
              ignored: true
            """);

        All2MdConfig config = ConfigLoader.load(configFile);

        assertThat(config.toc().title()).isEqualTo("Overview");
        assertThat(config.toc().maxDepth()).isEqualTo(3);
        assertThat(config.toc().position()).isEqualTo("start");
        assertThat(config.slug()).isEqualTo(All2MdConfig.SlugConfig.DEFAULT);
        assertThat(config.markdown()).isEqualTo(All2MdConfig.MarkdownConfig.DEFAULT);
    }

    @Test
    void load_nonExistentFile_returnsDefaults() {
        Path configFile = tempDir.resolve("missing.yaml");

        All2MdConfig config = ConfigLoader.load(configFile);

        assertThat(config).isEqualTo(All2MdConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("all2md.yaml");
        Files.writeString(configFile, "toc: [unclosed");

        All2MdConfig config = ConfigLoader.load(configFile);

        assertThat(config).isEqualTo(All2MdConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("all2md.yaml");
        Files.writeString(configFile, "");

        All2MdConfig config = ConfigLoader.load(configFile);

        assertThat(config).isEqualTo(All2MdConfig.defaults());
    }

    @Test
    void load_directory_returnsDefaults() {
        assertThat(ConfigLoader.load(tempDir)).isEqualTo(All2MdConfig.defaults());
    }

    @Test
    void defaults_matchDocumentedValues() {
        All2MdConfig config = All2MdConfig.defaults();

        assertThat(config.footnotes().autoNumberStart()).isEqualTo(1);
        assertThat(config.footnotes().fallbackPrefix()).isEqualTo("note");
        assertThat(config.serialization().pretty()).isTrue();
        assertThat(config.validation().allowRawHtml()).isFalse();
        assertThat(config.output().writer()).isEqualTo("filesystem");
    }
}
