package com.all2md.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Root configuration for all2md.
 *
 * <p>Loaded from {@code all2md.yaml}. Every section and field is optional; anything missing
 * takes the value from {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * slug:
 *   maxLength: 60
 *   separator: "-"
 *
 * footnotes:
 *   autoNumberStart: 1
 *   fallbackPrefix: note
 *   notePriority: [footnote, endnote]
 *
 * toc:
 *   maxDepth: 3
 *   position: after_first_heading
 *   title: "Contents"
 *
 * serialization:
 *   pretty: true
 *
 * validation:
 *   allowRawHtml: false
 *
 * output:
 *   directory: "./out"
 *   writer: filesystem
 *
 * markdown:
 *   frontMatter: true
 *   escapeSpecial: true
 *   bulletSymbols: "-*+"
 * }</pre>
 *
 * @param slug slug generation settings
 * @param footnotes footnote collector settings
 * @param toc table of contents settings
 * @param serialization JSON output settings
 * @param validation validator settings
 * @param output output writer settings
 * @param markdown Markdown renderer settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record All2MdConfig(
    @JsonProperty("slug") SlugConfig slug,
    @JsonProperty("footnotes") FootnoteConfig footnotes,
    @JsonProperty("toc") TocConfig toc,
    @JsonProperty("serialization") SerializationConfig serialization,
    @JsonProperty("validation") ValidationConfig validation,
    @JsonProperty("output") OutputConfig output,
    @JsonProperty("markdown") MarkdownConfig markdown
) {
    public All2MdConfig {
        slug = slug == null ? SlugConfig.DEFAULT : slug;
        footnotes = footnotes == null ? FootnoteConfig.DEFAULT : footnotes;
        toc = toc == null ? TocConfig.DEFAULT : toc;
        serialization = serialization == null ? SerializationConfig.DEFAULT : serialization;
        validation = validation == null ? ValidationConfig.DEFAULT : validation;
        output = output == null ? OutputConfig.DEFAULT : output;
        markdown = markdown == null ? MarkdownConfig.DEFAULT : markdown;
    }

    /**
     * @return configuration with every section at its default
     */
    public static All2MdConfig defaults() {
        return new All2MdConfig(null, null, null, null, null, null, null);
    }

    /**
     * Slug generation.
     *
     * @param maxLength maximum slug length, 0 for unlimited
     * @param separator word separator
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SlugConfig(
        @JsonProperty("maxLength") Integer maxLength,
        @JsonProperty("separator") String separator
    ) {
        public static final SlugConfig DEFAULT = new SlugConfig(0, "-");

        public SlugConfig {
            maxLength = maxLength == null ? 0 : maxLength;
            separator = separator == null || separator.isEmpty() ? "-" : separator;
        }
    }

    /**
     * Footnote numbering.
     *
     * @param autoNumberStart first auto-assigned footnote number
     * @param fallbackPrefix identifier used when a raw identifier sanitizes to nothing
     * @param notePriority order in which note types are emitted
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FootnoteConfig(
        @JsonProperty("autoNumberStart") Integer autoNumberStart,
        @JsonProperty("fallbackPrefix") String fallbackPrefix,
        @JsonProperty("notePriority") List<String> notePriority
    ) {
        public static final FootnoteConfig DEFAULT = new FootnoteConfig(1, "note", List.of("footnote", "endnote"));

        public FootnoteConfig {
            autoNumberStart = autoNumberStart == null ? 1 : autoNumberStart;
            fallbackPrefix = fallbackPrefix == null || fallbackPrefix.isEmpty() ? "note" : fallbackPrefix;
            notePriority = notePriority == null ? List.of("footnote", "endnote") : List.copyOf(notePriority);
        }
    }

    /**
     * Table of contents.
     *
     * @param maxDepth deepest heading level listed
     * @param position {@code start} or {@code after_first_heading}
     * @param title title heading text, empty for none
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TocConfig(
        @JsonProperty("maxDepth") Integer maxDepth,
        @JsonProperty("position") String position,
        @JsonProperty("title") String title
    ) {
        public static final TocConfig DEFAULT = new TocConfig(3, "start", "Table of Contents");

        public TocConfig {
            maxDepth = maxDepth == null ? 3 : maxDepth;
            position = position == null ? "start" : position;
            title = title == null ? "Table of Contents" : title;
        }
    }

    /**
     * JSON output.
     *
     * @param pretty whether to indent JSON output
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SerializationConfig(
        @JsonProperty("pretty") Boolean pretty
    ) {
        public static final SerializationConfig DEFAULT = new SerializationConfig(true);

        public SerializationConfig {
            pretty = pretty == null || pretty;
        }
    }

    /**
     * Validation.
     *
     * @param allowRawHtml whether raw HTML nodes are acceptable
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ValidationConfig(
        @JsonProperty("allowRawHtml") Boolean allowRawHtml
    ) {
        public static final ValidationConfig DEFAULT = new ValidationConfig(false);

        public ValidationConfig {
            allowRawHtml = allowRawHtml != null && allowRawHtml;
        }
    }

    /**
     * Output of multi-file results such as splits.
     *
     * @param directory default output directory
     * @param writer output writer id, e.g. {@code filesystem} or {@code console}
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("directory") String directory,
        @JsonProperty("writer") String writer
    ) {
        public static final OutputConfig DEFAULT = new OutputConfig("./out", "filesystem");

        public OutputConfig {
            directory = directory == null ? "./out" : directory;
            writer = writer == null ? "filesystem" : writer;
        }
    }

    /**
     * Markdown rendering.
     *
     * @param frontMatter whether document metadata is written as YAML front matter
     * @param escapeSpecial whether Markdown punctuation in text is backslash-escaped
     * @param bulletSymbols bullet characters cycled by list depth
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MarkdownConfig(
        @JsonProperty("frontMatter") Boolean frontMatter,
        @JsonProperty("escapeSpecial") Boolean escapeSpecial,
        @JsonProperty("bulletSymbols") String bulletSymbols
    ) {
        public static final MarkdownConfig DEFAULT = new MarkdownConfig(true, true, "-*+");

        public MarkdownConfig {
            frontMatter = frontMatter == null || frontMatter;
            escapeSpecial = escapeSpecial == null || escapeSpecial;
            bulletSymbols = bulletSymbols == null || bulletSymbols.isEmpty() ? "-*+" : bulletSymbols;
        }
    }
}
