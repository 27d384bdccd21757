package com.all2md.core.ast.builder;

import com.all2md.core.ast.Block;
import com.all2md.core.ast.CodeBlock;
import com.all2md.core.ast.Document;
import com.all2md.core.ast.Heading;
import com.all2md.core.ast.Inline;
import com.all2md.core.ast.Paragraph;
import com.all2md.core.ast.ThematicBreak;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Fluent builder for {@link Document} trees.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * Document doc = new DocumentBuilder()
 *     .metadata("title", "Report")
 *     .heading(1, "Introduction")
 *     .paragraph("Some text.")
 *     .thematicBreak()
 *     .build();
 * }</pre>
 */
public class DocumentBuilder {

    private final List<Block> children = new ArrayList<>();
    private final Map<String, Object> metadata = new LinkedHashMap<>();

    public DocumentBuilder node(Block node) {
        children.add(Objects.requireNonNull(node, "node must not be null"));
        return this;
    }

    public DocumentBuilder nodes(List<? extends Block> nodes) {
        nodes.forEach(this::node);
        return this;
    }

    public DocumentBuilder heading(int level, List<Inline> content) {
        return node(new Heading(level, content));
    }

    public DocumentBuilder heading(int level, String text) {
        return node(new Heading(level, text));
    }

    public DocumentBuilder paragraph(List<Inline> content) {
        return node(new Paragraph(content));
    }

    public DocumentBuilder paragraph(String text) {
        return node(new Paragraph(text));
    }

    public DocumentBuilder codeBlock(String content, String language) {
        return node(new CodeBlock(content, language));
    }

    public DocumentBuilder thematicBreak() {
        return node(new ThematicBreak());
    }

    public DocumentBuilder metadata(String key, Object value) {
        metadata.put(key, value);
        return this;
    }

    /**
     * @return document holding every node added so far
     */
    public Document build() {
        return new Document(children, metadata);
    }
}
