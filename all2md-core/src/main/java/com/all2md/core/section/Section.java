package com.all2md.core.section;

import com.all2md.core.ast.Block;
import com.all2md.core.ast.Document;
import com.all2md.core.ast.Heading;
import com.all2md.core.ast.Nodes;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A heading and the sibling blocks that belong to it.
 *
 * <p>Indexes refer to the children of the document the section was read from:
 * {@code [startIndex, endIndex)} covers the heading and its content. The preamble
 * pseudo-section has no heading and level 0.
 *
 * @param heading section heading, or null for the preamble
 * @param content blocks after the heading up to the next heading of equal or higher rank
 * @param level heading level, or 0 for the preamble
 * @param startIndex index of the heading (or first preamble block)
 * @param endIndex exclusive end index
 */
public record Section(
    Heading heading,
    List<Block> content,
    int level,
    int startIndex,
    int endIndex
) {
    public Section {
        content = content == null ? List.of() : List.copyOf(content);
        if (startIndex < 0 || endIndex < startIndex) {
            throw new IllegalArgumentException("Invalid section span [" + startIndex + ", " + endIndex + ")");
        }
    }

    public boolean isPreamble() {
        return heading == null;
    }

    /**
     * @return flattened heading text, or an empty string for the preamble
     */
    public String headingText() {
        return heading == null ? "" : Nodes.extractText(heading);
    }

    /**
     * @return the heading (if any) followed by the content
     */
    public List<Block> nodes() {
        List<Block> nodes = new ArrayList<>(content.size() + 1);
        if (heading != null) {
            nodes.add(heading);
        }
        nodes.addAll(content);
        return nodes;
    }

    public Document toDocument() {
        return new Document(nodes());
    }

    public Document toDocument(Map<String, Object> metadata) {
        return new Document(nodes(), metadata);
    }
}
