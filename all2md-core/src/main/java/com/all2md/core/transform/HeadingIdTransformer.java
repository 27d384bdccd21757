package com.all2md.core.transform;

import com.all2md.core.ast.Heading;
import com.all2md.core.ast.Metadata;
import com.all2md.core.ast.Node;
import com.all2md.core.ast.Nodes;
import com.all2md.core.util.Slugs;
import com.all2md.core.visitor.NodeCollector;

import java.util.HashSet;
import java.util.Set;

/**
 * Stores a unique anchor slug under the {@code id} metadata key of every heading.
 *
 * <p>Headings that already carry an id keep it. All existing ids are reserved before any slug
 * is generated, so generated slugs never collide with them. Uniqueness is scoped to one
 * {@link #transform} call.
 */
public class HeadingIdTransformer extends NodeTransformer {

    private final String prefix;
    private final Set<String> seen = new HashSet<>();

    public HeadingIdTransformer() {
        this("");
    }

    /**
     * @param prefix text prepended to every generated id, e.g. {@code "doc-"}
     */
    public HeadingIdTransformer(String prefix) {
        this.prefix = prefix == null ? "" : prefix;
    }

    @Override
    public Node transform(Node node) {
        seen.clear();
        for (Heading heading : NodeCollector.collect(node, Heading.class)) {
            if (heading.metadata().get(Heading.ID_KEY) instanceof String id && !id.isEmpty()) {
                seen.add(id.startsWith(prefix) ? id.substring(prefix.length()) : id);
            }
        }
        return super.transform(node);
    }

    @Override
    public Node visitHeading(Heading node) {
        Heading rebuilt = (Heading) visitDefault(node);
        Object existing = node.metadata().get(Heading.ID_KEY);
        if (existing instanceof String id && !id.isEmpty()) {
            return rebuilt;
        }
        String slug = Slugs.slugify(Nodes.extractText(node), seen);
        return rebuilt.withMetadata(Metadata.with(rebuilt.metadata(), Heading.ID_KEY, prefix + slug));
    }
}
