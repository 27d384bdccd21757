package com.all2md.core.transform;

import com.all2md.core.ast.Heading;
import com.all2md.core.ast.Node;

/**
 * Shifts every heading level by a fixed offset, clamped to a level range.
 */
public class HeadingLevelTransformer extends NodeTransformer {

    private final int offset;
    private final int minLevel;
    private final int maxLevel;

    public HeadingLevelTransformer(int offset) {
        this(offset, Heading.MIN_LEVEL, Heading.MAX_LEVEL);
    }

    /**
     * @param offset levels to add, negative to promote headings
     * @param minLevel lowest level a heading may end up at
     * @param maxLevel highest level a heading may end up at
     */
    public HeadingLevelTransformer(int offset, int minLevel, int maxLevel) {
        if (minLevel < Heading.MIN_LEVEL || maxLevel > Heading.MAX_LEVEL || minLevel > maxLevel) {
            throw new IllegalArgumentException(
                "Invalid level range: min=" + minLevel + ", max=" + maxLevel + "; expected 1 <= min <= max <= 6");
        }
        this.offset = offset;
        this.minLevel = minLevel;
        this.maxLevel = maxLevel;
    }

    @Override
    public Node visitHeading(Heading node) {
        Heading rebuilt = (Heading) visitDefault(node);
        int level = Math.max(minLevel, Math.min(maxLevel, node.level() + offset));
        return rebuilt.withLevel(level);
    }
}
