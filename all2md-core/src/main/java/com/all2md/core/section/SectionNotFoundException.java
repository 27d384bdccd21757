package com.all2md.core.section;

import com.all2md.core.All2MdException;

/**
 * Thrown when a {@link SectionTarget} matches no section.
 */
public class SectionNotFoundException extends All2MdException {

    private final SectionTarget target;

    public SectionNotFoundException(SectionTarget target, int sectionCount) {
        super("Section not found: " + target + " (document has " + sectionCount + " section(s))");
        this.target = target;
    }

    public SectionTarget getTarget() {
        return target;
    }
}
