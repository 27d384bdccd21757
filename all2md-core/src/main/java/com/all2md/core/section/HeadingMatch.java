package com.all2md.core.section;

import com.all2md.core.ast.Heading;

/**
 * A heading found among a document's children.
 *
 * @param index index of the heading in the document's children
 * @param heading the heading
 */
public record HeadingMatch(int index, Heading heading) {
}
