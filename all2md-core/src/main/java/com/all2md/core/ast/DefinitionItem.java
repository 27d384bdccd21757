package com.all2md.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * One term of a {@link DefinitionList} with its descriptions. Not a node itself.
 *
 * @param term the term
 * @param descriptions descriptions of the term
 */
public record DefinitionItem(
    DefinitionTerm term,
    List<DefinitionDescription> descriptions
) {
    public DefinitionItem {
        Objects.requireNonNull(term, "term must not be null");
        descriptions = descriptions == null ? List.of() : List.copyOf(descriptions);
    }
}
