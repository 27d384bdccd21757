package com.all2md.core.ast;

import com.all2md.core.All2MdException;

/**
 * Thrown when a tree is manipulated in a way its node variants cannot support.
 *
 * <p>Always indicates a programming or parser bug; callers should not try to recover.
 */
public class StructuralException extends All2MdException {

    public StructuralException(String message) {
        super(message);
    }
}
