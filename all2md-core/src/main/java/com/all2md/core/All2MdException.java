package com.all2md.core;

/**
 * Root of the unchecked exception hierarchy thrown by the all2md core.
 *
 * <p>Structural and serialization failures propagate to the immediate caller as
 * subclasses of this type. Recoverable conditions such as dangling footnote
 * references or validation findings are reported as data instead.
 */
public class All2MdException extends RuntimeException {

    public All2MdException(String message) {
        super(message);
    }

    public All2MdException(String message, Throwable cause) {
        super(message, cause);
    }
}
