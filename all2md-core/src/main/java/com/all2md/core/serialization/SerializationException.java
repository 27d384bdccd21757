package com.all2md.core.serialization;

import com.all2md.core.All2MdException;

/**
 * Base class for failures while encoding or decoding the serialized tree form.
 *
 * <p>Decoding never returns a partial tree: it either succeeds or throws a subclass of this.
 */
public class SerializationException extends All2MdException {

    public SerializationException(String message) {
        super(message);
    }

    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
