package com.all2md.core.serialization;

/**
 * Thrown when a serialized node is missing a field, has a field of the wrong type, names an
 * unknown node type, or places a child where its parent cannot hold it.
 */
public class MalformedAstException extends SerializationException {

    public MalformedAstException(String message) {
        super(message);
    }

    public MalformedAstException(String message, Throwable cause) {
        super(message, cause);
    }
}
