package com.all2md.core.serialization;

/**
 * Thrown when serialized text is not valid JSON or is not a JSON object.
 */
public class MalformedJsonException extends SerializationException {

    public MalformedJsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
