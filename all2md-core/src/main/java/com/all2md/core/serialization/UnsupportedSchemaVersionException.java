package com.all2md.core.serialization;

/**
 * Thrown when the serialized form carries a missing or unrecognized {@code schema_version}.
 */
public class UnsupportedSchemaVersionException extends SerializationException {

    private final Object version;

    public UnsupportedSchemaVersionException(Object version) {
        super(version == null
            ? "Missing schema_version"
            : "Unsupported schema_version: " + version + " (supported: " + AstSerializer.SCHEMA_VERSION + ")");
        this.version = version;
    }

    /**
     * @return the version found in the input, or null when it was missing
     */
    public Object getVersion() {
        return version;
    }
}
