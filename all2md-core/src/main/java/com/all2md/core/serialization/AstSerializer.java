package com.all2md.core.serialization;

import com.all2md.core.ast.Document;
import com.all2md.core.ast.Node;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Converts documents to and from a JSON-compatible map form and JSON text.
 *
 * <p>The map form tags every node with its variant name under {@code type} and carries a
 * {@code schema_version} at the root:
 * <pre>{@code
 * {"type": "Document", "schema_version": 1, "children": [
 *     {"type": "Heading", "level": 1, "content": [{"type": "Text", "content": "Title", "metadata": {}}], "metadata": {}}
 * ], "metadata": {}}
 * }</pre>
 *
 * <p>Input without a {@code schema_version} that uses the {@code node_type} discriminator is
 * read as the legacy version 0 format after logging a warning. Any other missing or unknown
 * version is rejected with {@link UnsupportedSchemaVersionException}.
 */
public final class AstSerializer {

    public static final int SCHEMA_VERSION = 1;
    public static final String SCHEMA_VERSION_KEY = "schema_version";
    public static final String TYPE_KEY = "type";
    public static final String LEGACY_TYPE_KEY = "node_type";

    private static final Logger log = LoggerFactory.getLogger(AstSerializer.class);
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
        .enable(DeserializationFeature.USE_LONG_FOR_INTS);
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private AstSerializer() {
    }

    /**
     * Encodes a document into the map form.
     *
     * @param document document to encode
     * @return mutable ordered map
     */
    public static Map<String, Object> astToDict(Document document) {
        Objects.requireNonNull(document, "document must not be null");
        Map<String, Object> encoded = document.accept(new AstEncoder());
        Map<String, Object> result = new LinkedHashMap<>();
        result.put(TYPE_KEY, encoded.remove(TYPE_KEY));
        result.put(SCHEMA_VERSION_KEY, SCHEMA_VERSION);
        result.putAll(encoded);
        return result;
    }

    /**
     * Decodes the map form into a document.
     *
     * @param data encoded document
     * @return decoded document
     * @throws UnsupportedSchemaVersionException if the version is missing or unknown
     * @throws MalformedAstException if any node is invalid
     */
    public static Document dictToAst(Map<String, Object> data) {
        if (data == null) {
            throw new MalformedAstException("Expected an object at $, got null");
        }
        String typeKey = typeKeyFor(data);
        Node root = new AstDecoder(typeKey).decode(data, "$");
        if (root instanceof Document document) {
            return document;
        }
        throw new MalformedAstException("Root node must be a Document, got " + root.nodeType());
    }

    public static String astToJson(Document document) {
        return astToJson(document, false);
    }

    /**
     * Encodes a document as JSON text.
     *
     * @param document document to encode
     * @param pretty whether to indent the output
     * @return JSON text
     */
    public static String astToJson(Document document, boolean pretty) {
        Map<String, Object> data = astToDict(document);
        try {
            return pretty
                ? JSON_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(data)
                : JSON_MAPPER.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to write document as JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Decodes JSON text into a document.
     *
     * @param json JSON text
     * @return decoded document
     * @throws MalformedJsonException if the text is not a JSON object
     * @throws UnsupportedSchemaVersionException if the version is missing or unknown
     * @throws MalformedAstException if any node is invalid
     */
    public static Document jsonToAst(String json) {
        Objects.requireNonNull(json, "json must not be null");
        Map<String, Object> data;
        try {
            data = JSON_MAPPER.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new MalformedJsonException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (data == null) {
            throw new MalformedJsonException("Invalid JSON: expected an object, got null", null);
        }
        return dictToAst(data);
    }

    private static String typeKeyFor(Map<String, Object> data) {
        Object version = data.get(SCHEMA_VERSION_KEY);
        if (version == null) {
            if (data.containsKey(LEGACY_TYPE_KEY) && !data.containsKey(TYPE_KEY)) {
                log.warn("Document has no {}; decoding as legacy version 0 format", SCHEMA_VERSION_KEY);
                return LEGACY_TYPE_KEY;
            }
            throw new UnsupportedSchemaVersionException(null);
        }
        if ((version instanceof Integer || version instanceof Long) && ((Number) version).longValue() == SCHEMA_VERSION) {
            return TYPE_KEY;
        }
        throw new UnsupportedSchemaVersionException(version);
    }
}
