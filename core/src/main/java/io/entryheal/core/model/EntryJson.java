package io.entryheal.core.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JSON helpers shared by strategies and the orchestrator: entry byte parsing, serialization and
 * reference-id extraction.
 *
 * <p>Thread-safe: stateless apart from a shared, immutable {@link ObjectMapper}.
 */
public final class EntryJson {

    // Bytes with content after the first JSON value are not an entry.
    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();

    private EntryJson() {}

    /** The shared mapper. Do not reconfigure it. */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Parses entry bytes as a JSON tree.
     *
     * @return the tree, or empty if the bytes are empty, not JSON, or hold more than one value
     */
    public static Optional<JsonNode> parse(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return Optional.empty();
        }
        try {
            JsonNode node = MAPPER.readTree(bytes);
            return node == null || node.isMissingNode() ? Optional.empty() : Optional.of(node);
        } catch (IOException e) {
            return Optional.empty();
        }
    }

    /** Parses entry bytes, yielding a {@link MissingNode} when they are not JSON. */
    public static JsonNode parseOrMissing(byte[] bytes) {
        return parse(bytes).orElse(MissingNode.getInstance());
    }

    /**
     * Serializes a tree to UTF-8 JSON bytes.
     *
     * @throws IllegalArgumentException if the tree cannot be serialized
     */
    public static byte[] toBytes(JsonNode node) {
        try {
            return MAPPER.writeValueAsBytes(node);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize entry to JSON", e);
        }
    }

    /**
     * Extracts the ids held by a reference field. Absent, null, non-text and blank values are
     * skipped; a single-id field that holds an array is read as an array.
     */
    public static List<String> referencedIds(JsonNode entry, ReferenceField reference) {
        List<String> ids = new ArrayList<>();
        JsonNode value = entry.path(reference.field());
        if (value.isArray()) {
            value.forEach(item -> addId(ids, item));
        } else {
            addId(ids, value);
        }
        return ids;
    }

    private static void addId(List<String> ids, JsonNode node) {
        if (node.isTextual() && !node.asText().isBlank()) {
            ids.add(node.asText());
        }
    }
}
