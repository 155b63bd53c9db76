package io.crabcity.auth.utils;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.NoArgsConstructor;
import lombok.SneakyThrows;

import java.util.TreeMap;

import static lombok.AccessLevel.PRIVATE;

@NoArgsConstructor(access = PRIVATE)
public class JsonUtils {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    // Readers and writers are immutable snapshots of the mapper configuration.
    private static final ObjectWriter CANONICAL_WRITER = MAPPER.writer()
            .without(SerializationFeature.INDENT_OUTPUT);
    private static final ObjectReader TREE_READER = MAPPER.reader();

    public static JsonNode readTree(final String json) throws JsonProcessingException {
        return TREE_READER.readTree(json);
    }

    /**
     * Copy of {@code node} with object keys sorted at every level.
     */
    public static JsonNode canonicalize(final JsonNode node) {
        if (node.isObject()) {
            var sorted = new TreeMap<String, JsonNode>();
            node.fields().forEachRemaining(e -> sorted.put(e.getKey(), canonicalize(e.getValue())));

            var result = new ObjectNode(JsonNodeFactory.instance);
            sorted.forEach(result::set);

            return result;
        }
        if (node.isArray()) {
            var result = new ArrayNode(JsonNodeFactory.instance);
            node.forEach(element -> result.add(canonicalize(element)));

            return result;
        }

        return node.deepCopy();
    }

    /**
     * Compact UTF-8 JSON of the canonical form.
     */
    @SneakyThrows
    public static byte[] canonicalBytes(final JsonNode node) {
        return CANONICAL_WRITER.writeValueAsBytes(canonicalize(node));
    }
}
