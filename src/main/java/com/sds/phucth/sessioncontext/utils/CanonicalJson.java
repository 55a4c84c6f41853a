package com.sds.phucth.sessioncontext.utils;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.TreeMap;

/**
 * Key-sorted JSON so that equal payloads always produce identical bytes, whatever the
 * insertion order of their maps.
 */
public final class CanonicalJson {
    private static final ObjectMapper M = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .setSerializationInclusion(JsonInclude.Include.ALWAYS)
            .registerModule(new JavaTimeModule());

    private CanonicalJson() {
    }

    public static byte[] toCanonicalBytes(Object value) {
        try {
            JsonNode sorted = sort(M.valueToTree(value));
            return M.writeValueAsBytes(sorted);
        } catch (Exception e) {
            throw new IllegalArgumentException("Value is not JSON serializable", e);
        }
    }

    /**
     * SHA-256 of the canonical form, used to tie a rendered summary to the payload it shows.
     */
    public static String fingerprint(Object value) {
        return Hashing.sha256Hex(toCanonicalBytes(value));
    }

    private static JsonNode sort(JsonNode node) {
        if (node.isObject()) {
            ObjectNode obj = (ObjectNode) node;
            ObjectNode out = M.createObjectNode();
            TreeMap<String, JsonNode> map = new TreeMap<>();
            obj.fields().forEachRemaining(e -> map.put(e.getKey(), sort(e.getValue())));
            map.forEach(out::set);
            return out;
        } else if (node.isArray()) {
            ArrayNode arr = (ArrayNode) node;
            ArrayNode out = M.createArrayNode();
            for (JsonNode n : arr) {
                out.add(sort(n));
            }
            return out;
        } else {
            return node;
        }
    }
}
