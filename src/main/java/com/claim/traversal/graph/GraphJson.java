package com.claim.traversal.graph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Reads upstream graph JSON into the untyped tree accepted by {@link GraphNormalizer}.
 *
 * <p>Malformed JSON is logged and read as an empty graph, so a bad payload yields
 * no forcing points rather than an exception.</p>
 */
public final class GraphJson {
    private static final Logger log = LoggerFactory.getLogger(GraphJson.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> TREE = new TypeReference<>() {};

    private GraphJson() {
        // utility class
    }

    public static Map<String, Object> read(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            Map<String, Object> tree = MAPPER.readValue(json, TREE);
            return tree != null ? tree : Map.of();
        } catch (JsonProcessingException e) {
            log.warn("graph.json.invalid error={}", e.getOriginalMessage());
            return Map.of();
        }
    }

    public static Map<String, Object> read(InputStream input) {
        if (input == null) {
            return Map.of();
        }
        try {
            Map<String, Object> tree = MAPPER.readValue(input, TREE);
            return tree != null ? tree : Map.of();
        } catch (IOException e) {
            log.warn("graph.json.unreadable error={}", e.getMessage());
            return Map.of();
        }
    }

    /**
     * Parses and normalizes in one step.
     */
    public static NormalizedGraph normalize(String json) {
        return GraphNormalizer.normalize(read(json));
    }
}
