package com.claim.traversal.state;

import com.claim.traversal.core.model.ClaimStatus;
import com.claim.traversal.core.model.ForcingPointType;
import com.claim.traversal.core.model.Resolution;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JSON codec for {@link TraversalState}.
 *
 * <p>Encoded form:</p>
 * <pre>
 * {
 *   "claimStatuses": [["c1", "active"], ["c2", "pruned"]],
 *   "resolutions":   [["g1", {"forcingPointId": "g1", "type": "conditional", "satisfied": false}]],
 *   "pathSteps":     ["✗ \"Applicable?\" — 1 claim(s) pruned"]
 * }
 * </pre>
 *
 * <p>Decoding also accepts plain objects for {@code claimStatuses} and {@code resolutions},
 * reads unknown status values as active, and treats missing parts as empty.
 * Input that is not a JSON object decodes to {@link Optional#empty()}.</p>
 */
public final class TraversalStateCodec {
    private static final Logger log = LoggerFactory.getLogger(TraversalStateCodec.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private TraversalStateCodec() {
        // utility class
    }

    public static String encode(TraversalState state) {
        ObjectNode root = MAPPER.createObjectNode();

        ArrayNode statuses = root.putArray("claimStatuses");
        state.getClaimStatuses().forEach((claimId, status) ->
                statuses.addArray().add(claimId).add(status.getValue()));

        ArrayNode resolutions = root.putArray("resolutions");
        state.getResolutions().forEach((fpId, resolution) -> {
            ArrayNode entry = resolutions.addArray();
            entry.add(fpId);
            entry.add(encodeResolution(resolution));
        });

        ArrayNode steps = root.putArray("pathSteps");
        state.getPathSteps().forEach(steps::add);

        try {
            return MAPPER.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode traversal state", e);
        }
    }

    public static Optional<TraversalState> decode(String json) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            return decode(MAPPER.readTree(json));
        } catch (JsonProcessingException e) {
            log.warn("traversal.state.decode.failed error={}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    public static Optional<TraversalState> decode(JsonNode root) {
        if (root == null || !root.isObject()) {
            return Optional.empty();
        }
        return Optional.of(TraversalState.of(
                decodeStatuses(root.get("claimStatuses")),
                decodeResolutions(root.get("resolutions")),
                decodeSteps(root.get("pathSteps"))));
    }

    private static ObjectNode encodeResolution(Resolution resolution) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("forcingPointId", resolution.getForcingPointId());
        node.put("type", resolution.getType().getValue());
        if (resolution.getSatisfied() != null) {
            node.put("satisfied", resolution.getSatisfied());
        }
        if (resolution.getUserInput() != null) {
            node.put("userInput", resolution.getUserInput());
        }
        if (resolution.getSelectedClaimId() != null) {
            node.put("selectedClaimId", resolution.getSelectedClaimId());
        }
        if (resolution.getSelectedLabel() != null) {
            node.put("selectedLabel", resolution.getSelectedLabel());
        }
        return node;
    }

    private static Map<String, ClaimStatus> decodeStatuses(JsonNode node) {
        Map<String, ClaimStatus> statuses = new LinkedHashMap<>();
        if (node == null) {
            return statuses;
        }
        if (node.isArray()) {
            for (JsonNode entry : node) {
                if (entry.isArray() && entry.size() >= 2 && entry.get(0).isTextual()) {
                    statuses.put(entry.get(0).asText(), ClaimStatus.fromValue(entry.get(1).asText()));
                }
            }
        } else if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                statuses.put(field.getKey(), ClaimStatus.fromValue(field.getValue().asText()));
            }
        }
        return statuses;
    }

    private static Map<String, Resolution> decodeResolutions(JsonNode node) {
        Map<String, Resolution> resolutions = new LinkedHashMap<>();
        if (node == null) {
            return resolutions;
        }
        if (node.isArray()) {
            for (JsonNode entry : node) {
                if (entry.isArray() && entry.size() >= 2 && entry.get(0).isTextual()) {
                    String fpId = entry.get(0).asText();
                    decodeResolution(fpId, entry.get(1)).ifPresent(r -> resolutions.put(fpId, r));
                }
            }
        } else if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                decodeResolution(field.getKey(), field.getValue())
                        .ifPresent(r -> resolutions.put(field.getKey(), r));
            }
        }
        return resolutions;
    }

    private static Optional<Resolution> decodeResolution(String fpId, JsonNode node) {
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        Optional<ForcingPointType> type = ForcingPointType.fromValue(node.path("type").asText(""));
        if (type.isEmpty()) {
            log.debug("traversal.state.decode resolution={} skipped reason=unknown-type", fpId);
            return Optional.empty();
        }
        return Optional.of(Resolution.builder()
                .forcingPointId(node.path("forcingPointId").asText(fpId))
                .type(type.get())
                .satisfied(node.path("satisfied").isBoolean() ? node.get("satisfied").asBoolean() : null)
                .userInput(textOrNull(node, "userInput"))
                .selectedClaimId(textOrNull(node, "selectedClaimId"))
                .selectedLabel(textOrNull(node, "selectedLabel"))
                .build());
    }

    private static List<String> decodeSteps(JsonNode node) {
        List<String> steps = new ArrayList<>();
        if (node != null && node.isArray()) {
            for (JsonNode step : node) {
                if (step.isTextual()) {
                    steps.add(step.asText());
                }
            }
        }
        return steps;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }
}
