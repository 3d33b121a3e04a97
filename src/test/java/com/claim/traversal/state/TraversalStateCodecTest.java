package com.claim.traversal.state;

import com.claim.traversal.core.model.ClaimStatus;
import com.claim.traversal.core.model.ForcingPointType;
import com.claim.traversal.core.model.Resolution;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TraversalStateCodecTest {

    @Test
    @DisplayName("Encoded state decodes to an equal state")
    void encodesAndDecodes() {
        Map<String, ClaimStatus> statuses = new LinkedHashMap<>();
        statuses.put("A", ClaimStatus.PRUNED);
        statuses.put("B", ClaimStatus.ACTIVE);
        Map<String, Resolution> resolutions = new LinkedHashMap<>();
        resolutions.put("g1", Resolution.conditional("g1", false, null));
        resolutions.put("fp_conflict_B::C", Resolution.conflict("fp_conflict_B::C", "B", "Beta"));
        TraversalState state = TraversalState.of(statuses, resolutions,
                List.of("✗ \"Applicable?\" — 1 claim(s) pruned", "→ Chose \"Beta\" over \"Gamma\""));

        String json = TraversalStateCodec.encode(state);

        assertTrue(json.contains("[\"A\",\"pruned\"]"));
        assertEquals(Optional.of(state), TraversalStateCodec.decode(json));
    }

    @Test
    @DisplayName("Plain object form is accepted")
    void decodesObjectForm() {
        String json = """
                {
                  "claimStatuses": {"A": "active", "B": "pruned", "C": "unknown"},
                  "resolutions": {"g1": {"type": "conditional", "satisfied": true, "userInput": "yes"}}
                }
                """;

        TraversalState state = TraversalStateCodec.decode(json).orElseThrow();

        assertTrue(state.isActive("A"));
        assertTrue(state.isPruned("B"));
        assertTrue(state.isActive("C"));
        Resolution resolution = state.getResolutions().get("g1");
        assertEquals("g1", resolution.getForcingPointId());
        assertEquals(ForcingPointType.CONDITIONAL, resolution.getType());
        assertTrue(resolution.isSatisfiedConditional());
        assertEquals("yes", resolution.getUserInput());
        assertTrue(state.getPathSteps().isEmpty());
    }

    @Test
    @DisplayName("Malformed entries are skipped")
    void skipsMalformedEntries() {
        String json = """
                {
                  "claimStatuses": [["A", "pruned"], ["B"], [1, "active"], "C"],
                  "resolutions": [["g1", {"type": "bogus"}], ["g2", "nope"], ["g3", {"type": "conflict", "selectedClaimId": "A"}]],
                  "pathSteps": ["one", 2, null, "two"]
                }
                """;

        TraversalState state = TraversalStateCodec.decode(json).orElseThrow();

        assertEquals(Map.of("A", ClaimStatus.PRUNED), state.getClaimStatuses());
        assertEquals(List.of("g3"), List.copyOf(state.getResolutions().keySet()));
        assertEquals(List.of("one", "two"), state.getPathSteps());
    }

    @Test
    @DisplayName("Non-object input decodes to empty")
    void rejectsNonObjects() {
        assertTrue(TraversalStateCodec.decode("[1, 2]").isEmpty());
        assertTrue(TraversalStateCodec.decode("{broken").isEmpty());
        assertTrue(TraversalStateCodec.decode("").isEmpty());
        assertTrue(TraversalStateCodec.decode((String) null).isEmpty());
    }
}
