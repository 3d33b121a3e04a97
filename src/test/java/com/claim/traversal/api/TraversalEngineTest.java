package com.claim.traversal.api;

import com.claim.traversal.core.model.Claim;
import com.claim.traversal.core.model.ForcingPoint;
import com.claim.traversal.core.model.ForcingPointType;
import com.claim.traversal.graph.GraphJson;
import com.claim.traversal.graph.GraphNormalizer;
import com.claim.traversal.graph.NormalizedGraph;
import com.claim.traversal.state.TraversalState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TraversalEngine Tests")
class TraversalEngineTest {

    private static final List<Map<String, Object>> CLAIMS = List.of(
            Map.of("id", "A", "label", "Label A"),
            Map.of("id", "B", "label", "Label B"));

    private static List<Claim> claimsOf(Map<String, Object> graph) {
        return GraphNormalizer.normalize(graph).claims();
    }

    @Test
    @DisplayName("A failed conditional prunes its claim and reports the step")
    void conditionalScenario() {
        Map<String, Object> graph = Map.of(
                "claims", CLAIMS,
                "conditionals", List.of(Map.of("id", "g1", "affectedClaims", List.of("A"),
                        "question", "Applicable?")));
        List<Claim> claims = claimsOf(graph);

        List<ForcingPoint> fps = TraversalEngine.extractForcingPoints(graph);
        assertEquals(1, fps.size());
        assertEquals(0, fps.get(0).getTier());

        TraversalState state = TraversalEngine.initTraversalState(claims);
        assertEquals("No constraints applied.", TraversalEngine.getPathSummary(state));

        state = TraversalEngine.resolveConditional(state, "g1", fps.get(0), false);

        assertEquals(List.of(claims.get(1)), TraversalEngine.getActiveClaims(claims, state));
        assertEquals(List.of(claims.get(0)), TraversalEngine.getPrunedClaims(claims, state));
        assertEquals("✗ \"Applicable?\" — 1 claim(s) pruned", TraversalEngine.getPathSummary(state));
        assertTrue(TraversalEngine.isTraversalComplete(fps, state));
    }

    @Test
    @DisplayName("Choosing a side of a conflict completes the traversal")
    void conflictScenario() {
        Map<String, Object> graph = Map.of(
                "claims", CLAIMS,
                "edges", List.of(Map.of("from", "A", "to", "B", "type", "conflict")));
        List<Claim> claims = claimsOf(graph);

        List<ForcingPoint> fps = TraversalEngine.extractForcingPoints(graph);
        assertEquals(1, fps.size());
        ForcingPoint fp = fps.get(0);
        assertEquals(ForcingPointType.CONFLICT, fp.getType());
        assertEquals(1, fp.getTier());

        TraversalState state = TraversalEngine.initTraversalState(claims);
        assertEquals(List.of(fp), TraversalEngine.getLiveForcingPoints(fps, state));

        state = TraversalEngine.resolveConflict(state, fp.getId(), fp, "A", "Label A");

        assertTrue(state.isPruned("B"));
        assertTrue(TraversalEngine.isTraversalComplete(fps, state));
        assertEquals("→ Chose \"Label A\" over \"Label B\"", TraversalEngine.getPathSummary(state));
    }

    @Test
    @DisplayName("A gated conflict opens on a satisfied gate and dies on a failed one")
    void gatedConflictScenario() {
        Map<String, Object> graph = Map.of(
                "claims", CLAIMS,
                "conditionals", List.of(Map.of("id", "g1", "affectedClaims", List.of("A"),
                        "question", "Applicable?")),
                "tensions", List.of(Map.of("claimAId", "A", "claimBId", "B",
                        "blockedByGates", List.of("g1"))));
        List<Claim> claims = claimsOf(graph);
        List<ForcingPoint> fps = TraversalEngine.extractForcingPoints(graph);
        ForcingPoint gate = fps.get(0);
        ForcingPoint conflict = fps.get(1);
        assertEquals(List.of("g1"), conflict.getBlockedByGateIds());

        TraversalState initial = TraversalEngine.initTraversalState(claims);
        assertEquals(List.of(gate), TraversalEngine.getLiveForcingPoints(fps, initial));

        TraversalState satisfied = TraversalEngine.resolveConditional(initial, "g1", gate, true, "yes");
        assertEquals(List.of(conflict), TraversalEngine.getLiveForcingPoints(fps, satisfied));
        assertEquals("✓ \"Applicable?\" — yes", TraversalEngine.getPathSummary(satisfied));

        TraversalState failed = TraversalEngine.resolveConditional(initial, "g1", gate, false);
        assertTrue(TraversalEngine.getLiveForcingPoints(fps, failed).isEmpty());
        assertTrue(TraversalEngine.isTraversalComplete(fps, failed));
    }

    @Test
    @DisplayName("Should extract from a graph read and normalized from JSON")
    void extractsFromNormalizedJson() {
        NormalizedGraph graph = GraphJson.normalize("""
                {
                  "claims": [{"id": "A", "label": "Label A"}, {"id": "B", "label": "Label B"}],
                  "edges": [{"from": "A", "to": "B", "type": "conflict"}]
                }
                """);

        List<ForcingPoint> fps = TraversalEngine.extractForcingPoints(graph);
        List<ForcingPoint> viaObject = TraversalEngine.extractForcingPoints((Object) graph);

        assertEquals(1, fps.size());
        assertEquals("fp_conflict_A::B", fps.get(0).getId());
        assertEquals(fps, viaObject);
    }

    @Test
    @DisplayName("Malformed input produces an immediately complete traversal")
    void malformedInput() {
        List<ForcingPoint> fps = TraversalEngine.extractForcingPoints("not a graph");
        TraversalState state = TraversalEngine.initTraversalState(List.of());

        assertTrue(fps.isEmpty());
        assertTrue(TraversalEngine.isTraversalComplete(fps, state));
    }
}
