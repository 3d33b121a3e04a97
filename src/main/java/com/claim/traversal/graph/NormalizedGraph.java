package com.claim.traversal.graph;

import com.claim.traversal.core.model.Claim;
import com.claim.traversal.core.model.Conditional;
import com.claim.traversal.core.model.ConflictEdge;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical form of an upstream decision graph.
 *
 * @param claims           claims with a usable id, in upstream order
 * @param edges            conflict edges from whichever shape was present
 * @param conditionals     merged conditionals, in first-seen order
 * @param conflictBlocks   gate ids recorded per conflict pair key (tensions shape only)
 * @param edgeSource       shape the edges were read from
 * @param droppedEdgeCount invalid entries discarded from an explicit {@code edges[]} array
 */
public record NormalizedGraph(
        List<Claim> claims,
        List<ConflictEdge> edges,
        List<Conditional> conditionals,
        Map<String, List<String>> conflictBlocks,
        EdgeSource edgeSource,
        int droppedEdgeCount
) {
    public NormalizedGraph {
        claims = claims != null ? List.copyOf(claims) : List.of();
        edges = edges != null ? List.copyOf(edges) : List.of();
        conditionals = conditionals != null ? List.copyOf(conditionals) : List.of();
        conflictBlocks = conflictBlocks != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(conflictBlocks)) : Map.of();
        edgeSource = edgeSource != null ? edgeSource : EdgeSource.CLAIM_CONFLICTS;
    }

    public static NormalizedGraph empty() {
        return new NormalizedGraph(List.of(), List.of(), List.of(), Map.of(), EdgeSource.CLAIM_CONFLICTS, 0);
    }

    /**
     * Claims keyed by id. When an id repeats, the later claim wins.
     */
    public Map<String, Claim> claimsById() {
        Map<String, Claim> byId = new LinkedHashMap<>();
        for (Claim claim : claims) {
            byId.put(claim.getId(), claim);
        }
        return byId;
    }

    public List<String> blockingGatesFor(String pairKey) {
        return conflictBlocks.getOrDefault(pairKey, List.of());
    }
}
