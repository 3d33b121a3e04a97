package com.claim.traversal.core.model;

import java.util.List;

/**
 * Canonical conflict edge between two claims.
 * Direction carries no meaning; see {@link #pairKey()}.
 *
 * @param from               first claim id
 * @param to                 second claim id
 * @param question           optional question supplied upstream, may be {@code null}
 * @param sourceStatementIds provenance attached to the edge itself
 */
public record ConflictEdge(String from, String to, String question, List<String> sourceStatementIds) {

    public ConflictEdge {
        sourceStatementIds = sourceStatementIds != null ? List.copyOf(sourceStatementIds) : List.of();
    }

    public String pairKey() {
        return pairKey(from, to);
    }

    /**
     * Order-independent key for a claim pair: the two ids sorted and joined by {@code ::}.
     */
    public static String pairKey(String a, String b) {
        return a.compareTo(b) <= 0 ? a + "::" + b : b + "::" + a;
    }
}
