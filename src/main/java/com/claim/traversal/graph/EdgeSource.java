package com.claim.traversal.graph;

/**
 * Which upstream shape the conflict edges of a normalized graph came from.
 * Shapes are tried in declaration order; the first one present wins.
 */
public enum EdgeSource {
    /** Explicit {@code edges[]} array of {@code {from, to, type, question}} objects. */
    EDGES,

    /** {@code tensions[]} array of {@code {claimAId, claimBId, blockedByGates}} objects. */
    TENSIONS,

    /** Each claim's own {@code conflicts[]} list of {@code {claimId, question}} objects. */
    CLAIM_CONFLICTS
}
