package com.claim.traversal.core.model;

import java.util.List;

/**
 * Canonical conditional gate: a condition whose failure renders its affected claims inapplicable.
 *
 * @param id                 gate id, or {@code null} for an unlabeled conditional
 * @param question           question text as supplied upstream (may be a placeholder)
 * @param affectedClaims     claim ids gated by this conditional, in first-seen order
 * @param sourceStatementIds provenance supplied upstream
 */
public record Conditional(String id, String question, List<String> affectedClaims, List<String> sourceStatementIds) {

    public Conditional {
        affectedClaims = affectedClaims != null ? List.copyOf(affectedClaims) : List.of();
        sourceStatementIds = sourceStatementIds != null ? List.copyOf(sourceStatementIds) : List.of();
    }

    public boolean hasId() {
        return id != null && !id.isEmpty();
    }
}
