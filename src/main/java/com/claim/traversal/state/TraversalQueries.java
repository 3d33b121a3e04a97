package com.claim.traversal.state;

import com.claim.traversal.core.model.ClaimStatus;
import com.claim.traversal.core.model.Identifiable;

import java.util.List;

/**
 * Read-only helpers over a {@link TraversalState}.
 */
public final class TraversalQueries {

    static final String NO_CONSTRAINTS = "No constraints applied.";

    private TraversalQueries() {
        // utility class
    }

    /**
     * Claims whose status is active, in input order. Claims unknown to the state are excluded.
     */
    public static <T extends Identifiable> List<T> getActiveClaims(List<T> claims, TraversalState state) {
        return withStatus(claims, state, ClaimStatus.ACTIVE);
    }

    /**
     * Claims whose status is pruned, in input order.
     */
    public static <T extends Identifiable> List<T> getPrunedClaims(List<T> claims, TraversalState state) {
        return withStatus(claims, state, ClaimStatus.PRUNED);
    }

    public static String getPathSummary(TraversalState state) {
        if (state.getPathSteps().isEmpty()) {
            return NO_CONSTRAINTS;
        }
        return String.join("\n", state.getPathSteps());
    }

    private static <T extends Identifiable> List<T> withStatus(List<T> claims, TraversalState state,
                                                               ClaimStatus status) {
        return claims.stream()
                .filter(claim -> state.getClaimStatuses().get(claim.getId()) == status)
                .toList();
    }
}
