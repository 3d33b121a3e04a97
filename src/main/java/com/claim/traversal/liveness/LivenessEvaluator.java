package com.claim.traversal.liveness;

import com.claim.traversal.core.model.ConflictOption;
import com.claim.traversal.core.model.ForcingPoint;
import com.claim.traversal.core.model.Resolution;
import com.claim.traversal.state.TraversalState;

import java.util.List;

/**
 * Decides which forcing points are still actionable for a given state.
 *
 * <p>A conditional is live while it is unresolved and at least one of its affected
 * claims is active. A conflict is live only when:</p>
 * <ul>
 *   <li>it is unresolved,</li>
 *   <li>no conditional anywhere is live (conditionals clear before conflicts),</li>
 *   <li>every gate in {@link ForcingPoint#getBlockedByGateIds()} was resolved as satisfied, and</li>
 *   <li>at least two of its options are still active.</li>
 * </ul>
 */
public final class LivenessEvaluator {

    private LivenessEvaluator() {
        // utility class
    }

    public static List<ForcingPoint> getLiveForcingPoints(List<ForcingPoint> forcingPoints, TraversalState state) {
        boolean conditionalsPending = forcingPoints.stream()
                .anyMatch(fp -> fp.isConditional() && isLiveConditional(fp, state));

        return forcingPoints.stream()
                .filter(fp -> !state.isResolved(fp.getId()))
                .filter(fp -> fp.isConditional()
                        ? hasActiveAffectedClaim(fp, state)
                        : isLiveConflict(fp, state, conditionalsPending))
                .toList();
    }

    public static boolean isTraversalComplete(List<ForcingPoint> forcingPoints, TraversalState state) {
        return getLiveForcingPoints(forcingPoints, state).isEmpty();
    }

    static boolean isLiveConditional(ForcingPoint fp, TraversalState state) {
        return !state.isResolved(fp.getId()) && hasActiveAffectedClaim(fp, state);
    }

    private static boolean hasActiveAffectedClaim(ForcingPoint fp, TraversalState state) {
        return fp.getAffectedClaims().stream().anyMatch(state::isActive);
    }

    private static boolean isLiveConflict(ForcingPoint fp, TraversalState state, boolean conditionalsPending) {
        if (conditionalsPending) {
            return false;
        }
        if (isBlockedByGate(fp, state)) {
            return false;
        }
        return activeOptionCount(fp, state) >= 2;
    }

    /**
     * A listed gate blocks until it has a satisfied conditional resolution.
     */
    static boolean isBlockedByGate(ForcingPoint fp, TraversalState state) {
        for (String gateId : fp.getBlockedByGateIds()) {
            Resolution resolution = state.getResolutions().get(gateId);
            if (resolution == null || !resolution.isSatisfiedConditional()) {
                return true;
            }
        }
        return false;
    }

    static long activeOptionCount(ForcingPoint fp, TraversalState state) {
        return fp.getOptions().stream()
                .map(ConflictOption::claimId)
                .filter(state::isActive)
                .count();
    }
}
