package com.claim.traversal.state;

import com.claim.traversal.core.model.ClaimStatus;
import com.claim.traversal.core.model.ConflictOption;
import com.claim.traversal.core.model.ForcingPoint;
import com.claim.traversal.core.model.Identifiable;
import com.claim.traversal.core.model.Resolution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Pure transitions over {@link TraversalState}.
 *
 * <p>Pruning is monotonic: no transition here returns a pruned claim to active.
 * Resolving the same forcing point again replaces its {@link Resolution} but keeps
 * whatever pruning the earlier resolution applied.</p>
 *
 * <p>Neither transition checks that the forcing point id and forcing point belong
 * together or to any extracted list; that is the caller's job.</p>
 */
public final class TraversalStateMachine {
    private static final Logger log = LoggerFactory.getLogger(TraversalStateMachine.class);

    private TraversalStateMachine() {
        // utility class
    }

    /**
     * Creates the initial state: every claim active, no resolutions, empty path.
     */
    public static TraversalState initTraversalState(Collection<? extends Identifiable> claims) {
        Map<String, ClaimStatus> statuses = new LinkedHashMap<>();
        if (claims != null) {
            for (Identifiable claim : claims) {
                if (claim != null && claim.getId() != null) {
                    statuses.put(claim.getId(), ClaimStatus.ACTIVE);
                }
            }
        }
        return new TraversalState(statuses, Map.of(), List.of());
    }

    public static TraversalState resolveConditional(TraversalState state, String forcingPointId,
                                                    ForcingPoint forcingPoint, boolean satisfied) {
        return resolveConditional(state, forcingPointId, forcingPoint, satisfied, null);
    }

    /**
     * Records a conditional answer. An unsatisfied conditional prunes every affected claim.
     *
     * @param userInput optional free text appended to the path step of a satisfied conditional
     */
    public static TraversalState resolveConditional(TraversalState state, String forcingPointId,
                                                    ForcingPoint forcingPoint, boolean satisfied,
                                                    String userInput) {
        Map<String, ClaimStatus> statuses = new LinkedHashMap<>(state.getClaimStatuses());
        Map<String, Resolution> resolutions = new LinkedHashMap<>(state.getResolutions());
        List<String> steps = new ArrayList<>(state.getPathSteps());

        resolutions.put(forcingPointId, Resolution.conditional(forcingPointId, satisfied, userInput));

        if (!satisfied) {
            List<String> affected = forcingPoint.getAffectedClaims();
            for (String claimId : affected) {
                statuses.put(claimId, ClaimStatus.PRUNED);
            }
            steps.add("✗ \"" + forcingPoint.getCondition() + "\" — " + affected.size() + " claim(s) pruned");
        } else {
            String suffix = userInput != null && !userInput.isEmpty() ? " — " + userInput : "";
            steps.add("✓ \"" + forcingPoint.getCondition() + "\"" + suffix);
        }

        log.debug("traversal.resolved fp={} type=conditional satisfied={}", forcingPointId, satisfied);
        return new TraversalState(statuses, resolutions, steps);
    }

    /**
     * Records a conflict choice. Every option other than {@code selectedClaimId} is pruned.
     */
    public static TraversalState resolveConflict(TraversalState state, String forcingPointId,
                                                 ForcingPoint forcingPoint, String selectedClaimId,
                                                 String selectedLabel) {
        Map<String, ClaimStatus> statuses = new LinkedHashMap<>(state.getClaimStatuses());
        Map<String, Resolution> resolutions = new LinkedHashMap<>(state.getResolutions());
        List<String> steps = new ArrayList<>(state.getPathSteps());

        resolutions.put(forcingPointId, Resolution.conflict(forcingPointId, selectedClaimId, selectedLabel));

        List<ConflictOption> options = forcingPoint.getOptions();
        if (!options.isEmpty()) {
            List<ConflictOption> rejected = options.stream()
                    .filter(option -> !option.claimId().equals(selectedClaimId))
                    .toList();
            for (ConflictOption option : rejected) {
                statuses.put(option.claimId(), ClaimStatus.PRUNED);
            }
            String rejectedLabels = rejected.stream()
                    .map(ConflictOption::label)
                    .collect(Collectors.joining(", "));
            steps.add("→ Chose \"" + selectedLabel + "\" over \"" + rejectedLabels + "\"");
        }

        log.debug("traversal.resolved fp={} type=conflict selected={}", forcingPointId, selectedClaimId);
        return new TraversalState(statuses, resolutions, steps);
    }
}
