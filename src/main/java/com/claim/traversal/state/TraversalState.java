package com.claim.traversal.state;

import com.claim.traversal.core.model.ClaimStatus;
import com.claim.traversal.core.model.Resolution;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of a traversal: claim statuses, resolutions by forcing point id,
 * and the human-readable path of steps taken so far.
 *
 * <p>Each snapshot owns its containers. Transitions in {@link TraversalStateMachine}
 * build a new snapshot and leave the previous one untouched, so callers may keep
 * older snapshots for undo or audit.</p>
 */
public final class TraversalState {

    private static final TraversalState EMPTY = new TraversalState(Map.of(), Map.of(), List.of());

    private final Map<String, ClaimStatus> claimStatuses;
    private final Map<String, Resolution> resolutions;
    private final List<String> pathSteps;

    TraversalState(Map<String, ClaimStatus> claimStatuses,
                   Map<String, Resolution> resolutions,
                   List<String> pathSteps) {
        this.claimStatuses = Collections.unmodifiableMap(new LinkedHashMap<>(claimStatuses));
        this.resolutions = Collections.unmodifiableMap(new LinkedHashMap<>(resolutions));
        this.pathSteps = List.copyOf(pathSteps);
    }

    public static TraversalState empty() {
        return EMPTY;
    }

    /**
     * Rebuilds a snapshot from its parts, e.g. after deserialization.
     */
    public static TraversalState of(Map<String, ClaimStatus> claimStatuses,
                                    Map<String, Resolution> resolutions,
                                    List<String> pathSteps) {
        return new TraversalState(
                claimStatuses != null ? claimStatuses : Map.of(),
                resolutions != null ? resolutions : Map.of(),
                pathSteps != null ? pathSteps : List.of());
    }

    public Map<String, ClaimStatus> getClaimStatuses() {
        return claimStatuses;
    }

    public Map<String, Resolution> getResolutions() {
        return resolutions;
    }

    public List<String> getPathSteps() {
        return pathSteps;
    }

    public Optional<ClaimStatus> statusOf(String claimId) {
        return Optional.ofNullable(claimStatuses.get(claimId));
    }

    public boolean isActive(String claimId) {
        return claimStatuses.get(claimId) == ClaimStatus.ACTIVE;
    }

    public boolean isPruned(String claimId) {
        return claimStatuses.get(claimId) == ClaimStatus.PRUNED;
    }

    public boolean isResolved(String forcingPointId) {
        return resolutions.containsKey(forcingPointId);
    }

    public Optional<Resolution> resolutionOf(String forcingPointId) {
        return Optional.ofNullable(resolutions.get(forcingPointId));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TraversalState that = (TraversalState) o;
        return claimStatuses.equals(that.claimStatuses) &&
                resolutions.equals(that.resolutions) &&
                pathSteps.equals(that.pathSteps);
    }

    @Override
    public int hashCode() {
        return Objects.hash(claimStatuses, resolutions, pathSteps);
    }

    @Override
    public String toString() {
        long pruned = claimStatuses.values().stream().filter(s -> s == ClaimStatus.PRUNED).count();
        return "TraversalState{" +
                "claims=" + claimStatuses.size() +
                ", pruned=" + pruned +
                ", resolutions=" + resolutions.size() +
                ", steps=" + pathSteps.size() +
                '}';
    }
}
