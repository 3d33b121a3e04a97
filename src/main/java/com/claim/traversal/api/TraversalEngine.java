package com.claim.traversal.api;

import com.claim.traversal.core.model.ForcingPoint;
import com.claim.traversal.core.model.Identifiable;
import com.claim.traversal.extract.ForcingPointExtractor;
import com.claim.traversal.graph.NormalizedGraph;
import com.claim.traversal.liveness.LivenessEvaluator;
import com.claim.traversal.state.TraversalQueries;
import com.claim.traversal.state.TraversalState;
import com.claim.traversal.state.TraversalStateMachine;

import java.util.Collection;
import java.util.List;

/**
 * Stateless entry point for the traversal engine.
 *
 * <p>Every method is a pure function over its arguments. The caller owns the current
 * {@link TraversalState} and must serialize resolutions against the same base state;
 * see {@link TraversalSession} for a single-session holder that does this bookkeeping.</p>
 *
 * <h2>Example usage:</h2>
 * <pre>
 * List&lt;ForcingPoint&gt; fps = TraversalEngine.extractForcingPoints(graph);
 * TraversalState state = TraversalEngine.initTraversalState(claims);
 *
 * for (ForcingPoint fp : TraversalEngine.getLiveForcingPoints(fps, state)) {
 *     // present fp, collect an answer, then
 *     state = TraversalEngine.resolveConditional(state, fp.getId(), fp, false);
 * }
 * String path = TraversalEngine.getPathSummary(state);
 * </pre>
 */
public final class TraversalEngine {

    private static final ForcingPointExtractor DEFAULT_EXTRACTOR = new ForcingPointExtractor();

    private TraversalEngine() {
        // utility class
    }

    // ========== Extraction ==========

    /**
     * Normalizes an untyped upstream graph and extracts its ordered forcing points.
     * Never throws on malformed input.
     */
    public static List<ForcingPoint> extractForcingPoints(Object graph) {
        return DEFAULT_EXTRACTOR.extract(graph);
    }

    public static List<ForcingPoint> extractForcingPoints(NormalizedGraph graph) {
        return DEFAULT_EXTRACTOR.extract(graph);
    }

    // ========== State ==========

    public static TraversalState initTraversalState(Collection<? extends Identifiable> claims) {
        return TraversalStateMachine.initTraversalState(claims);
    }

    public static TraversalState resolveConditional(TraversalState state, String forcingPointId,
                                                    ForcingPoint forcingPoint, boolean satisfied) {
        return TraversalStateMachine.resolveConditional(state, forcingPointId, forcingPoint, satisfied);
    }

    public static TraversalState resolveConditional(TraversalState state, String forcingPointId,
                                                    ForcingPoint forcingPoint, boolean satisfied,
                                                    String userInput) {
        return TraversalStateMachine.resolveConditional(state, forcingPointId, forcingPoint, satisfied, userInput);
    }

    public static TraversalState resolveConflict(TraversalState state, String forcingPointId,
                                                 ForcingPoint forcingPoint, String selectedClaimId,
                                                 String selectedLabel) {
        return TraversalStateMachine.resolveConflict(state, forcingPointId, forcingPoint,
                selectedClaimId, selectedLabel);
    }

    // ========== Liveness ==========

    public static List<ForcingPoint> getLiveForcingPoints(List<ForcingPoint> forcingPoints, TraversalState state) {
        return LivenessEvaluator.getLiveForcingPoints(forcingPoints, state);
    }

    public static boolean isTraversalComplete(List<ForcingPoint> forcingPoints, TraversalState state) {
        return LivenessEvaluator.isTraversalComplete(forcingPoints, state);
    }

    // ========== Queries ==========

    public static <T extends Identifiable> List<T> getActiveClaims(List<T> claims, TraversalState state) {
        return TraversalQueries.getActiveClaims(claims, state);
    }

    public static <T extends Identifiable> List<T> getPrunedClaims(List<T> claims, TraversalState state) {
        return TraversalQueries.getPrunedClaims(claims, state);
    }

    public static String getPathSummary(TraversalState state) {
        return TraversalQueries.getPathSummary(state);
    }
}
