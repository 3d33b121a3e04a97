package com.claim.traversal.api;

import com.claim.traversal.core.model.Claim;
import com.claim.traversal.core.model.ConflictOption;
import com.claim.traversal.core.model.ForcingPoint;
import com.claim.traversal.core.model.ForcingPointType;
import com.claim.traversal.core.model.Identifiable;
import com.claim.traversal.extract.ExtractionOptions;
import com.claim.traversal.extract.ForcingPointExtractor;
import com.claim.traversal.graph.GraphNormalizer;
import com.claim.traversal.graph.NormalizedGraph;
import com.claim.traversal.liveness.LivenessEvaluator;
import com.claim.traversal.logging.LogContext;
import com.claim.traversal.metrics.MetricsService;
import com.claim.traversal.metrics.MetricsService.ResolutionOutcome;
import com.claim.traversal.metrics.NoOpMetricsService;
import com.claim.traversal.state.TraversalQueries;
import com.claim.traversal.state.TraversalState;
import com.claim.traversal.state.TraversalStateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Holds one interactive traversal: the forcing points extracted once from the graph,
 * the current state, and the history of earlier snapshots.
 *
 * <p>Unlike the pure functions in {@link TraversalEngine}, a session looks forcing points
 * up by id and rejects ids it did not extract. Sessions are not thread-safe; one writer
 * per session.</p>
 *
 * <h2>Example usage:</h2>
 * <pre>
 * TraversalSession session = TraversalSession.builder()
 *     .graph(GraphJson.read(json))
 *     .build();
 *
 * while (!session.isComplete()) {
 *     ForcingPoint fp = session.nextForcingPoint().orElseThrow();
 *     if (fp.isConditional()) {
 *         session.resolveConditional(fp.getId(), askUser(fp));
 *     } else {
 *         session.resolveConflict(fp.getId(), pickOption(fp));
 *     }
 * }
 * </pre>
 */
public class TraversalSession {
    private static final Logger log = LoggerFactory.getLogger(TraversalSession.class);

    private final String sessionId;
    private final List<Claim> claims;
    private final List<ForcingPoint> forcingPoints;
    private final Map<String, ForcingPoint> forcingPointsById;
    private final List<TraversalState> history = new ArrayList<>();
    private final MetricsService metricsService;
    private boolean completionRecorded;

    private TraversalSession(Builder builder) {
        this.sessionId = builder.sessionId != null ? builder.sessionId : LogContext.generateSessionId();
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();

        NormalizedGraph graph = builder.normalizedGraph != null
                ? builder.normalizedGraph : GraphNormalizer.normalize(builder.graph);
        ForcingPointExtractor extractor = new ForcingPointExtractor(builder.options);

        this.claims = graph.claims();
        this.forcingPoints = List.copyOf(extractor.extract(graph));

        try (LogContext ctx = LogContext.forExtraction(sessionId)) {
            long conditionals = forcingPoints.stream().filter(ForcingPoint::isConditional).count();
            metricsService.incrementForcingPointsExtracted(ForcingPointType.CONDITIONAL, (int) conditionals);
            metricsService.incrementForcingPointsExtracted(ForcingPointType.CONFLICT,
                    forcingPoints.size() - (int) conditionals);
            metricsService.recordEdgesDropped(graph.droppedEdgeCount());

            log.info("forcing-points.extracted conditionals={} conflicts={} claims={}",
                    conditionals, forcingPoints.size() - conditionals, claims.size());
        }

        Map<String, ForcingPoint> byId = new LinkedHashMap<>();
        for (ForcingPoint fp : forcingPoints) {
            byId.putIfAbsent(fp.getId(), fp);
        }
        this.forcingPointsById = Collections.unmodifiableMap(byId);

        List<? extends Identifiable> seed = builder.claims != null ? builder.claims : claims;
        history.add(TraversalStateMachine.initTraversalState(seed));
    }

    // ========== Resolution API ==========

    public TraversalState resolveConditional(String forcingPointId, boolean satisfied) {
        return resolveConditional(forcingPointId, satisfied, null);
    }

    /**
     * Answers a conditional forcing point.
     *
     * @throws IllegalArgumentException if the id is unknown or names a conflict
     */
    public TraversalState resolveConditional(String forcingPointId, boolean satisfied, String userInput) {
        ForcingPoint fp = requireForcingPoint(forcingPointId, ForcingPointType.CONDITIONAL);
        try (LogContext ctx = LogContext.forResolution(sessionId, forcingPointId)) {
            TraversalState before = getState();
            TraversalState after = TraversalStateMachine.resolveConditional(
                    before, forcingPointId, fp, satisfied, userInput);
            metricsService.incrementResolution(ForcingPointType.CONDITIONAL,
                    satisfied ? ResolutionOutcome.SATISFIED : ResolutionOutcome.UNSATISFIED);
            return advance(before, after, fp);
        }
    }

    /**
     * Answers a conflict forcing point by choosing one of its options.
     *
     * @throws IllegalArgumentException if the id is unknown, names a conditional,
     *                                  or the claim is not one of the options
     */
    public TraversalState resolveConflict(String forcingPointId, String selectedClaimId) {
        ForcingPoint fp = requireForcingPoint(forcingPointId, ForcingPointType.CONFLICT);
        ConflictOption selected = fp.getOptions().stream()
                .filter(option -> option.claimId().equals(selectedClaimId))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Claim '" + selectedClaimId + "' is not an option of forcing point '" + forcingPointId + "'"));

        try (LogContext ctx = LogContext.forResolution(sessionId, forcingPointId)) {
            TraversalState before = getState();
            TraversalState after = TraversalStateMachine.resolveConflict(
                    before, forcingPointId, fp, selected.claimId(), selected.label());
            metricsService.incrementResolution(ForcingPointType.CONFLICT, ResolutionOutcome.CHOSEN);
            return advance(before, after, fp);
        }
    }

    /**
     * Restores the snapshot taken before the last resolution.
     *
     * @return false when the session is already at its initial state
     */
    public boolean undo() {
        if (history.size() <= 1) {
            return false;
        }
        history.remove(history.size() - 1);
        log.info("traversal.undo session={} steps={}", sessionId, getState().getPathSteps().size());
        return true;
    }

    // ========== Queries ==========

    public String getSessionId() {
        return sessionId;
    }

    public TraversalState getState() {
        return history.get(history.size() - 1);
    }

    /**
     * All snapshots from the initial state to the current one.
     */
    public List<TraversalState> getHistory() {
        return List.copyOf(history);
    }

    public List<ForcingPoint> getForcingPoints() {
        return forcingPoints;
    }

    public Optional<ForcingPoint> getForcingPoint(String forcingPointId) {
        return Optional.ofNullable(forcingPointsById.get(forcingPointId));
    }

    public List<ForcingPoint> getLiveForcingPoints() {
        return LivenessEvaluator.getLiveForcingPoints(forcingPoints, getState());
    }

    /**
     * The first live forcing point in tier order, if any remain.
     */
    public Optional<ForcingPoint> nextForcingPoint() {
        return getLiveForcingPoints().stream().findFirst();
    }

    public boolean isComplete() {
        return LivenessEvaluator.isTraversalComplete(forcingPoints, getState());
    }

    public List<Claim> getClaims() {
        return claims;
    }

    public List<Claim> getActiveClaims() {
        return TraversalQueries.getActiveClaims(claims, getState());
    }

    public List<Claim> getPrunedClaims() {
        return TraversalQueries.getPrunedClaims(claims, getState());
    }

    public String getPathSummary() {
        return TraversalQueries.getPathSummary(getState());
    }

    // ========== Internal ==========

    private ForcingPoint requireForcingPoint(String forcingPointId, ForcingPointType expectedType) {
        ForcingPoint fp = forcingPointsById.get(forcingPointId);
        if (fp == null) {
            throw new IllegalArgumentException("Unknown forcing point: '" + forcingPointId + "'");
        }
        if (fp.getType() != expectedType) {
            throw new IllegalArgumentException("Forcing point '" + forcingPointId + "' is a "
                    + fp.getType().getValue() + ", not a " + expectedType.getValue());
        }
        return fp;
    }

    private TraversalState advance(TraversalState before, TraversalState after, ForcingPoint fp) {
        int newlyPruned = (int) after.getClaimStatuses().keySet().stream()
                .filter(after::isPruned)
                .filter(claimId -> !before.isPruned(claimId))
                .count();
        if (newlyPruned > 0) {
            metricsService.incrementClaimsPruned(newlyPruned);
        }
        history.add(after);
        log.info("traversal.resolved fp={} type={} pruned={}", fp.getId(), fp.getType().getValue(), newlyPruned);

        if (!completionRecorded && isComplete()) {
            completionRecorded = true;
            metricsService.incrementTraversalCompleted();
            log.info("traversal.completed steps={}", after.getPathSteps().size());
        }
        return after;
    }

    // ========== Builder ==========

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Object graph;
        private NormalizedGraph normalizedGraph;
        private List<? extends Identifiable> claims;
        private ExtractionOptions options = ExtractionOptions.defaults();
        private MetricsService metricsService;
        private String sessionId;

        /**
         * Untyped upstream graph, normalized on build.
         */
        public Builder graph(Object graph) {
            this.graph = graph;
            return this;
        }

        public Builder normalizedGraph(NormalizedGraph normalizedGraph) {
            this.normalizedGraph = normalizedGraph;
            return this;
        }

        /**
         * Enriched claims that seed the initial state. Defaults to the graph's own claims.
         */
        public Builder claims(List<? extends Identifiable> claims) {
            this.claims = claims;
            return this;
        }

        public Builder options(ExtractionOptions options) {
            this.options = options;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public TraversalSession build() {
            if (graph == null && normalizedGraph == null) {
                throw new IllegalStateException("Either graph or normalizedGraph is required");
            }
            return new TraversalSession(this);
        }
    }
}
