package com.claim.traversal.metrics;

import com.claim.traversal.core.model.ForcingPointType;

/**
 * Interface for recording traversal metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, ensuring the library works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void incrementForcingPointsExtracted(ForcingPointType type, int count);

    void recordEdgesDropped(int count);

    void incrementResolution(ForcingPointType type, ResolutionOutcome outcome);

    void incrementClaimsPruned(int count);

    void incrementTraversalCompleted();

    /**
     * Outcome tag for a recorded resolution.
     */
    enum ResolutionOutcome {
        SATISFIED,
        UNSATISFIED,
        CHOSEN
    }
}
