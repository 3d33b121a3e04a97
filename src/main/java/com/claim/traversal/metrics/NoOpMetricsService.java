package com.claim.traversal.metrics;

import com.claim.traversal.core.model.ForcingPointType;

/**
 * No-op implementation of {@link MetricsService}.
 * All methods are empty, ensuring the library works without any metrics dependencies.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void incrementForcingPointsExtracted(ForcingPointType type, int count) {
    }

    @Override
    public void recordEdgesDropped(int count) {
    }

    @Override
    public void incrementResolution(ForcingPointType type, ResolutionOutcome outcome) {
    }

    @Override
    public void incrementClaimsPruned(int count) {
    }

    @Override
    public void incrementTraversalCompleted() {
    }
}
