package com.claim.traversal.metrics;

import com.claim.traversal.core.model.ForcingPointType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code traversal.forcing-points.extracted}: Counter (tag: type)</li>
 *   <li>{@code traversal.edges.dropped}: DistributionSummary</li>
 *   <li>{@code traversal.resolutions}: Counter (tags: type, outcome)</li>
 *   <li>{@code traversal.claims.pruned}: Counter</li>
 *   <li>{@code traversal.completed}: Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary edgesDroppedSummary;
    private final Counter claimsPrunedCounter;
    private final Counter completedCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.edgesDroppedSummary = DistributionSummary.builder("traversal.edges.dropped")
                .description("Invalid upstream edges discarded per normalized graph")
                .register(registry);
        this.claimsPrunedCounter = Counter.builder("traversal.claims.pruned")
                .description("Number of claims newly pruned by resolutions")
                .register(registry);
        this.completedCounter = Counter.builder("traversal.completed")
                .description("Number of traversals that reached completion")
                .register(registry);
    }

    @Override
    public void incrementForcingPointsExtracted(ForcingPointType type, int count) {
        String key = "extracted:" + type.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("traversal.forcing-points.extracted")
                        .description("Number of forcing points extracted")
                        .tag("type", type.getValue())
                        .register(registry));
        counter.increment(count);
    }

    @Override
    public void recordEdgesDropped(int count) {
        edgesDroppedSummary.record(count);
    }

    @Override
    public void incrementResolution(ForcingPointType type, ResolutionOutcome outcome) {
        String key = "resolution:" + type.name() + ":" + outcome.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("traversal.resolutions")
                        .description("Number of forcing points resolved")
                        .tag("type", type.getValue())
                        .tag("outcome", outcome.name().toLowerCase(Locale.ROOT))
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementClaimsPruned(int count) {
        claimsPrunedCounter.increment(count);
    }

    @Override
    public void incrementTraversalCompleted() {
        completedCounter.increment();
    }
}
