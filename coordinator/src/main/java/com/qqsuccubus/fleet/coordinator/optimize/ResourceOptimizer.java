package com.qqsuccubus.fleet.coordinator.optimize;

import com.google.common.base.Ticker;
import com.qqsuccubus.fleet.coordinator.config.CoordinatorConfig;
import com.qqsuccubus.fleet.coordinator.events.IClusterEventPublisher;
import com.qqsuccubus.fleet.coordinator.registry.INodeRegistry;
import com.qqsuccubus.fleet.core.error.ConfigurationInvalidException;
import com.qqsuccubus.fleet.core.metrics.MetricsNames;
import com.qqsuccubus.fleet.core.metrics.MetricsTags;
import com.qqsuccubus.fleet.core.model.NodeRecord;
import com.qqsuccubus.fleet.core.model.ResourceRecommendation;
import com.qqsuccubus.fleet.core.msg.ClusterEvents;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Computes advisory reallocation recommendations from registry load.
 * <p>
 * Policy over the {@code ACTIVE} nodes:
 * <pre>
 *   avgLoad > cpuHigh or avgMem > memHigh   and count < maxNodes  -> SCALE_UP
 *   avgLoad < cpuLow  and avgMem < memLow   and count > minNodes  -> SCALE_DOWN (least-loaded node)
 *   count < minNodes                                              -> SCALE_UP
 *   otherwise                                                     -> NONE
 * </pre>
 * </p>
 * <p>
 * After an actionable recommendation, further scaling is throttled for the
 * configured cooldown. The optimizer never adds or removes nodes itself.
 * </p>
 */
public class ResourceOptimizer {
    private static final Logger log = LoggerFactory.getLogger(ResourceOptimizer.class);

    static final int HISTORY_SIZE = 100;

    private static final Comparator<NodeRecord> LEAST_LOADED = Comparator
        .comparingDouble(NodeRecord::getLoad)
        .thenComparing(NodeRecord::getNodeId);

    // guarded by this; replaced whole by updateThresholds
    private CoordinatorConfig config;
    private final INodeRegistry registry;
    private final IClusterEventPublisher eventPublisher;
    private final Ticker ticker;
    private final Clock clock;

    private final Deque<LoadSample> history = new ArrayDeque<>();
    private Long lastActionNanos;

    private final Counter scaleUpDecisions;
    private final Counter scaleDownDecisions;
    private final Counter noChangeDecisions;

    public ResourceOptimizer(CoordinatorConfig config,
                             INodeRegistry registry,
                             IClusterEventPublisher eventPublisher,
                             Ticker ticker,
                             Clock clock,
                             MeterRegistry meterRegistry) {
        this.config = config;
        this.registry = registry;
        this.eventPublisher = eventPublisher;
        this.ticker = ticker;
        this.clock = clock;

        scaleUpDecisions = Counter.builder(MetricsNames.OPTIMIZER_RECOMMENDATIONS_TOTAL)
            .tag(MetricsTags.ACTION, "scale_up")
            .register(meterRegistry);
        scaleDownDecisions = Counter.builder(MetricsNames.OPTIMIZER_RECOMMENDATIONS_TOTAL)
            .tag(MetricsTags.ACTION, "scale_down")
            .register(meterRegistry);
        noChangeDecisions = Counter.builder(MetricsNames.OPTIMIZER_RECOMMENDATIONS_TOTAL)
            .tag(MetricsTags.ACTION, "none")
            .register(meterRegistry);
    }

    /**
     * Evaluates the current registry snapshot and publishes the recommendation.
     *
     * @return Mono of the recommendation, emitted once the publication completed or failed
     */
    public Mono<ResourceRecommendation> optimize() {
        ResourceRecommendation recommendation = evaluate(registry.snapshotAll());

        ClusterEvents.RecommendationIssued event = ClusterEvents.RecommendationIssued.builder()
            .recommendation(recommendation)
            .ts(recommendation.getTimestampMs())
            .build();

        // The decision stands even if nobody heard about it
        return eventPublisher.publishRecommendation(event)
            .doOnError(err -> log.error("Failed to publish recommendation {}: {}",
                recommendation.getAction(), err.getMessage()))
            .onErrorResume(err -> Mono.empty())
            .thenReturn(recommendation);
    }

    /**
     * Applies the policy to a snapshot and records a load sample.
     */
    public synchronized ResourceRecommendation evaluate(List<NodeRecord> snapshot) {
        long nowMs = clock.millis();
        List<NodeRecord> active = snapshot.stream()
            .filter(NodeRecord::isActive)
            .collect(Collectors.toList());

        int count = active.size();
        double avgLoad = active.stream().mapToDouble(NodeRecord::getLoad).average().orElse(0.0);
        double avgMem = active.stream().mapToDouble(NodeRecord::getMemoryUsage).average().orElse(0.0);
        recordSample(new LoadSample(avgLoad, avgMem, count, nowMs));

        log.info("Optimization metrics: activeNodes={}, avgLoad={}, avgMem={}",
            count, String.format("%.1f%%", avgLoad), String.format("%.1f%%", avgMem));

        ResourceRecommendation.Action action = ResourceRecommendation.Action.NONE;
        String targetNodeId = null;
        String reason;

        boolean overloaded = avgLoad > config.getCpuHighThreshold() || avgMem > config.getMemoryHighThreshold();
        boolean underused = avgLoad < config.getCpuLowThreshold() && avgMem < config.getMemoryLowThreshold();

        if (count < config.getMinNodes()) {
            action = ResourceRecommendation.Action.SCALE_UP;
            reason = String.format("Below min_nodes (%d < %d)", count, config.getMinNodes());
        } else if (overloaded) {
            if (count < config.getMaxNodes()) {
                action = ResourceRecommendation.Action.SCALE_UP;
                reason = String.format("High utilization (load=%.1f%%, mem=%.1f%%)", avgLoad, avgMem);
            } else {
                reason = String.format("High utilization but at max_nodes (%d)", config.getMaxNodes());
            }
        } else if (underused) {
            if (count > config.getMinNodes()) {
                action = ResourceRecommendation.Action.SCALE_DOWN;
                targetNodeId = active.stream().min(LEAST_LOADED).map(NodeRecord::getNodeId).orElse(null);
                reason = String.format("Low utilization (load=%.1f%%, mem=%.1f%%)", avgLoad, avgMem);
            } else {
                reason = String.format("Low utilization but at min_nodes (%d)", config.getMinNodes());
            }
        } else {
            reason = "Within thresholds";
        }

        long now = ticker.read();
        if (action != ResourceRecommendation.Action.NONE && inCooldown(now)) {
            action = ResourceRecommendation.Action.NONE;
            targetNodeId = null;
            reason = "Throttled (too soon)";
        }

        switch (action) {
            case SCALE_UP:
                scaleUpDecisions.increment();
                break;
            case SCALE_DOWN:
                scaleDownDecisions.increment();
                break;
            default:
                noChangeDecisions.increment();
        }

        ResourceRecommendation recommendation = ResourceRecommendation.builder()
            .action(action)
            .targetNodeId(targetNodeId)
            .reason(reason)
            .averageLoad(avgLoad)
            .averageMemory(avgMem)
            .nodeCount(count)
            .timestampMs(nowMs)
            .build();

        if (recommendation.isActionable()) {
            lastActionNanos = now;
            log.info("Recommendation: action={}, target={}, reason={}", action, targetNodeId, reason);
        }
        return recommendation;
    }

    /**
     * Replaces the utilization thresholds used from the next evaluation on.
     *
     * @throws ConfigurationInvalidException if the new thresholds are out of range or a low
     *                                       threshold is not below its high one; the current
     *                                       thresholds are then kept
     */
    public synchronized void updateThresholds(OptimizationThresholds thresholds) {
        Objects.requireNonNull(thresholds, "thresholds");
        CoordinatorConfig updated = thresholds.applyTo(config);
        updated.validate();

        config = updated;
        log.info("Updated optimization thresholds: {}", thresholds);
    }

    public synchronized OptimizationThresholds getThresholds() {
        return OptimizationThresholds.from(config);
    }

    /**
     * Most recent load samples, oldest first.
     */
    public synchronized List<LoadSample> getHistory() {
        return List.copyOf(history);
    }

    // called with the monitor held
    private boolean inCooldown(long now) {
        return lastActionNanos != null
            && now - lastActionNanos < config.getScalingCooldown().toNanos();
    }

    private void recordSample(LoadSample sample) {
        history.addLast(sample);
        if (history.size() > HISTORY_SIZE) {
            history.removeFirst();
        }
    }

    /**
     * Aggregate load observed by one optimization cycle.
     */
    @Value
    public static class LoadSample {
        double averageLoad;
        double averageMemory;
        int activeNodes;
        long timestampMs;
    }
}
