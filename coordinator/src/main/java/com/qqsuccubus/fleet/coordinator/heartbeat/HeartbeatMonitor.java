package com.qqsuccubus.fleet.coordinator.heartbeat;

import com.google.common.base.Ticker;
import com.qqsuccubus.fleet.coordinator.config.CoordinatorConfig;
import com.qqsuccubus.fleet.coordinator.registry.NodeLossListener;
import com.qqsuccubus.fleet.coordinator.registry.NodeRegistry;
import com.qqsuccubus.fleet.core.metrics.MetricsNames;
import com.qqsuccubus.fleet.core.model.NodeRecord;
import com.qqsuccubus.fleet.core.model.NodeStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Periodic liveness sweep over the registry.
 * <p>
 * Evicts nodes whose last heartbeat is older than the node timeout, and draining
 * nodes that went idle or overran the drain timeout. Each record is checked in
 * isolation: a failure on one record is logged and counted, and the sweep moves on.
 * </p>
 */
public class HeartbeatMonitor {
    private static final Logger log = LoggerFactory.getLogger(HeartbeatMonitor.class);

    public static final String REASON_HEARTBEAT_TIMEOUT = "heartbeat-timeout";
    public static final String REASON_DRAINED = "drained";
    public static final String REASON_DRAIN_TIMEOUT = "drain-timeout";

    private final NodeRegistry registry;
    private final NodeLossListener lossListener;
    private final Ticker ticker;
    private final long nodeTimeoutNanos;
    private final long drainTimeoutNanos;

    private final Counter sweepFailures;

    public HeartbeatMonitor(NodeRegistry registry,
                            CoordinatorConfig config,
                            NodeLossListener lossListener,
                            Ticker ticker,
                            MeterRegistry meterRegistry) {
        this.registry = registry;
        this.lossListener = lossListener;
        this.ticker = ticker;
        this.nodeTimeoutNanos = config.getNodeTimeout().toNanos();
        this.drainTimeoutNanos = config.getDrainTimeout().toNanos();

        this.sweepFailures = Counter.builder(MetricsNames.HEARTBEAT_SWEEP_FAILURES_TOTAL)
            .register(meterRegistry);
    }

    /**
     * Runs one sweep over a snapshot of the registry.
     *
     * @return evicted nodes and the number of isolated failures
     */
    public SweepResult sweep() {
        long now = ticker.read();
        List<NodeRecord> snapshot = registry.snapshotAll();

        Map<String, String> evictions = new LinkedHashMap<>();
        int failures = 0;

        for (NodeRecord record : snapshot) {
            try {
                if (evictionReason(record, now).isEmpty()) {
                    continue;
                }

                // Re-check under the registry lock: a report may have landed since the snapshot
                Optional<NodeRecord> removed = registry.removeIf(
                    record.getNodeId(), current -> evictionReason(current, now).isPresent()
                );
                if (removed.isEmpty()) {
                    log.debug("Node {} recovered before eviction", record.getNodeId());
                    continue;
                }

                NodeRecord lost = removed.get();
                String reason = evictionReason(lost, now).orElse(REASON_HEARTBEAT_TIMEOUT);
                evictions.put(lost.getNodeId(), reason);

                log.warn("Evicting node {} ({}): last heartbeat {} ms ago, status={}, load={}",
                    lost.getNodeId(), reason, lost.heartbeatAgeNanos(now) / 1_000_000,
                    lost.getStatus(), lost.getLoad());

                lossListener.onNodeLost(lost.withStatus(NodeStatus.DEAD), reason);
            } catch (RuntimeException e) {
                failures++;
                sweepFailures.increment();
                log.error("Heartbeat check failed for node {}", record.getNodeId(), e);
            }
        }

        if (!evictions.isEmpty()) {
            log.info("Heartbeat sweep evicted {} of {} nodes: {}", evictions.size(), snapshot.size(), evictions);
        } else {
            log.debug("Heartbeat sweep checked {} nodes, none evicted", snapshot.size());
        }

        return new SweepResult(snapshot.size(), Collections.unmodifiableMap(evictions), failures);
    }

    /**
     * Decides whether {@code record} must be evicted at {@code now}.
     */
    Optional<String> evictionReason(NodeRecord record, long now) {
        if (record.heartbeatAgeNanos(now) > nodeTimeoutNanos) {
            return Optional.of(REASON_HEARTBEAT_TIMEOUT);
        }
        if (record.isDraining()) {
            if (record.getLoad() <= 0.0) {
                return Optional.of(REASON_DRAINED);
            }
            Long since = record.getDrainingSinceNanos();
            if (since != null && now - since > drainTimeoutNanos) {
                return Optional.of(REASON_DRAIN_TIMEOUT);
            }
        }
        return Optional.empty();
    }
}
