package com.qqsuccubus.fleet.coordinator.heartbeat;

import com.google.common.testing.FakeTicker;
import com.qqsuccubus.fleet.coordinator.config.TestConfigs;
import com.qqsuccubus.fleet.coordinator.registry.NodeRegistry;
import com.qqsuccubus.fleet.core.metrics.MetricsNames;
import com.qqsuccubus.fleet.core.model.NodeAddress;
import com.qqsuccubus.fleet.core.model.NodeRecord;
import com.qqsuccubus.fleet.core.model.NodeStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HeartbeatMonitorTest {

    private static final NodeAddress ADDRESS = NodeAddress.of("10.0.0.1", 7000);

    private FakeTicker ticker;
    private NodeRegistry registry;
    private SimpleMeterRegistry meterRegistry;
    private Map<String, NodeRecord> lost;
    private Map<String, String> reasons;

    @BeforeEach
    void setUp() {
        ticker = new FakeTicker();
        registry = new NodeRegistry(10, ticker, Clock.systemUTC());
        meterRegistry = new SimpleMeterRegistry();
        lost = new LinkedHashMap<>();
        reasons = new LinkedHashMap<>();
    }

    private HeartbeatMonitor monitor() {
        return new HeartbeatMonitor(registry, TestConfigs.defaults(), (record, reason) -> {
            lost.put(record.getNodeId(), record);
            reasons.put(record.getNodeId(), reason);
        }, ticker, meterRegistry);
    }

    @Test
    void silentNode_isEvictedAfterTimeout() {
        registry.register("a", ADDRESS, Set.of());
        registry.register("b", ADDRESS, Set.of());

        ticker.advance(20, TimeUnit.SECONDS);
        registry.updateStatus("b", 10.0, NodeStatus.ACTIVE);
        ticker.advance(11, TimeUnit.SECONDS);

        SweepResult result = monitor().sweep();

        assertEquals(2, result.getChecked());
        assertTrue(result.evicted("a"));
        assertFalse(result.evicted("b"));
        assertTrue(registry.get("a").isEmpty());
        assertTrue(registry.get("b").isPresent());
        assertEquals(HeartbeatMonitor.REASON_HEARTBEAT_TIMEOUT, reasons.get("a"));
        assertEquals(NodeStatus.DEAD, lost.get("a").getStatus());
    }

    @Test
    void nodeExactlyAtTimeout_isKept() {
        registry.register("a", ADDRESS, Set.of());
        ticker.advance(30, TimeUnit.SECONDS);

        SweepResult result = monitor().sweep();

        assertTrue(result.getEvictions().isEmpty());
        assertTrue(registry.get("a").isPresent());
    }

    @Test
    void drainedNode_isEvictedOnceLoadReachesZero() {
        registry.register("a", ADDRESS, Set.of());
        registry.updateStatus("a", 40.0, NodeStatus.DRAINING);

        HeartbeatMonitor monitor = monitor();
        assertTrue(monitor.sweep().getEvictions().isEmpty());

        registry.updateStatus("a", 0.0, NodeStatus.DRAINING);
        SweepResult result = monitor.sweep();

        assertEquals(Map.of("a", HeartbeatMonitor.REASON_DRAINED), result.getEvictions());
    }

    @Test
    void slowDrain_isEvictedAfterDrainTimeout() {
        registry.register("a", ADDRESS, Set.of());
        registry.updateStatus("a", 40.0, NodeStatus.DRAINING);

        // Keep heartbeating so only the drain deadline can trigger
        for (int i = 0; i < 11; i++) {
            ticker.advance(28, TimeUnit.SECONDS);
            registry.updateStatus("a", 40.0, NodeStatus.DRAINING);
        }

        SweepResult result = monitor().sweep();

        assertEquals(HeartbeatMonitor.REASON_DRAIN_TIMEOUT, result.getEvictions().get("a"));
    }

    @Test
    void failingListener_isIsolatedPerNode() {
        registry.register("a", ADDRESS, Set.of());
        registry.register("b", ADDRESS, Set.of());
        ticker.advance(31, TimeUnit.SECONDS);

        HeartbeatMonitor monitor = new HeartbeatMonitor(registry, TestConfigs.defaults(), (record, reason) -> {
            if (record.getNodeId().equals("a")) {
                throw new IllegalStateException("listener down");
            }
            lost.put(record.getNodeId(), record);
        }, ticker, meterRegistry);

        SweepResult result = monitor.sweep();

        assertEquals(1, result.getFailures());
        assertTrue(lost.containsKey("b"));
        assertTrue(registry.snapshotAll().isEmpty());
        assertEquals(1.0, meterRegistry.get(MetricsNames.HEARTBEAT_SWEEP_FAILURES_TOTAL).counter().count());
    }

    @Test
    void lateHeartbeat_keepsNodeAlive() {
        registry.register("a", ADDRESS, Set.of());
        ticker.advance(31, TimeUnit.SECONDS);
        HeartbeatMonitor monitor = monitor();

        registry.updateStatus("a", 1.0, NodeStatus.ACTIVE);

        assertFalse(monitor.evictionReason(registry.get("a").orElseThrow(), ticker.read()).isPresent());
        assertTrue(monitor.sweep().getEvictions().isEmpty());
    }
}
