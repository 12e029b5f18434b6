package com.qqsuccubus.fleet.coordinator;

import com.google.common.testing.FakeTicker;
import com.qqsuccubus.fleet.coordinator.config.CoordinatorConfig;
import com.qqsuccubus.fleet.coordinator.config.TestConfigs;
import com.qqsuccubus.fleet.coordinator.events.RecordingEventPublisher;
import com.qqsuccubus.fleet.coordinator.heartbeat.HeartbeatMonitor;
import com.qqsuccubus.fleet.coordinator.heartbeat.SweepResult;
import com.qqsuccubus.fleet.core.error.ConfigurationInvalidException;
import com.qqsuccubus.fleet.core.error.NodeNotFoundException;
import com.qqsuccubus.fleet.core.metrics.MetricsNames;
import com.qqsuccubus.fleet.core.metrics.MetricsTags;
import com.qqsuccubus.fleet.core.model.ClusterMetricsSnapshot;
import com.qqsuccubus.fleet.core.model.NodeAddress;
import com.qqsuccubus.fleet.core.model.NodeRecord;
import com.qqsuccubus.fleet.core.model.NodeStatus;
import com.qqsuccubus.fleet.core.model.PlacementRequest;
import com.qqsuccubus.fleet.core.model.ResourceRecommendation;
import com.qqsuccubus.fleet.core.msg.ClusterEvents;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ClusterCoordinatorTest {

    private static final NodeAddress ADDRESS = NodeAddress.of("10.0.0.1", 7000);

    private FakeTicker ticker;
    private RecordingEventPublisher publisher;
    private SimpleMeterRegistry meterRegistry;
    private ClusterCoordinator coordinator;

    @BeforeEach
    void setUp() {
        ticker = new FakeTicker();
        publisher = new RecordingEventPublisher();
        meterRegistry = new SimpleMeterRegistry();
        coordinator = new ClusterCoordinator(TestConfigs.defaults(), publisher, meterRegistry, ticker,
            Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        coordinator.stop();
    }

    @Test
    void invalidConfiguration_isRejectedAtConstruction() {
        CoordinatorConfig invalid = TestConfigs.defaults().toBuilder().minNodes(5).maxNodes(2).build();

        assertThrows(ConfigurationInvalidException.class,
            () -> new ClusterCoordinator(invalid, publisher, meterRegistry));
    }

    @Test
    void startAndStop_controlBothLoops() {
        coordinator.start();
        assertTrue(coordinator.isRunning());

        coordinator.start();
        coordinator.stop();
        assertFalse(coordinator.isRunning());

        coordinator.stop();
        assertFalse(coordinator.isRunning());
    }

    @Test
    void registerNode_publishesRegistration() {
        String id = coordinator.registerNode(ADDRESS, Set.of("gpu"));

        List<ClusterEvents.NodeRegistered> registered = publisher.eventsOf(ClusterEvents.NodeRegistered.class);
        assertEquals(1, registered.size());
        assertEquals(id, registered.get(0).getNodeId());
        assertEquals(Set.of("gpu"), registered.get(0).getCapabilities());
        assertEquals(List.of(id), coordinator.listNodes().stream().map(NodeRecord::getNodeId)
            .collect(Collectors.toList()));
    }

    @Test
    void unregisterNode_isIdempotentAndPublishesOnce() {
        String id = coordinator.registerNode(ADDRESS, Set.of());

        assertTrue(coordinator.unregisterNode(id));
        assertFalse(coordinator.unregisterNode(id));
        assertFalse(coordinator.unregisterNode("never-registered"));

        List<ClusterEvents.NodeLost> lost = publisher.eventsOf(ClusterEvents.NodeLost.class);
        assertEquals(1, lost.size());
        assertEquals(ClusterCoordinator.REASON_UNREGISTERED, lost.get(0).getReason());
        assertEquals(1.0, meterRegistry.get(MetricsNames.NODES_LOST_TOTAL)
            .tag(MetricsTags.REASON, ClusterCoordinator.REASON_UNREGISTERED).counter().count());
    }

    @Test
    void silentNode_isEvictedWithPlacementsAndStateCleared() {
        coordinator.registerNode("a", ADDRESS, Set.of("gpu"));
        coordinator.registerNode("b", ADDRESS, Set.of("gpu"));
        coordinator.updateNodeStatus("b", 50.0, NodeStatus.ACTIVE);
        assertEquals("a", coordinator.selectNode(PlacementRequest.builder()
            .taskId("task-1")
            .requiredCapability("gpu")
            .build()));
        coordinator.pushState("a", bytes("checkpoint"), 1);

        ticker.advance(20, TimeUnit.SECONDS);
        coordinator.updateNodeStatus("b", 50.0, NodeStatus.ACTIVE);
        ticker.advance(11, TimeUnit.SECONDS);

        SweepResult result = coordinator.sweep();

        assertEquals(Set.of("a"), result.getEvictions().keySet());
        assertTrue(coordinator.getNode("a").isEmpty());
        assertTrue(coordinator.placementOf("task-1").isEmpty());
        assertTrue(coordinator.pullState("a").isEmpty());
        assertEquals(0, coordinator.getStateManager().size());
        assertEquals("b", coordinator.selectNode(Set.of("gpu")));

        ClusterEvents.NodeLost lost = publisher.eventsOf(ClusterEvents.NodeLost.class).get(0);
        assertEquals("a", lost.getNodeId());
        assertEquals(HeartbeatMonitor.REASON_HEARTBEAT_TIMEOUT, lost.getReason());
    }

    @Test
    void reRegistration_startsFreshWithoutNodeLostEvent() {
        coordinator.registerNode("a", ADDRESS, Set.of());
        coordinator.updateNodeStatus("a", 40.0, NodeStatus.ACTIVE);
        coordinator.selectNode(PlacementRequest.builder().taskId("task-1").build());
        coordinator.pushState("a", bytes("old"), 10);

        NodeRecord fresh = coordinator.registerNode("a", NodeAddress.of("10.0.0.2", 7000), Set.of("cpu"));

        assertEquals(0.0, fresh.getLoad());
        assertEquals(NodeStatus.ACTIVE, fresh.getStatus());
        assertTrue(coordinator.placementOf("task-1").isEmpty());
        assertTrue(coordinator.pullState("a").isEmpty());
        assertEquals(1, coordinator.pushState("a", bytes("new"), 1).getVersion());
        assertTrue(publisher.eventsOf(ClusterEvents.NodeLost.class).isEmpty());
        assertEquals(2, publisher.eventsOf(ClusterEvents.NodeRegistered.class).size());
    }

    @Test
    void scaleDown_drainsTargetUntilItEmpties() {
        coordinator.registerNode("a", ADDRESS, Set.of());
        coordinator.registerNode("b", ADDRESS, Set.of());
        coordinator.registerNode("c", ADDRESS, Set.of());
        coordinator.updateNodeStatus("a", 5.0, NodeStatus.ACTIVE);
        coordinator.updateNodeStatus("b", 10.0, NodeStatus.ACTIVE);
        coordinator.updateNodeStatus("c", 15.0, NodeStatus.ACTIVE);

        ResourceRecommendation rec = coordinator.optimize().block();

        assertEquals(ResourceRecommendation.Action.SCALE_DOWN, rec.getAction());
        assertEquals("a", rec.getTargetNodeId());
        assertEquals(NodeStatus.DRAINING, coordinator.getNode("a").orElseThrow().getStatus());
        assertEquals(1, publisher.eventsOf(ClusterEvents.RecommendationIssued.class).size());
        ClusterEvents.NodeStatusChanged last = lastStatusChange();
        assertEquals("a", last.getNodeId());
        assertEquals(NodeStatus.DRAINING, last.getStatus());

        assertTrue(coordinator.sweep().getEvictions().isEmpty());
        coordinator.updateNodeStatus("a", 0.0, NodeStatus.DRAINING);

        SweepResult result = coordinator.sweep();
        assertEquals(HeartbeatMonitor.REASON_DRAINED, result.getEvictions().get("a"));
    }

    @Test
    void statusReports_publishStatusChanges() {
        coordinator.registerNode("a", ADDRESS, Set.of());

        coordinator.updateNodeStatus("a", 42.0, 60.0, NodeStatus.ACTIVE);

        ClusterEvents.NodeStatusChanged changed = lastStatusChange();
        assertEquals(42.0, changed.getLoad());
        assertEquals(60.0, coordinator.getNode("a").orElseThrow().getMemoryUsage());
        assertThrows(NodeNotFoundException.class,
            () -> coordinator.updateNodeStatus("ghost", 1.0, NodeStatus.ACTIVE));
    }

    @Test
    void failingPublisher_doesNotBreakOperations() {
        publisher.failPublications();

        String id = coordinator.registerNode(ADDRESS, Set.of());
        coordinator.updateNodeStatus(id, 10.0, NodeStatus.ACTIVE);

        assertTrue(coordinator.unregisterNode(id));
        assertTrue(publisher.events().isEmpty());
    }

    @Test
    void failingPublisher_stillDrainsScaleDownTarget() {
        coordinator.registerNode("a", ADDRESS, Set.of());
        coordinator.registerNode("b", ADDRESS, Set.of());
        coordinator.registerNode("c", ADDRESS, Set.of());
        coordinator.updateNodeStatus("a", 5.0, NodeStatus.ACTIVE);
        coordinator.updateNodeStatus("b", 10.0, NodeStatus.ACTIVE);
        coordinator.updateNodeStatus("c", 15.0, NodeStatus.ACTIVE);
        publisher.failPublications();

        ResourceRecommendation rec = coordinator.optimize().block();

        assertEquals(ResourceRecommendation.Action.SCALE_DOWN, rec.getAction());
        assertEquals("a", rec.getTargetNodeId());
        assertEquals(NodeStatus.DRAINING, coordinator.getNode("a").orElseThrow().getStatus());
        assertTrue(publisher.eventsOf(ClusterEvents.RecommendationIssued.class).isEmpty());
    }

    @Test
    void lateLossOfPreviousIncarnation_keepsNewIncarnationIntact() {
        NodeRecord previous = coordinator.registerNode("a", ADDRESS, Set.of());
        NodeRecord current = coordinator.registerNode("a", NodeAddress.of("10.0.0.2", 7000), Set.of());
        assertTrue(current.getIncarnation() > previous.getIncarnation());

        coordinator.pushState("a", "shard-1", bytes("fresh"), 1);
        coordinator.selectNode(PlacementRequest.builder().taskId("task-1").build());

        // e.g. an eviction of the old record whose notification lands after the re-registration
        coordinator.onNodeLost(previous.withStatus(NodeStatus.DEAD), HeartbeatMonitor.REASON_HEARTBEAT_TIMEOUT);

        assertTrue(coordinator.verifyState("a", bytes("fresh")));
        assertEquals("a", coordinator.placementOf("task-1").orElseThrow());
        assertTrue(coordinator.consistencyCheck().isEmpty());
        assertEquals(2, coordinator.pushState("a", "shard-1", bytes("fresher"), 2).getVersion());
    }

    @Test
    void stateRoundTrip_andVerification() {
        coordinator.registerNode("a", ADDRESS, Set.of());
        coordinator.pushState("a", "shard-1", bytes("v1"), 1);

        assertTrue(coordinator.verifyState("a", bytes("v1")));
        assertFalse(coordinator.verifyState("a", bytes("v2")));
        assertTrue(coordinator.consistencyCheck().isEmpty());
    }

    @Test
    void metricsSnapshot_reflectsRegistry() {
        coordinator.registerNode("a", ADDRESS, Set.of());
        coordinator.registerNode("b", ADDRESS, Set.of());
        coordinator.updateNodeStatus("a", 30.0, NodeStatus.ACTIVE);
        coordinator.updateCapabilities("b", Set.of("gpu"));

        ClusterMetricsSnapshot snapshot = coordinator.metricsSnapshot();

        assertEquals(2, snapshot.countOf(NodeStatus.ACTIVE));
        assertEquals(15.0, snapshot.getAverageLoad(), 1e-9);
        assertEquals(0.2, snapshot.getPoolUtilization(), 1e-9);
        assertEquals("b", coordinator.selectNode(Set.of("gpu")));
    }

    private ClusterEvents.NodeStatusChanged lastStatusChange() {
        List<ClusterEvents.NodeStatusChanged> changes = publisher.eventsOf(ClusterEvents.NodeStatusChanged.class);
        return changes.get(changes.size() - 1);
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
