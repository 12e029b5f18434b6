package com.qqsuccubus.fleet.coordinator;

import com.google.common.base.Ticker;
import com.qqsuccubus.fleet.coordinator.balance.LoadBalancer;
import com.qqsuccubus.fleet.coordinator.config.CoordinatorConfig;
import com.qqsuccubus.fleet.coordinator.events.IClusterEventPublisher;
import com.qqsuccubus.fleet.coordinator.heartbeat.HeartbeatMonitor;
import com.qqsuccubus.fleet.coordinator.heartbeat.SweepResult;
import com.qqsuccubus.fleet.coordinator.metrics.ClusterMetricsService;
import com.qqsuccubus.fleet.coordinator.optimize.OptimizationThresholds;
import com.qqsuccubus.fleet.coordinator.optimize.ResourceOptimizer;
import com.qqsuccubus.fleet.coordinator.registry.NodeLossListener;
import com.qqsuccubus.fleet.coordinator.registry.NodeRegistry;
import com.qqsuccubus.fleet.coordinator.registry.Registration;
import com.qqsuccubus.fleet.coordinator.state.StateManager;
import com.qqsuccubus.fleet.coordinator.task.PeriodicTask;
import com.qqsuccubus.fleet.core.error.NodeNotFoundException;
import com.qqsuccubus.fleet.core.metrics.MetricsNames;
import com.qqsuccubus.fleet.core.metrics.MetricsTags;
import com.qqsuccubus.fleet.core.model.ClusterMetricsSnapshot;
import com.qqsuccubus.fleet.core.model.DivergenceReport;
import com.qqsuccubus.fleet.core.model.NodeAddress;
import com.qqsuccubus.fleet.core.model.NodeRecord;
import com.qqsuccubus.fleet.core.model.NodeStatus;
import com.qqsuccubus.fleet.core.model.PlacementRequest;
import com.qqsuccubus.fleet.core.model.ResourceRecommendation;
import com.qqsuccubus.fleet.core.model.StateEntry;
import com.qqsuccubus.fleet.core.msg.ClusterEvents;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Facade over the node registry and the components built on it.
 * <p>
 * Owns two independent background loops:
 * <ul>
 *   <li>heartbeat: liveness sweep followed by a state consistency check</li>
 *   <li>optimizer: resource recommendation cycle</li>
 * </ul>
 * Node losses from any source (eviction or unregistration) are fanned out to the
 * load balancer and the state manager, then published as {@code NodeLost}.
 * </p>
 */
public class ClusterCoordinator implements NodeLossListener {
    private static final Logger log = LoggerFactory.getLogger(ClusterCoordinator.class);

    public static final String REASON_UNREGISTERED = "unregistered";
    static final String REASON_REREGISTERED = "re-registered";

    private final CoordinatorConfig config;
    private final IClusterEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Getter
    private final NodeRegistry registry;
    @Getter
    private final LoadBalancer loadBalancer;
    @Getter
    private final StateManager stateManager;
    @Getter
    private final ResourceOptimizer optimizer;
    private final HeartbeatMonitor heartbeatMonitor;
    private final ClusterMetricsService metricsService;

    private final PeriodicTask heartbeatTask;
    private final PeriodicTask optimizerTask;

    public ClusterCoordinator(CoordinatorConfig config,
                              IClusterEventPublisher eventPublisher,
                              MeterRegistry meterRegistry) {
        this(config, eventPublisher, meterRegistry, Ticker.systemTicker(), Clock.systemUTC());
    }

    public ClusterCoordinator(CoordinatorConfig config,
                              IClusterEventPublisher eventPublisher,
                              MeterRegistry meterRegistry,
                              Ticker ticker,
                              Clock clock) {
        config.validate();

        this.config = config;
        this.eventPublisher = eventPublisher;
        this.meterRegistry = meterRegistry;
        this.clock = clock;

        this.registry = new NodeRegistry(config.getMaxNodes(), ticker, clock);
        this.loadBalancer = new LoadBalancer(registry, meterRegistry);
        this.stateManager = new StateManager(registry, clock, meterRegistry);
        this.optimizer = new ResourceOptimizer(config, registry, eventPublisher, ticker, clock, meterRegistry);
        this.heartbeatMonitor = new HeartbeatMonitor(registry, config, this, ticker, meterRegistry);
        this.metricsService = new ClusterMetricsService(registry, stateManager, meterRegistry, clock);

        this.heartbeatTask = new PeriodicTask("heartbeat", config.getHeartbeatInterval(), this::sweep, meterRegistry);
        this.optimizerTask = new PeriodicTask("optimizer", config.getOptimizationInterval(),
            () -> optimize().block(), meterRegistry);
    }

    /**
     * Validates the configuration and starts both background loops. Idempotent.
     */
    public synchronized void start() {
        config.validate();
        if (isRunning()) {
            return;
        }
        heartbeatTask.start();
        optimizerTask.start();
        log.info("Coordinator {} started (heartbeat every {}, optimization every {})",
            config.getNodeId(), config.getHeartbeatInterval(), config.getOptimizationInterval());
    }

    /**
     * Stops both loops and waits for in-flight iterations to finish. Idempotent.
     */
    public synchronized void stop() {
        heartbeatTask.stop();
        optimizerTask.stop();
        log.info("Coordinator {} stopped", config.getNodeId());
    }

    public boolean isRunning() {
        return heartbeatTask.isRunning() || optimizerTask.isRunning();
    }

    // ---- Node lifecycle ----

    /**
     * Registers a node under a fresh id.
     *
     * @return the allocated node id
     */
    public String registerNode(NodeAddress address, Set<String> capabilities) {
        return registerNode(UUID.randomUUID().toString(), address, capabilities).getNodeId();
    }

    /**
     * Registers a node under a caller-chosen id. A previous incarnation is replaced:
     * its placements are invalidated and its state orphaned. Loss notifications are
     * scoped to the incarnation they name, so a late one never touches what the new
     * incarnation has already placed or written.
     */
    public NodeRecord registerNode(String nodeId, NodeAddress address, Set<String> capabilities) {
        Registration registration = registry.register(nodeId, address, capabilities);
        registration.replacedRecord().ifPresent(previous -> {
            loadBalancer.onNodeLost(previous, REASON_REREGISTERED);
            stateManager.onNodeLost(previous, REASON_REREGISTERED);
        });
        publishRegistered(registration.getRecord());
        return registration.getRecord();
    }

    /**
     * Removes a node. Idempotent: unknown ids are ignored.
     *
     * @return true if a node was removed
     */
    public boolean unregisterNode(String nodeId) {
        Optional<NodeRecord> removed = registry.unregister(nodeId);
        removed.ifPresent(record -> onNodeLost(record.withStatus(NodeStatus.DEAD), REASON_UNREGISTERED));
        return removed.isPresent();
    }

    public Optional<NodeRecord> getNode(String nodeId) {
        return registry.get(nodeId);
    }

    public List<NodeRecord> listNodes() {
        return registry.snapshotAll();
    }

    /**
     * Records a status report; counts as a heartbeat.
     */
    public NodeRecord updateNodeStatus(String nodeId, double load, NodeStatus status) {
        NodeRecord updated = registry.updateStatus(nodeId, load, status);
        publishStatusChanged(updated);
        return updated;
    }

    /**
     * Records a status report with memory usage; counts as a heartbeat.
     */
    public NodeRecord updateNodeStatus(String nodeId, double load, double memoryUsage, NodeStatus status) {
        NodeRecord updated = registry.updateStatus(nodeId, load, memoryUsage, status);
        publishStatusChanged(updated);
        return updated;
    }

    public NodeRecord updateCapabilities(String nodeId, Set<String> capabilities) {
        return registry.updateCapabilities(nodeId, capabilities);
    }

    // ---- Placement ----

    public String selectNode(Set<String> requiredCapabilities) {
        return loadBalancer.selectNode(requiredCapabilities);
    }

    public String selectNode(PlacementRequest request) {
        return loadBalancer.selectNode(request);
    }

    public Optional<String> placementOf(String taskId) {
        return loadBalancer.placementOf(taskId);
    }

    public boolean releasePlacement(String taskId) {
        return loadBalancer.releasePlacement(taskId);
    }

    // ---- State ----

    public StateEntry pushState(String nodeId, byte[] payload, long version) {
        return stateManager.pushState(nodeId, payload, version);
    }

    public StateEntry pushState(String nodeId, String resourceKey, byte[] payload, long version) {
        return stateManager.pushState(nodeId, resourceKey, payload, version);
    }

    public Optional<StateEntry> pullState(String nodeId) {
        return stateManager.pullState(nodeId);
    }

    public boolean verifyState(String nodeId, byte[] payload) {
        return stateManager.verifyConsistency(nodeId, payload);
    }

    public List<DivergenceReport> consistencyCheck() {
        return stateManager.consistencyCheck();
    }

    // ---- Background iterations ----

    /**
     * One heartbeat loop iteration: liveness sweep, then consistency check so that
     * state orphaned by this sweep is collected right away.
     */
    public SweepResult sweep() {
        SweepResult result = heartbeatMonitor.sweep();
        stateManager.consistencyCheck();
        return result;
    }

    /**
     * One optimization cycle. A {@code SCALE_DOWN} target is marked draining; it is
     * evicted by the heartbeat loop once its load reaches zero or the drain times out.
     */
    public Mono<ResourceRecommendation> optimize() {
        return optimizer.optimize()
            .doOnNext(this::apply);
    }

    /**
     * Adjusts the optimizer's utilization thresholds at runtime.
     *
     * @throws com.qqsuccubus.fleet.core.error.ConfigurationInvalidException if the thresholds are invalid
     */
    public void updateThresholds(OptimizationThresholds thresholds) {
        optimizer.updateThresholds(thresholds);
    }

    public ClusterMetricsSnapshot metricsSnapshot() {
        return metricsService.snapshot();
    }

    // ---- Loss fan-out ----

    @Override
    public void onNodeLost(NodeRecord record, String reason) {
        loadBalancer.onNodeLost(record, reason);
        stateManager.onNodeLost(record, reason);

        Counter.builder(MetricsNames.NODES_LOST_TOTAL)
            .tag(MetricsTags.REASON, reason)
            .register(meterRegistry)
            .increment();

        publish("NodeLost", eventPublisher.publishNodeLost(ClusterEvents.NodeLost.builder()
            .nodeId(record.getNodeId())
            .reason(reason)
            .ts(clock.millis())
            .build()));
    }

    private void apply(ResourceRecommendation recommendation) {
        if (recommendation.getAction() != ResourceRecommendation.Action.SCALE_DOWN
            || recommendation.getTargetNodeId() == null) {
            return;
        }
        try {
            NodeRecord draining = registry.markDraining(recommendation.getTargetNodeId());
            log.info("Draining node {}: {}", draining.getNodeId(), recommendation.getReason());
            publishStatusChanged(draining);
        } catch (NodeNotFoundException e) {
            log.info("Scale-down target {} already gone", recommendation.getTargetNodeId());
        }
    }

    private void publishRegistered(NodeRecord record) {
        publish("NodeRegistered", eventPublisher.publishNodeRegistered(ClusterEvents.NodeRegistered.builder()
            .nodeId(record.getNodeId())
            .address(record.getAddress())
            .capabilities(record.getCapabilities())
            .ts(clock.millis())
            .build()));
    }

    private void publishStatusChanged(NodeRecord record) {
        publish("NodeStatusChanged", eventPublisher.publishNodeStatusChanged(ClusterEvents.NodeStatusChanged.builder()
            .nodeId(record.getNodeId())
            .load(record.getLoad())
            .status(record.getStatus())
            .ts(clock.millis())
            .build()));
    }

    private void publish(String type, Mono<Void> publication) {
        publication
            .doOnError(err -> log.error("Failed to publish {} event: {}", type, err.getMessage()))
            .onErrorResume(err -> Mono.empty())
            .subscribe();
    }
}
