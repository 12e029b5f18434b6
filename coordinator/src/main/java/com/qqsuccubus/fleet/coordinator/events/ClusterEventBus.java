package com.qqsuccubus.fleet.coordinator.events;

import com.qqsuccubus.fleet.core.msg.ClusterEvents;
import com.qqsuccubus.fleet.core.msg.ClusterEvents.ClusterEvent;
import com.qqsuccubus.fleet.core.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;

/**
 * In-process event publisher.
 * <p>
 * Every event is logged as JSON and multicast to current subscribers of
 * {@link #events()}. Slow subscribers lose events rather than stall the
 * coordinator; with no subscriber the event is only logged.
 * </p>
 */
public class ClusterEventBus implements IClusterEventPublisher {
    private static final Logger log = LoggerFactory.getLogger(ClusterEventBus.class);

    private static final Duration EMIT_RETRY = Duration.ofMillis(100);

    private final Sinks.Many<ClusterEvent> sink = Sinks.many().multicast().directBestEffort();

    /**
     * Hot stream of events emitted after subscription.
     */
    public Flux<ClusterEvent> events() {
        return sink.asFlux();
    }

    @Override
    public Mono<Void> publishNodeRegistered(ClusterEvents.NodeRegistered event) {
        return emit(event);
    }

    @Override
    public Mono<Void> publishNodeLost(ClusterEvents.NodeLost event) {
        return emit(event);
    }

    @Override
    public Mono<Void> publishNodeStatusChanged(ClusterEvents.NodeStatusChanged event) {
        return emit(event);
    }

    @Override
    public Mono<Void> publishRecommendation(ClusterEvents.RecommendationIssued event) {
        return emit(event);
    }

    @Override
    public void close() {
        sink.tryEmitComplete();
        log.info("Cluster event bus closed");
    }

    private Mono<Void> emit(ClusterEvent event) {
        return Mono.fromRunnable(() -> {
            log.info("Cluster event: {}", JsonUtils.writeValueAsString(event));
            // Concurrent emitters are serialized by retrying; missing subscribers drop the event
            sink.emitNext(event, Sinks.EmitFailureHandler.busyLooping(EMIT_RETRY));
        });
    }
}
