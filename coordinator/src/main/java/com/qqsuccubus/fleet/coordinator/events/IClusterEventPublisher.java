package com.qqsuccubus.fleet.coordinator.events;

import com.qqsuccubus.fleet.core.msg.ClusterEvents;
import reactor.core.publisher.Mono;

/**
 * Interface for publishing lifecycle events (Dependency Inversion Principle).
 */
public interface IClusterEventPublisher {
    Mono<Void> publishNodeRegistered(ClusterEvents.NodeRegistered event);
    Mono<Void> publishNodeLost(ClusterEvents.NodeLost event);
    Mono<Void> publishNodeStatusChanged(ClusterEvents.NodeStatusChanged event);
    Mono<Void> publishRecommendation(ClusterEvents.RecommendationIssued event);
    void close();
}
