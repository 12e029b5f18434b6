package com.qqsuccubus.fleet.coordinator.balance;

import com.qqsuccubus.fleet.core.model.PlacementRequest;

import java.util.Optional;
import java.util.Set;

/**
 * Interface for node selection (Dependency Inversion Principle).
 */
public interface ILoadBalancer {

    /**
     * Selects the least-loaded active node offering every required capability.
     *
     * @throws com.qqsuccubus.fleet.core.error.NoEligibleNodeException if no node qualifies
     */
    String selectNode(Set<String> requiredCapabilities);

    /**
     * Same policy as {@link #selectNode(Set)}; tracks the placement when the request has a task id.
     */
    String selectNode(PlacementRequest request);

    /**
     * Node a tracked task was placed on.
     */
    Optional<String> placementOf(String taskId);
}
