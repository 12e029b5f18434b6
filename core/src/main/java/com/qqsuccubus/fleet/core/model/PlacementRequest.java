package com.qqsuccubus.fleet.core.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

/**
 * Ephemeral request to place a unit of work on a node.
 * <p>
 * The task itself stays opaque; only its required capabilities drive selection.
 * When {@code taskId} is set, the resulting placement is tracked so it can be
 * invalidated if the chosen node is lost.
 * </p>
 */
@Value
@Builder
public class PlacementRequest {
    String taskId;

    @Singular
    Set<String> requiredCapabilities;

    public static PlacementRequest of(Set<String> requiredCapabilities) {
        return PlacementRequest.builder()
            .requiredCapabilities(requiredCapabilities == null ? Set.of() : requiredCapabilities)
            .build();
    }
}
