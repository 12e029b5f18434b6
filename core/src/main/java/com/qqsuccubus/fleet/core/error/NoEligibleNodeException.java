package com.qqsuccubus.fleet.core.error;

import lombok.Getter;

import java.util.Set;

/**
 * Thrown when no active node declares all the required capabilities.
 * The caller should back off and retry, or raise capacity.
 */
@Getter
public class NoEligibleNodeException extends CoordinationException {

    private final Set<String> requiredCapabilities;

    public NoEligibleNodeException(Set<String> requiredCapabilities) {
        super("No active node offers capabilities " + requiredCapabilities);
        this.requiredCapabilities = Set.copyOf(requiredCapabilities);
    }
}
