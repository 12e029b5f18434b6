package com.qqsuccubus.fleet.core.error;

import lombok.Getter;

import java.util.List;

/**
 * Thrown at start-up when configuration values violate an invariant.
 */
@Getter
public class ConfigurationInvalidException extends CoordinationException {

    private final List<String> violations;

    public ConfigurationInvalidException(List<String> violations) {
        super("Invalid configuration: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }
}
