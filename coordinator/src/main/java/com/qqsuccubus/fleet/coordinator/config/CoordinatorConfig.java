package com.qqsuccubus.fleet.coordinator.config;

import com.qqsuccubus.fleet.core.error.ConfigurationInvalidException;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Configuration for the coordinator, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class CoordinatorConfig {

    String nodeId;

    // Liveness
    Duration heartbeatInterval;
    Duration nodeTimeout;
    Duration drainTimeout;

    // Pool bounds
    int minNodes;
    int maxNodes;

    // Optimization
    Duration optimizationInterval;
    Duration scalingCooldown;
    double cpuHighThreshold;     // percent
    double cpuLowThreshold;      // percent
    double memoryHighThreshold;  // percent
    double memoryLowThreshold;   // percent

    /**
     * Reads the configuration from the process environment.
     *
     * @throws ConfigurationInvalidException if a variable does not parse as its type
     */
    public static CoordinatorConfig fromEnv() {
        return fromEnv(System::getenv);
    }

    /**
     * Reads the configuration from {@code env}, a lookup that returns null for unset keys.
     * Unparsable values are all collected before failing.
     *
     * @throws ConfigurationInvalidException if a variable does not parse as its type
     */
    static CoordinatorConfig fromEnv(Function<String, String> env) {
        EnvReader reader = new EnvReader(env);
        CoordinatorConfig config = CoordinatorConfig.builder()
            .nodeId(reader.string("NODE_ID", "coordinator-1"))
            .heartbeatInterval(reader.seconds("HEARTBEAT_INTERVAL_SEC", 10))
            .nodeTimeout(reader.seconds("NODE_TIMEOUT_SEC", 30))
            .drainTimeout(reader.seconds("DRAIN_TIMEOUT_SEC", 300))
            .minNodes(reader.integer("MIN_NODES", 1))
            .maxNodes(reader.integer("MAX_NODES", 100))
            .optimizationInterval(reader.seconds("OPTIMIZATION_INTERVAL_SEC", 60))
            .scalingCooldown(reader.seconds("SCALING_COOLDOWN_SEC", 0))
            .cpuHighThreshold(reader.decimal("CPU_HIGH", 80.0))
            .cpuLowThreshold(reader.decimal("CPU_LOW", 20.0))
            .memoryHighThreshold(reader.decimal("MEMORY_HIGH", 85.0))
            .memoryLowThreshold(reader.decimal("MEMORY_LOW", 30.0))
            .build();

        if (!reader.violations.isEmpty()) {
            throw new ConfigurationInvalidException(reader.violations);
        }
        return config;
    }

    /**
     * Checks every invariant and reports all violations at once.
     *
     * @throws ConfigurationInvalidException if any invariant is violated
     */
    public void validate() {
        List<String> violations = new ArrayList<>();

        requirePositive(violations, "heartbeat_interval", heartbeatInterval);
        requirePositive(violations, "node_timeout", nodeTimeout);
        requirePositive(violations, "drain_timeout", drainTimeout);
        requirePositive(violations, "optimization_interval", optimizationInterval);
        if (scalingCooldown == null || scalingCooldown.isNegative()) {
            violations.add("scaling_cooldown must not be negative");
        }

        if (minNodes <= 0) {
            violations.add("min_nodes must be positive, was " + minNodes);
        }
        if (maxNodes <= 0) {
            violations.add("max_nodes must be positive, was " + maxNodes);
        }
        if (minNodes > maxNodes) {
            violations.add(String.format("min_nodes (%d) must not exceed max_nodes (%d)", minNodes, maxNodes));
        }

        requirePercent(violations, "cpu_high_threshold", cpuHighThreshold);
        requirePercent(violations, "cpu_low_threshold", cpuLowThreshold);
        requirePercent(violations, "memory_high_threshold", memoryHighThreshold);
        requirePercent(violations, "memory_low_threshold", memoryLowThreshold);
        if (cpuLowThreshold >= cpuHighThreshold) {
            violations.add("cpu_low_threshold must be below cpu_high_threshold");
        }
        if (memoryLowThreshold >= memoryHighThreshold) {
            violations.add("memory_low_threshold must be below memory_high_threshold");
        }

        if (!violations.isEmpty()) {
            throw new ConfigurationInvalidException(violations);
        }
    }

    private static void requirePositive(List<String> violations, String name, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            violations.add(name + " must be a positive duration, was " + value);
        }
    }

    private static void requirePercent(List<String> violations, String name, double value) {
        if (!(value > 0 && value <= 100)) {
            violations.add(name + " must be in (0, 100], was " + value);
        }
    }

    private static final class EnvReader {
        private final Function<String, String> env;
        private final List<String> violations = new ArrayList<>();

        private EnvReader(Function<String, String> env) {
            this.env = env;
        }

        String string(String key, String defaultValue) {
            String value = env.apply(key);
            return value != null ? value : defaultValue;
        }

        Duration seconds(String key, long defaultValue) {
            return Duration.ofSeconds(parse(key, "an integer number of seconds", Long::parseLong, defaultValue));
        }

        int integer(String key, int defaultValue) {
            return parse(key, "an integer", Integer::parseInt, defaultValue);
        }

        double decimal(String key, double defaultValue) {
            return parse(key, "a number", Double::parseDouble, defaultValue);
        }

        private <T> T parse(String key, String expected, Function<String, T> parser, T defaultValue) {
            String raw = env.apply(key);
            if (raw == null) {
                return defaultValue;
            }
            try {
                return parser.apply(raw.trim());
            } catch (NumberFormatException e) {
                violations.add(String.format("%s must be %s, was '%s'", key, expected, raw));
                return defaultValue;
            }
        }
    }
}
