package com.qqsuccubus.fleet.coordinator.optimize;

import com.qqsuccubus.fleet.coordinator.config.CoordinatorConfig;
import lombok.Builder;
import lombok.Value;

/**
 * Utilization percentages the optimizer compares cluster averages against.
 */
@Value
@Builder(toBuilder = true)
public class OptimizationThresholds {
    double cpuHigh;
    double cpuLow;
    double memoryHigh;
    double memoryLow;

    public static OptimizationThresholds from(CoordinatorConfig config) {
        return OptimizationThresholds.builder()
            .cpuHigh(config.getCpuHighThreshold())
            .cpuLow(config.getCpuLowThreshold())
            .memoryHigh(config.getMemoryHighThreshold())
            .memoryLow(config.getMemoryLowThreshold())
            .build();
    }

    CoordinatorConfig applyTo(CoordinatorConfig config) {
        return config.toBuilder()
            .cpuHighThreshold(cpuHigh)
            .cpuLowThreshold(cpuLow)
            .memoryHighThreshold(memoryHigh)
            .memoryLowThreshold(memoryLow)
            .build();
    }
}
