package com.qqsuccubus.fleet.coordinator.metrics;

import com.qqsuccubus.fleet.core.metrics.MetricsTags;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prometheus metrics exporter.
 * Components register against the composite registry; the Prometheus registry
 * behind it renders the scrape text.
 */
public class PrometheusMetricsExporter {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsExporter.class);

    @Getter
    private final MeterRegistry registry;
    private final PrometheusMeterRegistry prometheusRegistry;

    public PrometheusMetricsExporter(String nodeId) {
        CompositeMeterRegistry composite = new CompositeMeterRegistry();
        this.prometheusRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        composite.add(prometheusRegistry);

        composite.config().commonTags(MetricsTags.NODE_ID, nodeId);
        this.registry = composite;
        log.info("Metrics exporter initialized for {} with Prometheus registry", nodeId);
    }

    public String scrape() {
        return prometheusRegistry.scrape();
    }

    public void close() {
        registry.close();
    }
}
