package com.qqsuccubus.fleet.coordinator;

import com.qqsuccubus.fleet.coordinator.config.CoordinatorConfig;
import com.qqsuccubus.fleet.coordinator.events.ClusterEventBus;
import com.qqsuccubus.fleet.coordinator.metrics.PrometheusMetricsExporter;
import com.qqsuccubus.fleet.core.error.ConfigurationInvalidException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

public class CoordinatorApp {
    private static final Logger log = LoggerFactory.getLogger(CoordinatorApp.class);

    public static void main(String[] args) throws InterruptedException {
        CoordinatorConfig config;
        try {
            config = CoordinatorConfig.fromEnv();
        } catch (ConfigurationInvalidException e) {
            log.error("Invalid configuration: {}", e.getViolations());
            return;
        }

        log.info("Starting Fleet Coordinator");
        log.info("  Node: {}", config.getNodeId());
        log.info("  Pool: {}..{} nodes", config.getMinNodes(), config.getMaxNodes());
        log.info("  Heartbeat: every {}, timeout {}", config.getHeartbeatInterval(), config.getNodeTimeout());

        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter(config.getNodeId());
        ClusterEventBus eventBus = new ClusterEventBus();

        ClusterCoordinator coordinator;
        try {
            coordinator = new ClusterCoordinator(config, eventBus, metricsExporter.getRegistry());
            coordinator.start();
        } catch (ConfigurationInvalidException e) {
            log.error("Invalid configuration: {}", e.getViolations());
            eventBus.close();
            metricsExporter.close();
            return;
        }

        log.info("Fleet Coordinator is ready");

        CountDownLatch terminated = new CountDownLatch(1);
        handleShutDown(coordinator, eventBus, metricsExporter, terminated);

        terminated.await();
    }

    private static void handleShutDown(
        ClusterCoordinator coordinator,
        ClusterEventBus eventBus,
        PrometheusMetricsExporter metricsExporter,
        CountDownLatch terminated
    ) {
        // Graceful shutdown
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown signal received");

            coordinator.stop();

            log.info("Final cluster state: {}", coordinator.metricsSnapshot());
            if (log.isDebugEnabled()) {
                log.debug("Final metrics:\n{}", metricsExporter.scrape());
            }

            eventBus.close();
            metricsExporter.close();

            log.info("Shutdown complete");
            terminated.countDown();
        }));
    }
}
