package com.qqsuccubus.fleet.coordinator.task;

import com.qqsuccubus.fleet.core.metrics.MetricsNames;
import com.qqsuccubus.fleet.core.metrics.MetricsTags;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Supervised background loop running one iteration per interval.
 * <p>
 * Iterations never overlap. A failing iteration is logged and counted, and the
 * loop carries on at the next tick. {@link #stop()} cancels the schedule and
 * returns only after an in-flight iteration has finished.
 * </p>
 */
public class PeriodicTask {
    private static final Logger log = LoggerFactory.getLogger(PeriodicTask.class);

    private final String name;
    private final Duration interval;
    private final Runnable iteration;
    private final Counter failures;

    private final ReentrantLock iterationLock = new ReentrantLock();
    private final AtomicBoolean running = new AtomicBoolean(false);

    private Scheduler scheduler;
    private Disposable subscription;

    public PeriodicTask(String name, Duration interval, Runnable iteration, MeterRegistry meterRegistry) {
        this.name = name;
        this.interval = interval;
        this.iteration = iteration;
        this.failures = Counter.builder(MetricsNames.LOOP_FAILURES_TOTAL)
            .tag(MetricsTags.TASK, name)
            .register(meterRegistry);
    }

    /**
     * Starts ticking. The first iteration runs one interval after start.
     */
    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Task {} already running", name);
            return;
        }

        // Single worker allowed to block, so iterations may wait on reactive publishers
        scheduler = Schedulers.newBoundedElastic(1, 16, "fleet-" + name, 60, true);
        subscription = Flux.interval(interval, interval, scheduler)
            .subscribe(
                tick -> runOnce(),
                err -> log.error("Task {} schedule terminated unexpectedly", name, err)
            );

        log.info("Task {} started (interval={})", name, interval);
    }

    /**
     * Cancels the schedule and waits for the current iteration, if any, to finish.
     */
    public synchronized void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }

        // Wait for the in-flight iteration before cancelling: disposal interrupts the worker
        iterationLock.lock();
        try {
            subscription.dispose();
        } finally {
            iterationLock.unlock();
        }

        scheduler.dispose();
        log.info("Task {} stopped", name);
    }

    public boolean isRunning() {
        return running.get();
    }

    public String getName() {
        return name;
    }

    void runOnce() {
        if (!running.get()) {
            return;
        }
        iterationLock.lock();
        try {
            if (!running.get()) {
                return;
            }
            iteration.run();
        } catch (RuntimeException e) {
            failures.increment();
            log.error("Task {} iteration failed, retrying at next tick", name, e);
        } finally {
            iterationLock.unlock();
        }
    }
}
