package io.hermes.server.registry;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.hermes.server.config.A2AConfig;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically runs the registry's liveness sweep on a single daemon thread.
 */
@ApplicationScoped
public class LivenessMonitor {

    private static final Logger LOGGER = LoggerFactory.getLogger(LivenessMonitor.class);

    private final AgentRegistry registry;
    private final Duration interval;
    private @Nullable ScheduledExecutorService scheduler;

    @Inject
    public LivenessMonitor(AgentRegistry registry, A2AConfig config) {
        this(registry, config.sweepInterval());
    }

    public LivenessMonitor(AgentRegistry registry, Duration interval) {
        this.registry = registry;
        this.interval = interval;
    }

    @PostConstruct
    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        if (interval.isZero() || interval.isNegative()) {
            LOGGER.info("Liveness sweeper disabled");
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "hermes-liveness");
            thread.setDaemon(true);
            return thread;
        });
        long millis = interval.toMillis();
        scheduler.scheduleAtFixedRate(this::sweepSafely, millis, millis, TimeUnit.MILLISECONDS);
        LOGGER.info("Liveness sweeper started, interval {}", interval);
    }

    @PreDestroy
    public synchronized void stop() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
            LOGGER.info("Liveness sweeper stopped");
        }
    }

    public synchronized boolean isRunning() {
        return scheduler != null;
    }

    void sweepSafely() {
        try {
            int changed = registry.sweep();
            if (changed > 0) {
                LOGGER.debug("Liveness sweep changed {} agents", changed);
            }
        } catch (RuntimeException e) {
            // an exception would cancel the periodic task
            LOGGER.error("Liveness sweep failed", e);
        }
    }
}
