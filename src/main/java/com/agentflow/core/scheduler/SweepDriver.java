package com.agentflow.core.scheduler;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Wall-clock ticker that drives a {@link SweepJobTable}. Tests drive the
 * table directly instead.
 */
@Component
public class SweepDriver {

    private static final Logger log = LoggerFactory.getLogger(SweepDriver.class);

    private ScheduledExecutorService ticker;

    /**
     * @return false if already ticking
     */
    public synchronized boolean start(Runnable tick, Duration interval) {
        if (ticker != null) {
            return false;
        }
        ticker = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "agentflow-sweep-driver");
            t.setDaemon(true);
            return t;
        });
        long millis = Math.max(1, interval.toMillis());
        ticker.scheduleAtFixedRate(() -> {
            try {
                tick.run();
            } catch (RuntimeException e) {
                log.error("Sweep driver tick failed", e);
            }
        }, millis, millis, TimeUnit.MILLISECONDS);
        log.info("Sweep driver started (tick={}ms)", millis);
        return true;
    }

    /**
     * Stops ticking. A tick already running is allowed to finish.
     *
     * @return false if not ticking
     */
    public synchronized boolean stop() {
        if (ticker == null) {
            return false;
        }
        ticker.shutdown();
        try {
            if (!ticker.awaitTermination(5, TimeUnit.SECONDS)) {
                ticker.shutdownNow();
            }
        } catch (InterruptedException e) {
            ticker.shutdownNow();
            Thread.currentThread().interrupt();
        }
        ticker = null;
        log.info("Sweep driver stopped");
        return true;
    }

    public synchronized boolean isRunning() {
        return ticker != null;
    }

    @PreDestroy
    void shutdown() {
        stop();
    }
}
