package com.agentflow.core.scheduler;

import com.agentflow.core.logging.MdcContext;
import com.agentflow.core.metrics.OrchestrationMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Table of named periodic jobs, each started and stopped on its own.
 * <p>
 * The table owns no thread. Whoever drives it calls {@link #runDue()}; every
 * enabled job whose next run time has passed on the injected {@link Clock} is
 * handed to the executor. A job never overlaps itself. After a normal run the
 * next run is one period later; after a run that threw it is the longer of
 * the period and the failure backoff later, so a failure never brings a run
 * forward. Stopping a job only prevents future runs.
 */
public class SweepJobTable {

    private static final Logger log = LoggerFactory.getLogger(SweepJobTable.class);

    private final Clock clock;
    private final Executor executor;
    private final OrchestrationMetrics metrics;
    private final Map<String, Job> jobs = new LinkedHashMap<>();

    public SweepJobTable(Clock clock, Executor executor, OrchestrationMetrics metrics) {
        this.clock = clock;
        this.executor = executor;
        this.metrics = metrics;
    }

    public synchronized void register(String name, Duration period, Duration failureBackoff, Runnable body) {
        if (jobs.containsKey(name)) {
            throw new IllegalArgumentException("Job already registered: " + name);
        }
        if (period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("Job period must be positive: " + name);
        }
        jobs.put(name, new Job(name, period, failureBackoff, body));
    }

    /**
     * Enables a job; its first run is due one period from now.
     *
     * @return false if the job was already enabled
     */
    public synchronized boolean start(String name) {
        Job job = require(name);
        if (job.enabled) {
            return false;
        }
        job.nextRunAt = clock.instant().plus(job.period);
        job.enabled = true;
        log.debug("Job {} started (every {})", name, job.period);
        return true;
    }

    /**
     * @return false if the job was not enabled
     */
    public synchronized boolean stop(String name) {
        Job job = require(name);
        if (!job.enabled) {
            return false;
        }
        job.enabled = false;
        log.debug("Job {} stopped", name);
        return true;
    }

    public synchronized void startAll() {
        jobs.keySet().forEach(this::start);
    }

    public synchronized void stopAll() {
        jobs.keySet().forEach(this::stop);
    }

    /**
     * Dispatches every job that is due.
     *
     * @return number of jobs dispatched
     */
    public int runDue() {
        List<Job> due = new ArrayList<>();
        synchronized (this) {
            Instant now = clock.instant();
            for (Job job : jobs.values()) {
                if (job.enabled && !now.isBefore(job.nextRunAt) && job.running.compareAndSet(false, true)) {
                    due.add(job);
                }
            }
        }
        int dispatched = 0;
        for (Job job : due) {
            try {
                executor.execute(() -> run(job));
                dispatched++;
            } catch (RejectedExecutionException e) {
                job.running.set(false);
                log.warn("Job {} could not be dispatched: {}", job.name, e.getMessage());
            }
        }
        return dispatched;
    }

    public synchronized Optional<JobState> state(String name) {
        Job job = jobs.get(name);
        return job == null ? Optional.empty() : Optional.of(job.state());
    }

    public synchronized List<JobState> states() {
        return jobs.values().stream().map(Job::state).toList();
    }

    private void run(Job job) {
        MdcContext.setSweep(job.name);
        long started = System.nanoTime();
        try {
            job.body.run();
            job.consecutiveFailures = 0;
            job.nextRunAt = clock.instant().plus(job.period);
        } catch (RuntimeException e) {
            job.consecutiveFailures++;
            Duration delay = job.retryDelay();
            job.nextRunAt = clock.instant().plus(delay);
            metrics.recordSweepFailure(job.name);
            log.error("Job {} failed ({} in a row); next run in {}", job.name, job.consecutiveFailures, delay, e);
        } finally {
            job.lastRunAt = clock.instant();
            metrics.recordSweep(job.name, Duration.ofNanos(System.nanoTime() - started));
            job.running.set(false);
            MdcContext.clear();
        }
    }

    private Job require(String name) {
        Job job = jobs.get(name);
        if (job == null) {
            throw new IllegalArgumentException("Unknown job: " + name);
        }
        return job;
    }

    private static final class Job {
        private final String name;
        private final Duration period;
        private final Duration failureBackoff;
        private final Runnable body;
        private final AtomicBoolean running = new AtomicBoolean();
        private volatile boolean enabled;
        private volatile Instant nextRunAt;
        private volatile Instant lastRunAt;
        private volatile int consecutiveFailures;

        Job(String name, Duration period, Duration failureBackoff, Runnable body) {
            this.name = name;
            this.period = period;
            this.failureBackoff = failureBackoff;
            this.body = body;
        }

        Duration retryDelay() {
            return failureBackoff.compareTo(period) > 0 ? failureBackoff : period;
        }

        JobState state() {
            return new JobState(name, period, enabled, running.get(), nextRunAt, lastRunAt, consecutiveFailures);
        }
    }
}
