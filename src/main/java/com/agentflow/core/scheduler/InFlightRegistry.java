package com.agentflow.core.scheduler;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-task mutual exclusion shared by every sweep: at most one processing
 * pass per task at a time. Callers must release in a {@code finally} block.
 */
@Component
public class InFlightRegistry {

    private final Set<Long> inFlight = ConcurrentHashMap.newKeySet();

    /**
     * @return true if the caller now owns the task, false if it is already being processed
     */
    public boolean tryAcquire(long taskId) {
        return inFlight.add(taskId);
    }

    public void release(long taskId) {
        inFlight.remove(taskId);
    }

    public boolean contains(long taskId) {
        return inFlight.contains(taskId);
    }

    public List<Long> snapshot() {
        return inFlight.stream().sorted().toList();
    }
}
