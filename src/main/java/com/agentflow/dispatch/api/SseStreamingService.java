package com.agentflow.dispatch.api;

import com.agentflow.core.events.EventBus;
import com.agentflow.core.events.OrchestrationEvent;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Bridges {@link EventBus} subscriptions to {@link SseEmitter}s.
 * <p>
 * One emitter per client, subscribed either to a single task or to every
 * event. Idle connections are kept open by periodic SSE comment lines, which
 * EventSource clients ignore.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;

    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    private final EventBus eventBus;
    private final long timeoutMs;

    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(EventBus eventBus) {
        this(eventBus, DEFAULT_TIMEOUT_MS);
    }

    SseStreamingService(EventBus eventBus, long timeoutMs) {
        this.eventBus = eventBus;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS, HEARTBEAT_INTERVAL_SECONDS, TimeUnit.SECONDS);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdown();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Emitter for one task's events.
     */
    public SseEmitter createTaskEmitter(long taskId) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        return register("task " + taskId, emitter, eventBus.subscribe(taskId, event -> sendEvent(emitter, event)));
    }

    /**
     * Emitter for every event the orchestrator publishes.
     */
    public SseEmitter createGlobalEmitter() {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        return register("all events", emitter, eventBus.subscribeAll(event -> sendEvent(emitter, event)));
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    private SseEmitter register(String scope, SseEmitter emitter, EventBus.Subscription subscription) {
        var registration = new EmitterRegistration(scope, emitter, subscription);
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> cleanup(registration));
        emitter.onTimeout(() -> cleanup(registration));
        emitter.onError(ex -> {
            log.debug("SSE emitter error for {}: {}", scope, ex.getMessage());
            cleanup(registration);
        });

        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException e) {
            log.warn("Failed to confirm SSE connection for {}: {}", scope, e.getMessage());
        }
        log.info("SSE emitter created for {} (timeout={}ms)", scope, timeoutMs);
        return emitter;
    }

    private void sendHeartbeats() {
        for (EmitterRegistration registration : activeRegistrations) {
            try {
                registration.emitter.send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException | IllegalStateException e) {
                // the emitter's own callbacks remove it
                log.debug("Heartbeat skipped for {}: {}", registration.scope, e.getMessage());
            }
        }
    }

    private void sendEvent(SseEmitter emitter, OrchestrationEvent event) {
        try {
            Map<String, Object> data = new LinkedHashMap<>();
            if (event.taskId() != null) {
                data.put("taskId", event.taskId());
            }
            data.putAll(event.payload());
            data.put("timestamp", event.timestamp().toString());
            emitter.send(SseEmitter.event().name(event.eventType()).data(data));
        } catch (IOException | IllegalStateException e) {
            log.debug("Failed to send SSE event {}: {}", event.eventType(), e.getMessage());
        }
    }

    private void cleanup(EmitterRegistration registration) {
        registration.subscription.unsubscribe();
        activeRegistrations.remove(registration);
    }

    private record EmitterRegistration(String scope, SseEmitter emitter, EventBus.Subscription subscription) {}
}
