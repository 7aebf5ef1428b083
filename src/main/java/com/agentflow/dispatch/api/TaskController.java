package com.agentflow.dispatch.api;

import com.agentflow.core.model.Communication;
import com.agentflow.core.model.Task;
import com.agentflow.core.model.TaskPriority;
import com.agentflow.core.model.TaskStatus;
import com.agentflow.core.store.OrchestrationStore;
import com.agentflow.core.workflow.TaskService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.LongFunction;

/**
 * REST controller for task intake, inspection and pause/resume.
 */
@RestController
@RequestMapping("/api/v1/tasks")
public class TaskController {

    private static final Logger log = LoggerFactory.getLogger(TaskController.class);

    private final TaskService taskService;
    private final OrchestrationStore store;
    private final SseStreamingService sseStreamingService;

    public TaskController(TaskService taskService, OrchestrationStore store,
                          SseStreamingService sseStreamingService) {
        this.taskService = taskService;
        this.store = store;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * POST /api/v1/tasks: submit a task. Auto-assignment picks it up.
     */
    @PostMapping
    public ResponseEntity<?> submit(@RequestBody TaskRequest request) {
        if (request.title() == null || request.title().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Title is required"));
        }
        TaskPriority priority;
        try {
            priority = request.priority() == null ? TaskPriority.MEDIUM : TaskPriority.of(request.priority());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "Invalid priority: " + request.priority()));
        }
        Task task = taskService.submit(request.title(), request.description(), priority);
        log.info("Accepted task {} via API", task.id());
        return ResponseEntity.status(HttpStatus.CREATED).body(task);
    }

    /**
     * GET /api/v1/tasks[?status=...]: newest first.
     */
    @GetMapping
    public ResponseEntity<?> list(@RequestParam(required = false) String status) {
        if (status == null) {
            return ResponseEntity.ok(store.findTasks());
        }
        try {
            return ResponseEntity.ok(store.findTasksByStatus(List.of(TaskStatus.of(status))));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "Invalid status: " + status));
        }
    }

    @GetMapping("/{id}")
    public ResponseEntity<Task> get(@PathVariable long id) {
        return store.findTask(id).map(ResponseEntity::ok).orElse(ResponseEntity.notFound().build());
    }

    /**
     * GET /api/v1/tasks/{id}/communications: oldest first.
     */
    @GetMapping("/{id}/communications")
    public ResponseEntity<List<Communication>> communications(@PathVariable long id) {
        if (store.findTask(id).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(store.findCommunicationsByTask(id));
    }

    @PostMapping("/{id}/pause")
    public ResponseEntity<?> pause(@PathVariable long id) {
        return control(id, taskService::pauseTask, "Task cannot be paused in its current status");
    }

    /**
     * POST /api/v1/tasks/{id}/resume: resumes a paused task, or restarts an
     * escalated one from intake.
     */
    @PostMapping("/{id}/resume")
    public ResponseEntity<?> resume(@PathVariable long id) {
        return control(id, taskService::resumeTask, "Task is neither paused nor escalated");
    }

    @GetMapping(value = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> events(@PathVariable long id) {
        if (store.findTask(id).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(sseStreamingService.createTaskEmitter(id));
    }

    private ResponseEntity<?> control(long id, LongFunction<Optional<Task>> operation, String conflictMessage) {
        Optional<Task> current = store.findTask(id);
        if (current.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        Optional<Task> updated = operation.apply(id);
        if (updated.isEmpty()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of(
                    "error", conflictMessage,
                    "status", current.get().status().value()));
        }
        return ResponseEntity.ok(updated.get());
    }
}
