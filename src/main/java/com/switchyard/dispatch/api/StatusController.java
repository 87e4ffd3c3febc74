package com.switchyard.dispatch.api;

import com.switchyard.core.circuit.CircuitBreakerRegistry;
import com.switchyard.core.circuit.CircuitStatus;
import com.switchyard.core.events.EventBus;
import com.switchyard.core.events.SwitchyardEvent;
import com.switchyard.core.orchestrator.Orchestrator;
import com.switchyard.core.orchestrator.TaskSummary;
import com.switchyard.core.queue.ChannelStatus;
import com.switchyard.core.queue.DispatchQueue;
import com.switchyard.core.queue.QueuedTask;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for handler, queue and circuit introspection plus operator actions
 * (pause/resume a channel, cancel a pending task, reset a circuit). Also exposes the
 * event tail and a live SSE event stream.
 */
@RestController
@RequestMapping("/api/v1/status")
public class StatusController {

    private final Orchestrator orchestrator;
    private final DispatchQueue dispatchQueue;
    private final CircuitBreakerRegistry circuitBreakers;
    private final EventBus eventBus;
    private final EventStreamService eventStreamService;

    public StatusController(Orchestrator orchestrator, DispatchQueue dispatchQueue,
                            CircuitBreakerRegistry circuitBreakers, EventBus eventBus,
                            EventStreamService eventStreamService) {
        this.orchestrator = orchestrator;
        this.dispatchQueue = dispatchQueue;
        this.circuitBreakers = circuitBreakers;
        this.eventBus = eventBus;
        this.eventStreamService = eventStreamService;
    }

    @GetMapping("/agents")
    public Map<String, String> agents() {
        return orchestrator.getAgentStatus();
    }

    @GetMapping("/history")
    public List<TaskSummary> history(@RequestParam(name = "limit", required = false) Integer limit) {
        return limit == null ? orchestrator.getTaskHistory() : orchestrator.getTaskHistory(limit);
    }

    @GetMapping("/queues")
    public Map<String, ChannelStatus> queues() {
        return dispatchQueue.getQueueStatus();
    }

    @GetMapping("/queues/{channel}/tasks")
    public ResponseEntity<?> tasks(@PathVariable String channel) {
        if (!dispatchQueue.isRegistered(channel)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(dispatchQueue.listTasks(channel).stream().map(StatusController::describe).toList());
    }

    @PostMapping("/queues/{channel}/pause")
    public ResponseEntity<?> pause(@PathVariable String channel) {
        if (!dispatchQueue.isRegistered(channel)) {
            return ResponseEntity.notFound().build();
        }
        dispatchQueue.pause(channel);
        return ResponseEntity.ok(Map.of("channel", channel, "paused", true));
    }

    @PostMapping("/queues/{channel}/resume")
    public ResponseEntity<?> resume(@PathVariable String channel) {
        if (!dispatchQueue.isRegistered(channel)) {
            return ResponseEntity.notFound().build();
        }
        dispatchQueue.resume(channel);
        return ResponseEntity.ok(Map.of("channel", channel, "paused", false));
    }

    @PostMapping("/tasks/{taskId}/cancel")
    public ResponseEntity<?> cancel(@PathVariable String taskId) {
        QueuedTask task = dispatchQueue.getTask(taskId);
        if (task == null) {
            return ResponseEntity.notFound().build();
        }
        boolean cancelled = dispatchQueue.cancel(taskId);
        if (!cancelled) {
            return ResponseEntity.status(409).body(Map.of(
                    "error", "Task " + taskId + " is " + task.getStatus() + " and cannot be cancelled"));
        }
        return ResponseEntity.ok(Map.of("task_id", taskId, "status", "CANCELLED"));
    }

    @GetMapping("/circuits")
    public Map<String, CircuitStatus> circuits() {
        return circuitBreakers.getCircuitStatus();
    }

    @PostMapping("/circuits/{name}/reset")
    public ResponseEntity<?> resetCircuit(@PathVariable String name) {
        if (!circuitBreakers.reset(name)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(Map.of("circuit", name, "state", circuitBreakers.getState(name).value()));
    }

    /**
     * GET /api/v1/status/events: most recent events, oldest first.
     */
    @GetMapping("/events")
    public List<Map<String, Object>> events(@RequestParam(name = "limit", defaultValue = "50") int limit,
                                            @RequestParam(name = "source", required = false) String source) {
        return eventBus.recent(source, limit).stream().map(StatusController::describeEvent).toList();
    }

    /**
     * GET /api/v1/status/events/stream: SSE stream of live events, optionally for one source.
     */
    @GetMapping(value = "/events/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamEvents(@RequestParam(name = "source", required = false) String source,
                                   @RequestParam(name = "replay", defaultValue = "0") int replay) {
        return eventStreamService.open(source, replay);
    }

    private static Map<String, Object> describeEvent(SwitchyardEvent event) {
        var view = new LinkedHashMap<String, Object>();
        view.put("type", event.eventType());
        view.putAll(EventStreamService.frame(event));
        return view;
    }

    private static Map<String, Object> describe(QueuedTask task) {
        var view = new LinkedHashMap<String, Object>();
        view.put("id", task.getId());
        view.put("command", task.getCommand());
        view.put("priority", task.getPriority().name());
        view.put("status", task.getStatus().name());
        view.put("retry_count", task.getRetryCount());
        view.put("max_retries", task.getMaxRetries());
        view.put("created_at", task.getCreatedAt());
        if (task.getError() != null) {
            view.put("error", task.getError());
        }
        return view;
    }
}
