package com.switchyard.core.orchestrator;

import com.switchyard.core.events.EventBus;
import com.switchyard.core.events.SwitchyardEvent;
import com.switchyard.core.logging.MdcContext;
import com.switchyard.core.metrics.SwitchyardMetrics;
import com.switchyard.core.model.AgentCategory;
import com.switchyard.core.model.HandlerOutcome;
import com.switchyard.core.model.RouteRequest;
import com.switchyard.core.model.TaskPriority;
import com.switchyard.core.model.TaskResult;
import com.switchyard.core.queue.ChannelHandler;
import com.switchyard.core.queue.DispatchQueue;
import com.switchyard.core.queue.TaskDispatchException;
import com.switchyard.core.queue.TaskTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Routes free-text requests to registered domain handlers.
 * <p>
 * Flow: pick a category (explicit preference or keyword classification), resolve the
 * handler (falling back to the general handler when the category is offline), invoke
 * it directly or through its bound dispatch channel, optionally pass a successful
 * output through the inspector, then record the result in a bounded history.
 * <p>
 * {@link #route(RouteRequest)} never throws; every failure becomes a failed
 * {@link TaskResult}.
 */
public class Orchestrator {

    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);

    static final String AGENT_COMMAND = "process";

    private final IntentClassifier classifier;
    private final DispatchQueue dispatchQueue;
    private final OrchestratorProperties properties;
    private final EventBus eventBus;
    private final SwitchyardMetrics metrics;

    private final Map<AgentCategory, AgentHandler> handlers = new ConcurrentHashMap<>();
    private final Map<AgentCategory, String> channelBindings = new ConcurrentHashMap<>();
    private final Deque<TaskResult> history = new ArrayDeque<>();
    private final AtomicLong requestCounter = new AtomicLong();

    public Orchestrator(IntentClassifier classifier, DispatchQueue dispatchQueue,
                        OrchestratorProperties properties, EventBus eventBus, SwitchyardMetrics metrics) {
        this.classifier = classifier;
        this.dispatchQueue = dispatchQueue;
        this.properties = properties;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public Orchestrator(IntentClassifier classifier, DispatchQueue dispatchQueue, OrchestratorProperties properties) {
        this(classifier, dispatchQueue, properties, new EventBus(), null);
    }

    public Orchestrator() {
        this(new IntentClassifier(), new DispatchQueue(), new OrchestratorProperties());
    }

    // -- Registration ----------------------------------------------------------

    /**
     * Registers (or replaces) the handler for a category. If the category has a channel
     * binding under {@code switchyard.orchestrator.channels}, the handler runs through
     * that dispatch channel with the channel's configured concurrency.
     */
    public void registerHandler(AgentCategory category, AgentHandler handler) {
        String channel = properties.getChannels().get(category.value());
        if (channel != null) {
            bindChannel(category, handler, channel, -1);
            return;
        }
        handlers.put(category, handler);
        channelBindings.remove(category);
        log.info("Registered handler for {}", category.value());
    }

    /**
     * Registers a handler whose invocations go through a dedicated dispatch channel,
     * which bounds how many requests for this category run at once.
     *
     * @throws IllegalStateException if the channel name is already taken
     */
    public void registerHandler(AgentCategory category, AgentHandler handler, String channel, int concurrency) {
        bindChannel(category, handler, channel, concurrency);
    }

    private void bindChannel(AgentCategory category, AgentHandler handler, String channel, int concurrency) {
        ChannelHandler channelHandler = (command, payload) -> invokeOnChannel(handler, payload);
        if (concurrency < 0) {
            dispatchQueue.register(channel, channelHandler);
        } else {
            dispatchQueue.register(channel, channelHandler, concurrency);
        }
        handlers.put(category, handler);
        channelBindings.put(category, channel);
        log.info("Registered handler for {} on channel {}", category.value(), channel);
    }

    @SuppressWarnings("unchecked")
    private static Object invokeOnChannel(AgentHandler handler, Map<String, Object> payload)
            throws HandlerFailedException {
        String message = (String) payload.get("message");
        Map<String, Object> context = (Map<String, Object>) payload.getOrDefault("context", Map.of());
        HandlerOutcome outcome = handler.process(message, context);
        if (outcome instanceof HandlerOutcome.Failure failure) {
            throw new HandlerFailedException(failure.error());
        }
        return ((HandlerOutcome.Success) outcome).output();
    }

    // -- Routing ---------------------------------------------------------------

    public TaskResult route(String message) {
        return route(RouteRequest.of(message));
    }

    public TaskResult route(RouteRequest request) {
        AgentCategory requested = request.preferredCategory() != null
                ? request.preferredCategory()
                : classifier.classify(request.message());
        String requestId = "req-" + requestCounter.incrementAndGet();
        MdcContext.setRequest(requestId, requested.value());
        try {
            log.info("Routing request to {}", requested.value());
            TaskResult result = dispatch(requested, request);
            if (request.requireReview() && result.success()) {
                result = review(result, request);
            }
            record(result);
            eventBus.publish(SwitchyardEvent.of("route.completed", "orchestrator", requestId, Map.of(
                    "category", result.agent().value(),
                    "success", result.success())));
            if (metrics != null) {
                metrics.recordRoute(result.agent().value(), result.success());
            }
            return result;
        } finally {
            MdcContext.clear();
        }
    }

    private TaskResult dispatch(AgentCategory requested, RouteRequest request) {
        AgentCategory target = requested;
        var metadata = new LinkedHashMap<String, Object>();
        AgentHandler handler = handlers.get(requested);

        if (handler == null && requested != AgentCategory.GENERAL) {
            handler = handlers.get(AgentCategory.GENERAL);
            if (handler == null) {
                log.warn("No handler for {} and no general fallback", requested.value());
                return TaskResult.failed(requested, "Agent category '" + requested.value() + "' is offline.", null);
            }
            log.warn("No handler for {}, falling back to general", requested.value());
            target = AgentCategory.GENERAL;
            metadata.put("fallback_from", requested.value());
        }

        if (handler == null) {
            metadata.put("acknowledged_only", true);
            return TaskResult.succeeded(AgentCategory.GENERAL,
                    "Processing general request: " + truncate(request.message(), 100), metadata);
        }

        HandlerOutcome outcome = invoke(target, handler, request);
        if (outcome instanceof HandlerOutcome.Success success) {
            return TaskResult.succeeded(target, success.output(), metadata);
        }
        String error = ((HandlerOutcome.Failure) outcome).error();
        log.warn("Handler for {} failed: {}", target.value(), error);
        return TaskResult.failed(target, error, metadata);
    }

    private HandlerOutcome invoke(AgentCategory category, AgentHandler handler, RouteRequest request) {
        String channel = channelBindings.get(category);
        if (channel == null) {
            try {
                HandlerOutcome outcome = handler.process(request.message(), request.context());
                return outcome != null ? outcome : HandlerOutcome.failure("Handler returned no outcome");
            } catch (Exception | Error e) {
                log.error("Handler for {} threw", category.value(), e);
                return HandlerOutcome.failure(describe(e));
            }
        }

        try {
            String taskId = dispatchQueue.submit(channel, AGENT_COMMAND,
                    Map.of("message", request.message(), "context", request.context()),
                    TaskPriority.NORMAL, properties.getQueueMaxRetries());
            return HandlerOutcome.success(dispatchQueue.awaitResult(taskId, properties.getQueueTimeout()));
        } catch (TaskTimeoutException e) {
            return HandlerOutcome.failure("Timed out after " + properties.getQueueTimeout().toSeconds()
                    + "s waiting for " + category.value());
        } catch (TaskDispatchException e) {
            return HandlerOutcome.failure(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Could not dispatch {} request to channel {}", category.value(), channel, e);
            return HandlerOutcome.failure(describe(e));
        }
    }

    private TaskResult review(TaskResult result, RouteRequest request) {
        AgentHandler inspector = handlers.get(AgentCategory.INSPECTOR);
        if (inspector == null) {
            return result.withMetadata(Map.of("reviewed", false));
        }
        var metadata = new LinkedHashMap<String, Object>();
        try {
            HandlerOutcome verdict = inspector.review(result.output(), request.context());
            if (verdict instanceof HandlerOutcome.Success success) {
                metadata.put("reviewed", true);
                if (success.output() != null) {
                    metadata.put("review_result", success.output());
                }
            } else {
                metadata.put("reviewed", false);
                metadata.put("review_error", ((HandlerOutcome.Failure) verdict).error());
            }
        } catch (Exception | Error e) {
            log.warn("Review of {} output failed: {}", result.agent().value(), e.getMessage());
            metadata.put("reviewed", false);
            metadata.put("review_error", describe(e));
        }
        return result.withMetadata(metadata);
    }

    // -- Introspection ---------------------------------------------------------

    /**
     * Registration state of every category, in declaration order.
     */
    public Map<String, String> getAgentStatus() {
        var status = new LinkedHashMap<String, String>();
        for (AgentCategory category : AgentCategory.values()) {
            status.put(category.value(), handlers.containsKey(category) ? "registered" : "not_registered");
        }
        return status;
    }

    public Map<String, String> getChannelBindings() {
        var bindings = new LinkedHashMap<String, String>();
        for (AgentCategory category : AgentCategory.values()) {
            String channel = channelBindings.get(category);
            if (channel != null) {
                bindings.put(category.value(), channel);
            }
        }
        return bindings;
    }

    public List<TaskSummary> getTaskHistory() {
        return getTaskHistory(properties.getDefaultHistoryLimit());
    }

    /**
     * Most recent results, oldest first.
     */
    public List<TaskSummary> getTaskHistory(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        var recent = new ArrayList<TaskSummary>();
        synchronized (history) {
            Iterator<TaskResult> newestFirst = history.descendingIterator();
            while (newestFirst.hasNext() && recent.size() < limit) {
                TaskResult r = newestFirst.next();
                recent.add(new TaskSummary(r.agent().value(), r.success(), r.error(), r.timestamp()));
            }
        }
        Collections.reverse(recent);
        return recent;
    }

    public boolean isRegistered(AgentCategory category) {
        return handlers.containsKey(category);
    }

    private void record(TaskResult result) {
        synchronized (history) {
            history.addLast(result);
            while (history.size() > properties.getHistorySize()) {
                history.removeFirst();
            }
        }
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static String truncate(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max);
    }
}
