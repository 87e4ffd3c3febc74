package com.switchyard.core.orchestrator;

import com.switchyard.core.model.HandlerOutcome;

import java.util.Map;

/**
 * A domain handler the orchestrator routes requests to. Report failure by returning
 * {@link HandlerOutcome#failure(String)}; an unexpected runtime exception is still
 * caught by the orchestrator and reported the same way.
 */
@FunctionalInterface
public interface AgentHandler {

    HandlerOutcome process(String message, Map<String, Object> context);

    /**
     * Reviews another handler's output (producer-reviewer pattern). Only called on the
     * handler registered for the inspector category. Defaults to processing the output
     * as a message.
     */
    default HandlerOutcome review(Object output, Map<String, Object> context) {
        return process(String.valueOf(output), context);
    }
}
