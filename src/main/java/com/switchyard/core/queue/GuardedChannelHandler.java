package com.switchyard.core.queue;

import com.switchyard.core.circuit.CircuitBreakerRegistry;
import com.switchyard.core.circuit.CircuitOperationException;

import java.util.Map;

/**
 * Runs a channel's handler through a named circuit, so queued commands against a hung
 * desktop application or an exhausted API fail fast instead of piling up.
 * <p>
 * A rejected call (open circuit, rate limit) counts as a failed attempt for the queue's
 * retry accounting. An operation failure is rethrown with its original cause.
 */
public class GuardedChannelHandler implements ChannelHandler {

    private final CircuitBreakerRegistry breakers;
    private final String circuitName;
    private final ChannelHandler delegate;

    public GuardedChannelHandler(CircuitBreakerRegistry breakers, String circuitName, ChannelHandler delegate) {
        this.breakers = breakers;
        this.circuitName = circuitName;
        this.delegate = delegate;
    }

    @Override
    public Object handle(String command, Map<String, Object> payload) throws Exception {
        try {
            return breakers.call(circuitName, () -> delegate.handle(command, payload));
        } catch (CircuitOperationException e) {
            if (e.getCause() instanceof Exception cause) {
                throw cause;
            }
            throw e;
        }
    }

    public String getCircuitName() {
        return circuitName;
    }
}
