package com.switchyard.core.queue;

import java.util.Map;

/**
 * Executes one command against the system behind a channel (a CAD session, a trading
 * terminal). Throwing marks the attempt as failed; the queue decides whether to retry.
 */
@FunctionalInterface
public interface ChannelHandler {
    Object handle(String command, Map<String, Object> payload) throws Exception;
}
