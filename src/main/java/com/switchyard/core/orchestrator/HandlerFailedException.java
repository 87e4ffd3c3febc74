package com.switchyard.core.orchestrator;

/**
 * Carries a handler's {@code Failure} outcome through a dispatch channel so the queue
 * counts the attempt as failed.
 */
class HandlerFailedException extends Exception {

    HandlerFailedException(String message) {
        super(message);
    }
}
