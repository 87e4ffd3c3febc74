package com.switchyard.core.model;

/**
 * Explicit outcome of a handler invocation: either an output or an error message.
 * Handlers report failure through {@link Failure} instead of throwing.
 */
public sealed interface HandlerOutcome permits HandlerOutcome.Success, HandlerOutcome.Failure {

    boolean isSuccess();

    static HandlerOutcome success(Object output) {
        return new Success(output);
    }

    static HandlerOutcome failure(String error) {
        return new Failure(error);
    }

    record Success(Object output) implements HandlerOutcome {
        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    record Failure(String error) implements HandlerOutcome {
        public Failure {
            if (error == null || error.isBlank()) {
                error = "Handler reported failure without a message";
            }
        }

        @Override
        public boolean isSuccess() {
            return false;
        }
    }
}
