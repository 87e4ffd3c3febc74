package com.switchyard.core.queue;

/**
 * Thrown to a waiting caller when a task exhausted its retries.
 */
public class TaskFailedException extends TaskDispatchException {

    private final int attempts;

    public TaskFailedException(String taskId, String error, int attempts) {
        super(taskId, error);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
