package com.switchyard.core.queue;

/**
 * Base type for errors raised to callers waiting on a queued task.
 */
public class TaskDispatchException extends RuntimeException {

    private final String taskId;

    public TaskDispatchException(String taskId, String message) {
        super(message);
        this.taskId = taskId;
    }

    public TaskDispatchException(String taskId, String message, Throwable cause) {
        super(message, cause);
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
