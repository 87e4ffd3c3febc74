package com.switchyard.core.queue;

/**
 * Thrown to a waiting caller when the task was cancelled before it started.
 */
public class TaskCancelledException extends TaskDispatchException {

    public TaskCancelledException(String taskId) {
        super(taskId, "Task cancelled: " + taskId);
    }
}
