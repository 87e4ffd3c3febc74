package com.switchyard.core.queue;

import java.time.Duration;

/**
 * Thrown when a caller stops waiting for a task. The task itself is unaffected and may
 * still complete later.
 */
public class TaskTimeoutException extends TaskDispatchException {

    public TaskTimeoutException(String taskId, Duration timeout) {
        super(taskId, "Task " + taskId + " timed out after " + timeout.toMillis() + "ms");
    }
}
