package com.switchyard.core.queue;

import com.switchyard.core.model.QueuedTaskStatus;
import com.switchyard.core.model.TaskPriority;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * A unit of work submitted to a dispatch channel.
 * <p>
 * Mutated only by {@link DispatchQueue} while holding the owning channel's lock.
 * Fields are volatile so status reads from other threads see the latest transition.
 * Terminal states are final.
 */
public final class QueuedTask {

    private final String id;
    private final String channel;
    private final String command;
    private final Map<String, Object> payload;
    private final TaskPriority priority;
    private final int maxRetries;
    private final Instant createdAt;
    private final CompletableFuture<Object> completion = new CompletableFuture<>();

    private volatile QueuedTaskStatus status = QueuedTaskStatus.PENDING;
    private volatile Object result;
    private volatile String error;
    private volatile int retryCount;
    private volatile Instant startedAt;
    private volatile Instant completedAt;

    QueuedTask(String id, String channel, String command, Map<String, Object> payload,
               TaskPriority priority, int maxRetries, Instant createdAt) {
        this.id = id;
        this.channel = channel;
        this.command = command;
        this.payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        this.priority = priority == null ? TaskPriority.NORMAL : priority;
        this.maxRetries = maxRetries;
        this.createdAt = createdAt;
    }

    public String getId() { return id; }
    public String getChannel() { return channel; }
    public String getCommand() { return command; }
    public Map<String, Object> getPayload() { return payload; }
    public TaskPriority getPriority() { return priority; }
    public QueuedTaskStatus getStatus() { return status; }
    public Object getResult() { return result; }
    public String getError() { return error; }
    public int getRetryCount() { return retryCount; }
    public int getMaxRetries() { return maxRetries; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getCompletedAt() { return completedAt; }

    CompletableFuture<Object> completion() {
        return completion;
    }

    void markRunning(Instant now) {
        status = QueuedTaskStatus.RUNNING;
        startedAt = now;
    }

    void markCompleted(Object value, Instant now) {
        result = value;
        error = null;
        status = QueuedTaskStatus.COMPLETED;
        completedAt = now;
    }

    /** Back to pending for another attempt. */
    void markRetrying(String failure) {
        error = failure;
        retryCount++;
        status = QueuedTaskStatus.PENDING;
    }

    void markFailed(String failure, Instant now) {
        error = failure;
        status = QueuedTaskStatus.FAILED;
        completedAt = now;
    }

    void markCancelled(Instant now) {
        status = QueuedTaskStatus.CANCELLED;
        completedAt = now;
    }

    boolean canRetry() {
        return retryCount < maxRetries;
    }

    @Override
    public String toString() {
        return "QueuedTask[" + id + " " + command + " " + priority + " " + status
                + " retries=" + retryCount + "/" + maxRetries + "]";
    }
}
