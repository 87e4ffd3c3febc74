package com.switchyard.core.queue;

import com.switchyard.core.events.EventBus;
import com.switchyard.core.events.SwitchyardEvent;
import com.switchyard.core.logging.MdcContext;
import com.switchyard.core.metrics.SwitchyardMetrics;
import com.switchyard.core.model.QueuedTaskStatus;
import com.switchyard.core.model.TaskPriority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-channel, concurrency-bounded, priority-ordered task queue with retry-with-requeue.
 *
 * <p>Some downstream systems (an interactive CAD session) process one command at a time
 * and corrupt state under concurrent access, so a channel's concurrency bound is a
 * correctness limit. Priority keeps interactive commands from starving behind batch work.
 *
 * <p>Usage:
 * <pre>{@code
 * queue.register("cad", cadExecutor, 1);
 * String id = queue.submit("cad", "extrude", Map.of("depth", 10), TaskPriority.HIGH);
 * Object result = queue.awaitResult(id, Duration.ofMinutes(5));
 * }</pre>
 *
 * <p>Scheduling: whenever a task is submitted, finishes, or is requeued, the channel
 * starts pending tasks on the shared worker pool while its in-flight count is below its
 * concurrency. The next task is the head of the highest non-empty priority band, so equal
 * priorities run in submission order. A failed attempt with retries left goes back to the
 * <em>front</em> of its band. A handler exception never affects other tasks.
 */
public class DispatchQueue implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DispatchQueue.class);

    private final QueueProperties properties;
    private final EventBus eventBus;
    private final SwitchyardMetrics metrics;
    private final Clock clock;

    private final ConcurrentHashMap<String, Channel> channels = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, QueuedTask> tasks = new ConcurrentHashMap<>();
    private final ConcurrentLinkedDeque<String> finishedOrder = new ConcurrentLinkedDeque<>();
    private final AtomicLong counter = new AtomicLong();

    private final ExecutorService workers;
    private final ScheduledExecutorService retryScheduler;

    public DispatchQueue(QueueProperties properties, EventBus eventBus, SwitchyardMetrics metrics, Clock clock) {
        this.properties = properties;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
        this.workers = Executors.newCachedThreadPool(namedDaemon("dispatch-worker"));
        this.retryScheduler = Executors.newSingleThreadScheduledExecutor(namedDaemon("dispatch-retry"));
    }

    public DispatchQueue(QueueProperties properties) {
        this(properties, new EventBus(), null, Clock.systemUTC());
    }

    public DispatchQueue() {
        this(new QueueProperties());
    }

    // -- Registration ---------------------------------------------------------

    /**
     * Registers a channel. Handler and concurrency are fixed for the channel's lifetime.
     *
     * @throws IllegalArgumentException if concurrency is not positive
     * @throws IllegalStateException    if the name is already registered
     */
    public void register(String name, ChannelHandler handler, int concurrency) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("Concurrency must be positive for channel " + name + ": " + concurrency);
        }
        var channel = new Channel(name, handler, concurrency);
        if (channels.putIfAbsent(name, channel) != null) {
            throw new IllegalStateException("Channel already registered: " + name);
        }
        log.info("Registered channel: {} (concurrency={})", name, concurrency);
    }

    /** Registers a channel with its configured (or default) concurrency. */
    public void register(String name, ChannelHandler handler) {
        register(name, handler, properties.concurrencyFor(name));
    }

    public boolean isRegistered(String name) {
        return channels.containsKey(name);
    }

    // -- Submission -----------------------------------------------------------

    public String submit(String channelName, String command, Map<String, Object> payload, TaskPriority priority) {
        return submit(channelName, command, payload, priority, properties.getDefaultMaxRetries());
    }

    public String submit(String channelName, String command, Map<String, Object> payload) {
        return submit(channelName, command, payload, TaskPriority.NORMAL);
    }

    /**
     * Adds a task to a channel and returns its id without waiting for it to start.
     *
     * @param maxRetries attempts allowed after the first failure
     * @throws IllegalArgumentException if the channel is not registered
     */
    public String submit(String channelName, String command, Map<String, Object> payload,
                         TaskPriority priority, int maxRetries) {
        Channel channel = channels.get(channelName);
        if (channel == null) {
            throw new IllegalArgumentException("Channel not registered: " + channelName);
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
        }
        Objects.requireNonNull(command, "command");

        String taskId = String.format("%s-%06d", channelName, counter.incrementAndGet());
        var task = new QueuedTask(taskId, channelName, command, payload, priority, maxRetries, clock.instant());
        tasks.put(taskId, task);
        synchronized (channel) {
            channel.band(task.getPriority()).addLast(task);
        }

        log.debug("Enqueued: {} ({}, {})", taskId, command, task.getPriority());
        eventBus.publish(SwitchyardEvent.of("task.submitted", channelName, taskId,
                Map.of("command", command, "priority", task.getPriority().name())));

        startReady(channel);
        return taskId;
    }

    // -- Waiting and cancellation ----------------------------------------------

    /**
     * Blocks until the task reaches a terminal state or {@code timeout} elapses.
     * Timing out never changes the task; it may still complete later.
     *
     * @return the handler's result
     * @throws TaskTimeoutException     if the timeout elapsed first
     * @throws TaskFailedException      if the task exhausted its retries
     * @throws TaskCancelledException   if the task was cancelled
     * @throws IllegalArgumentException if the task is unknown (or already pruned)
     */
    public Object awaitResult(String taskId, Duration timeout) {
        QueuedTask task = tasks.get(taskId);
        if (task == null) {
            throw new IllegalArgumentException("Task not found: " + taskId);
        }
        try {
            return task.completion().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new TaskTimeoutException(taskId, timeout);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof TaskDispatchException dispatchError) {
                throw dispatchError;
            }
            throw new TaskDispatchException(taskId, "Task " + taskId + " failed: " + e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TaskDispatchException(taskId, "Interrupted while waiting for task " + taskId, e);
        }
    }

    /**
     * Cancels a task that has not started yet. Running tasks cannot be cancelled.
     *
     * @return true if the task moved to CANCELLED
     */
    public boolean cancel(String taskId) {
        QueuedTask task = tasks.get(taskId);
        if (task == null) {
            return false;
        }
        Channel channel = channels.get(task.getChannel());
        synchronized (channel) {
            if (task.getStatus() != QueuedTaskStatus.PENDING) {
                return false;
            }
            channel.band(task.getPriority()).remove(task);
            task.markCancelled(clock.instant());
        }
        log.info("Cancelled: {}", taskId);
        task.completion().completeExceptionally(new TaskCancelledException(taskId));
        onFinished(task, "cancelled");
        return true;
    }

    // -- Pause / resume -------------------------------------------------------

    /** Stops a channel from starting new tasks. Submissions are still accepted. */
    public void pause(String channelName) {
        Channel channel = requireChannel(channelName);
        synchronized (channel) {
            channel.paused = true;
        }
        log.info("Paused channel: {}", channelName);
    }

    public void resume(String channelName) {
        Channel channel = requireChannel(channelName);
        synchronized (channel) {
            channel.paused = false;
        }
        log.info("Resumed channel: {}", channelName);
        startReady(channel);
    }

    // -- Introspection --------------------------------------------------------

    public QueuedTask getTask(String taskId) {
        return tasks.get(taskId);
    }

    /** Tasks of one channel still held by the queue, oldest first. */
    public List<QueuedTask> listTasks(String channelName) {
        return tasks.values().stream()
                .filter(t -> t.getChannel().equals(channelName))
                .sorted(Comparator.comparing(QueuedTask::getId))
                .toList();
    }

    /**
     * Snapshot of every channel, sorted by name.
     */
    public Map<String, ChannelStatus> getQueueStatus() {
        var status = new TreeMap<String, ChannelStatus>();
        for (Channel channel : channels.values()) {
            synchronized (channel) {
                status.put(channel.name, new ChannelStatus(channel.pendingCount(), channel.inFlight,
                        channel.concurrency, channel.paused));
            }
        }
        return status;
    }

    @Override
    public void close() {
        retryScheduler.shutdownNow();
        workers.shutdownNow();
        log.info("Dispatch queue shut down ({} channels)", channels.size());
    }

    // -- Execution ------------------------------------------------------------

    private void startReady(Channel channel) {
        var toStart = new ArrayList<QueuedTask>();
        synchronized (channel) {
            while (!channel.paused && channel.inFlight < channel.concurrency) {
                QueuedTask next = channel.pollNext();
                if (next == null) {
                    break;
                }
                channel.inFlight++;
                next.markRunning(clock.instant());
                toStart.add(next);
            }
        }
        for (QueuedTask task : toStart) {
            try {
                workers.execute(() -> execute(channel, task));
            } catch (RejectedExecutionException e) {
                log.error("Worker pool rejected task {}: {}", task.getId(), e.getMessage());
                settle(channel, task, null, "Dispatch queue is shut down", false);
            }
        }
    }

    private void execute(Channel channel, QueuedTask task) {
        MdcContext.setTask(channel.name, task.getId());
        long startMs = System.currentTimeMillis();
        try {
            Object result = channel.handler.handle(task.getCommand(), task.getPayload());
            settle(channel, task, result, null, true);
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            settle(channel, task, null, message, true);
        } catch (Error e) {
            // Release the slot before anything else; an Error is never retried.
            log.error("Handler for {} threw {}", task.getId(), e.toString(), e);
            settle(channel, task, null, e.getClass().getSimpleName() + ": " + e.getMessage(), false);
            if (e instanceof VirtualMachineError) {
                throw e;
            }
        } finally {
            if (metrics != null) {
                metrics.recordTaskExecution(channel.name, System.currentTimeMillis() - startMs);
            }
            MdcContext.clearTask();
        }
    }

    /**
     * Records the outcome of one attempt: releases the slot and completes, requeues or
     * fails the task in a single step under the channel lock.
     */
    private void settle(Channel channel, QueuedTask task, Object result, String error, boolean mayRetry) {
        boolean succeeded = error == null;
        boolean requeued = false;
        Duration backoff = Duration.ZERO;

        synchronized (channel) {
            channel.inFlight--;
            if (succeeded) {
                task.markCompleted(result, clock.instant());
            } else if (mayRetry && task.canRetry()) {
                task.markRetrying(error);
                requeued = true;
                backoff = backoffFor(task.getRetryCount());
                if (backoff.isZero()) {
                    channel.band(task.getPriority()).addFirst(task);
                } else {
                    channel.backingOff++;
                }
            } else {
                task.markFailed(error, clock.instant());
            }
        }

        if (succeeded) {
            log.debug("Completed: {}", task.getId());
            task.completion().complete(result);
            onFinished(task, "completed");
        } else if (requeued) {
            log.warn("Retrying: {} ({}/{}): {}", task.getId(), task.getRetryCount(), task.getMaxRetries(), error);
            if (metrics != null) {
                metrics.recordTaskRetry(channel.name);
            }
            eventBus.publish(SwitchyardEvent.of("task.retrying", channel.name, task.getId(),
                    Map.of("retry", task.getRetryCount(), "error", error)));
            if (!backoff.isZero()) {
                scheduleRequeue(channel, task, backoff);
            }
        } else {
            log.error("Failed: {} after {} attempt(s) - {}", task.getId(), task.getRetryCount() + 1, error);
            task.completion().completeExceptionally(
                    new TaskFailedException(task.getId(), error, task.getRetryCount() + 1));
            onFinished(task, "failed");
        }

        startReady(channel);
    }

    private void scheduleRequeue(Channel channel, QueuedTask task, Duration backoff) {
        Runnable requeue = () -> {
            synchronized (channel) {
                channel.backingOff--;
                if (task.getStatus() == QueuedTaskStatus.PENDING) {
                    channel.band(task.getPriority()).addFirst(task);
                }
            }
            startReady(channel);
        };
        try {
            retryScheduler.schedule(requeue, backoff.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("Retry scheduler unavailable, requeueing {} immediately", task.getId());
            requeue.run();
        }
    }

    /** Exponential backoff: base * 2^(retry-1), capped. Zero base means immediate requeue. */
    private Duration backoffFor(int retryCount) {
        Duration base = properties.getRetryBackoff();
        if (base == null || base.isZero() || base.isNegative()) {
            return Duration.ZERO;
        }
        long factor = 1L << Math.min(retryCount - 1, 20);
        Duration delay = base.multipliedBy(factor);
        Duration max = properties.getRetryBackoffMax();
        return max != null && delay.compareTo(max) > 0 ? max : delay;
    }

    private void onFinished(QueuedTask task, String outcome) {
        if (metrics != null) {
            metrics.recordTaskOutcome(task.getChannel(), outcome);
        }
        var payload = new LinkedHashMap<String, Object>();
        payload.put("command", task.getCommand());
        payload.put("retries", task.getRetryCount());
        if (task.getError() != null && !"completed".equals(outcome)) {
            payload.put("error", task.getError());
        }
        eventBus.publish(SwitchyardEvent.of("task." + outcome, task.getChannel(), task.getId(), payload));
        prune(task.getId());
    }

    /** Forgets the oldest finished tasks once more than the configured number are held. */
    private void prune(String finishedId) {
        finishedOrder.addLast(finishedId);
        int retention = Math.max(0, properties.getCompletedRetention());
        while (finishedOrder.size() > retention) {
            String oldest = finishedOrder.pollFirst();
            if (oldest == null) {
                break;
            }
            tasks.remove(oldest);
        }
    }

    private Channel requireChannel(String name) {
        Channel channel = channels.get(name);
        if (channel == null) {
            throw new IllegalArgumentException("Channel not registered: " + name);
        }
        return channel;
    }

    private static ThreadFactory namedDaemon(String prefix) {
        var sequence = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + sequence.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /**
     * A named lane of serialized work. All mutable fields are guarded by the instance monitor.
     */
    private static final class Channel {
        final String name;
        final ChannelHandler handler;
        final int concurrency;
        final EnumMap<TaskPriority, Deque<QueuedTask>> bands = new EnumMap<>(TaskPriority.class);
        int inFlight;
        int backingOff;
        boolean paused;

        Channel(String name, ChannelHandler handler, int concurrency) {
            this.name = name;
            this.handler = handler;
            this.concurrency = concurrency;
            for (TaskPriority priority : TaskPriority.values()) {
                bands.put(priority, new ArrayDeque<>());
            }
        }

        Deque<QueuedTask> band(TaskPriority priority) {
            return bands.get(priority);
        }

        /** Head of the highest non-empty band, or null. */
        QueuedTask pollNext() {
            TaskPriority[] priorities = TaskPriority.values();
            for (int i = priorities.length - 1; i >= 0; i--) {
                QueuedTask next = bands.get(priorities[i]).pollFirst();
                if (next != null) {
                    return next;
                }
            }
            return null;
        }

        int pendingCount() {
            int pending = backingOff;
            for (Deque<QueuedTask> band : bands.values()) {
                pending += band.size();
            }
            return pending;
        }
    }
}
