package com.switchyard.dispatch.api;

import com.switchyard.core.events.EventBus;
import com.switchyard.core.events.SwitchyardEvent;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Streams {@link EventBus} traffic to SSE clients.
 * <p>
 * Each emitter owns one bus subscription, scoped to a source or to all events, and can
 * replay the bus tail on connect. Heartbeat comments keep idle connections open through
 * proxies.
 */
@Service
public class EventStreamService {

    private static final Logger log = LoggerFactory.getLogger(EventStreamService.class);

    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;
    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    private final EventBus eventBus;
    private final long timeoutMs;
    private final CopyOnWriteArrayList<Stream> streams = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeat = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "event-stream-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public EventStreamService(EventBus eventBus) {
        this(eventBus, DEFAULT_TIMEOUT_MS);
    }

    EventStreamService(EventBus eventBus, long timeoutMs) {
        this.eventBus = eventBus;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeat.scheduleAtFixedRate(this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS, HEARTBEAT_INTERVAL_SECONDS, TimeUnit.SECONDS);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeat.shutdownNow();
        streams.forEach(stream -> stream.emitter().complete());
    }

    /**
     * Opens a stream.
     *
     * @param source only events from this channel, circuit or "orchestrator"; null for all
     * @param replay number of retained events to send first
     */
    public SseEmitter open(String source, int replay) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        String scope = source == null ? "all" : source;

        for (SwitchyardEvent past : eventBus.recent(source, replay)) {
            send(emitter, past);
        }

        EventBus.Subscription subscription = source == null
                ? eventBus.subscribeAll(event -> send(emitter, event))
                : eventBus.subscribe(source, event -> send(emitter, event));
        var stream = new Stream(scope, emitter, subscription);
        streams.add(stream);

        emitter.onCompletion(() -> close(stream));
        emitter.onTimeout(() -> close(stream));
        emitter.onError(ex -> close(stream));

        log.info("Event stream opened for {} (replay={})", scope, replay);
        return emitter;
    }

    public int openStreams() {
        return streams.size();
    }

    static Map<String, Object> frame(SwitchyardEvent event) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("source", event.source());
        if (event.subjectId() != null) {
            data.put("subject_id", event.subjectId());
        }
        data.putAll(event.payload());
        data.put("timestamp", event.timestamp().toString());
        return data;
    }

    private void send(SseEmitter emitter, SwitchyardEvent event) {
        try {
            emitter.send(SseEmitter.event().name(event.eventType()).data(frame(event)));
        } catch (IOException | IllegalStateException e) {
            log.debug("Dropped {} for a closed stream: {}", event.eventType(), e.getMessage());
        }
    }

    private void sendHeartbeats() {
        for (Stream stream : streams) {
            try {
                stream.emitter().send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException | IllegalStateException e) {
                log.debug("Heartbeat to {} stream failed: {}", stream.scope(), e.getMessage());
            }
        }
    }

    private void close(Stream stream) {
        stream.subscription().unsubscribe();
        if (streams.remove(stream)) {
            log.debug("Event stream closed for {}", stream.scope());
        }
    }

    private record Stream(String scope, SseEmitter emitter, EventBus.Subscription subscription) {}
}
