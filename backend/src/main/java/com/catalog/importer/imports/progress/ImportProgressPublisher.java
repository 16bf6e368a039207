package com.catalog.importer.imports.progress;

import com.catalog.importer.imports.model.ImportJobSnapshot;
import com.catalog.importer.imports.persistence.ImportJobRepository;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Per-job fan-out of committed progress snapshots to connected SSE clients.
 *
 * <p>Updates published while nobody is listening are dropped. A subscriber only sees snapshots
 * committed after it connected, except that a subscriber to an already finished job receives the
 * terminal snapshot once. A job's channel is closed right after its terminal snapshot is sent.
 */
@Component
public class ImportProgressPublisher {
    private static final Logger log = LoggerFactory.getLogger(ImportProgressPublisher.class);
    static final String STREAM_ENDED = "stream_ended";

    private final ConcurrentMap<String, ProgressChannel> channels = new ConcurrentHashMap<>();
    private final ImportJobRepository repository;

    public ImportProgressPublisher(ImportJobRepository repository) {
        this.repository = repository;
    }

    public SseEmitter subscribe(String jobId, SseEmitter emitter) {
        while (true) {
            ProgressChannel channel = channels.computeIfAbsent(jobId, ignored -> new ProgressChannel());
            synchronized (channel) {
                if (channel.retired) {
                    // lost a race with a terminal publish or the last unsubscribe; use a fresh channel
                    if (channel.terminal == null) {
                        continue;
                    }
                    sendTerminal(emitter, channel.terminal);
                    return emitter;
                }
                Optional<ImportJobSnapshot> current = repository.findById(jobId);
                if (current.isPresent() && current.get().status().isTerminal()) {
                    if (channel.subscribers.isEmpty()) {
                        channel.retired = true;
                        channels.remove(jobId, channel);
                    }
                    sendTerminal(emitter, current.get());
                    return emitter;
                }
                channel.subscribers.add(emitter);
            }
            emitter.onCompletion(() -> unsubscribe(jobId, emitter));
            emitter.onError(error -> unsubscribe(jobId, emitter));
            emitter.onTimeout(() -> {
                unsubscribe(jobId, emitter);
                sendStreamEnded(emitter, jobId);
            });
            log.debug("SSE subscriber attached to import {}", jobId);
            return emitter;
        }
    }

    public void publish(ImportJobSnapshot snapshot) {
        if (snapshot == null) {
            return;
        }
        String jobId = snapshot.id();
        if (snapshot.status().isTerminal()) {
            ProgressChannel channel = channels.remove(jobId);
            if (channel == null) {
                return;
            }
            synchronized (channel) {
                channel.retired = true;
                channel.terminal = snapshot;
                for (SseEmitter emitter : List.copyOf(channel.subscribers)) {
                    sendTerminal(emitter, snapshot);
                }
                channel.subscribers.clear();
            }
            return;
        }

        ProgressChannel channel = channels.get(jobId);
        if (channel == null) {
            return;
        }
        synchronized (channel) {
            if (channel.retired) {
                return;
            }
            List<SseEmitter> dead = new ArrayList<>();
            for (SseEmitter emitter : List.copyOf(channel.subscribers)) {
                if (!send(emitter, snapshot)) {
                    dead.add(emitter);
                }
            }
            channel.subscribers.removeAll(dead);
        }
    }

    @PreDestroy
    public void shutdown() {
        for (Map.Entry<String, ProgressChannel> entry : channels.entrySet()) {
            ProgressChannel channel = entry.getValue();
            synchronized (channel) {
                channel.retired = true;
                for (SseEmitter emitter : List.copyOf(channel.subscribers)) {
                    sendStreamEnded(emitter, entry.getKey());
                }
                channel.subscribers.clear();
            }
        }
        channels.clear();
    }

    private void unsubscribe(String jobId, SseEmitter emitter) {
        ProgressChannel channel = channels.get(jobId);
        if (channel == null) {
            return;
        }
        synchronized (channel) {
            channel.subscribers.remove(emitter);
            if (channel.subscribers.isEmpty() && !channel.retired) {
                channel.retired = true;
                channels.remove(jobId, channel);
            }
        }
    }

    private void sendTerminal(SseEmitter emitter, ImportJobSnapshot snapshot) {
        if (send(emitter, snapshot)) {
            emitter.complete();
        }
    }

    private void sendStreamEnded(SseEmitter emitter, String jobId) {
        Map<String, Object> marker = new LinkedHashMap<>();
        marker.put("status", STREAM_ENDED);
        marker.put("job_id", jobId);
        if (send(emitter, marker)) {
            emitter.complete();
        }
    }

    private boolean send(SseEmitter emitter, Object payload) {
        try {
            emitter.send(SseEmitter.event().data(payload, MediaType.APPLICATION_JSON));
            return true;
        } catch (IOException | IllegalStateException e) {
            log.debug("Dropping SSE subscriber: {}", e.getMessage());
            emitter.completeWithError(e);
            return false;
        }
    }

    private static final class ProgressChannel {
        private final List<SseEmitter> subscribers = new ArrayList<>();
        private ImportJobSnapshot terminal;
        private boolean retired;
    }
}
