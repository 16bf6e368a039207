package com.catalog.importer.imports.webhook;

import com.catalog.importer.imports.http.WebhookHttpClient;
import com.catalog.importer.imports.model.Webhook;
import com.catalog.importer.imports.model.WebhookDeliveryResult;
import com.catalog.importer.imports.model.WebhookEvent;
import com.catalog.importer.imports.model.WebhookTestResult;
import com.catalog.importer.imports.persistence.WebhookRepository;
import com.catalog.importer.imports.util.HmacUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Delivers lifecycle events to every enabled webhook subscribed to them.
 *
 * <p>{@link #dispatch} returns immediately and never throws. Each delivery is an independent
 * asynchronous request with its own timeout, and its outcome is recorded on the webhook row.
 */
@Service
public class WebhookDispatcher {
    private static final Logger log = LoggerFactory.getLogger(WebhookDispatcher.class);

    public static final String EVENT_HEADER = "X-Webhook-Event";
    public static final String TIMESTAMP_HEADER = "X-Webhook-Timestamp";
    public static final String SIGNATURE_HEADER = "X-Webhook-Signature";

    private final WebhookRepository repository;
    private final WebhookHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ExecutorService webhookExecutor;

    public WebhookDispatcher(
        WebhookRepository repository,
        WebhookHttpClient httpClient,
        ObjectMapper objectMapper,
        @Qualifier("webhookExecutor") ExecutorService webhookExecutor
    ) {
        this.repository = repository;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.webhookExecutor = webhookExecutor;
    }

    public void dispatch(WebhookEvent.Lifecycle event) {
        if (event == null) {
            return;
        }
        try {
            webhookExecutor.submit(() -> fanOut(event));
        } catch (RejectedExecutionException e) {
            log.warn("Webhook executor rejected {} event", event.eventName());
        }
    }

    public Optional<WebhookTestResult> test(long webhookId) {
        return repository.findById(webhookId)
            .map(webhook -> WebhookTestResult.from(
                deliver(webhook, new WebhookEvent.Ping(webhook.id(), webhook.name()), false).join()
            ));
    }

    private void fanOut(WebhookEvent.Lifecycle event) {
        List<Webhook> webhooks;
        try {
            webhooks = repository.findEnabledByEventType(event.type().value());
        } catch (RuntimeException e) {
            log.warn("Unable to load webhooks for {}", event.eventName(), e);
            return;
        }
        for (Webhook webhook : webhooks) {
            if (!webhook.enabled()) {
                continue;
            }
            try {
                deliver(webhook, event, true).whenComplete((result, error) -> {
                    if (error != null) {
                        log.warn("Webhook {} delivery of {} aborted", webhook.id(), event.eventName(), error);
                    }
                });
            } catch (RuntimeException e) {
                log.warn("Webhook {} delivery of {} aborted", webhook.id(), event.eventName(), e);
            }
        }
    }

    /**
     * Starts one delivery. The request runs without holding a dispatcher thread; only recording
     * the outcome goes through the webhook executor.
     */
    CompletableFuture<WebhookDeliveryResult> deliver(Webhook webhook, WebhookEvent event, boolean retry) {
        Instant timestamp = Instant.now();
        String body = payload(event, timestamp);
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(EVENT_HEADER, event.eventName());
        headers.put(TIMESTAMP_HEADER, timestamp.toString());
        if (webhook.hasSecret()) {
            headers.put(SIGNATURE_HEADER, HmacUtils.signatureHeader(webhook.secret(), body));
        }

        return httpClient.postJsonAsync(webhook.url(), body, headers, retry)
            .thenApplyAsync(result -> recordOutcome(webhook, event, result), webhookExecutor);
    }

    private WebhookDeliveryResult recordOutcome(Webhook webhook, WebhookEvent event, WebhookDeliveryResult result) {
        try {
            repository.recordDelivery(
                webhook.id(),
                result.attemptedAt(),
                result.statusCode(),
                result.responseTimeMs(),
                result.success()
            );
        } catch (RuntimeException e) {
            log.warn("Failed to record delivery outcome for webhook {}", webhook.id(), e);
        }
        if (result.success()) {
            log.debug("Webhook {} accepted {} with HTTP {}", webhook.id(), event.eventName(), result.statusCode());
        } else {
            log.warn(
                "Webhook {} delivery of {} failed after {} attempt(s): {}",
                webhook.id(),
                event.eventName(),
                result.attempts(),
                result.failureReason()
            );
        }
        return result;
    }

    private String payload(WebhookEvent event, Instant timestamp) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("event", event.eventName());
        payload.put("data", event.data());
        payload.put("timestamp", timestamp);
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize " + event.eventName() + " payload", e);
        }
    }
}
