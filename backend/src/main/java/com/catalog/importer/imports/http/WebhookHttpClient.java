package com.catalog.importer.imports.http;

import com.catalog.importer.config.ImporterProperties;
import com.catalog.importer.imports.model.WebhookDeliveryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * Outbound JSON POSTs for webhook deliveries. Never throws: transport problems come back as a
 * result with an error code and no status code.
 *
 * <p>Requests are sent with {@link HttpClient#sendAsync}, and retries wait on the scheduler, so
 * a slow or stalled endpoint holds no thread and never delays another delivery.
 */
@Service
public class WebhookHttpClient {
    private static final Logger log = LoggerFactory.getLogger(WebhookHttpClient.class);
    private static final String USER_AGENT = "product-importer-webhooks/1.0";

    private final ImporterProperties.Webhook properties;
    private final HttpClient client;
    private final ScheduledExecutorService retryScheduler;

    public WebhookHttpClient(
        ImporterProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor,
        @Qualifier("webhookRetryScheduler") ScheduledExecutorService retryScheduler
    ) {
        this.properties = properties.getWebhook();
        this.retryScheduler = retryScheduler;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(this.properties.getTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    /** Blocking form of {@link #postJsonAsync}. */
    public WebhookDeliveryResult postJson(String url, String jsonBody, Map<String, String> headers, boolean retry) {
        return postJsonAsync(url, jsonBody, headers, retry).join();
    }

    /**
     * Posts {@code jsonBody}, retrying transport errors, 408, 429 and 5xx responses when
     * {@code retry} is set. The future completes normally with the result of the last attempt.
     */
    public CompletableFuture<WebhookDeliveryResult> postJsonAsync(
        String url,
        String jsonBody,
        Map<String, String> headers,
        boolean retry
    ) {
        Instant startedAt = Instant.now();
        URI uri = parseUri(url);
        if (uri == null) {
            return CompletableFuture.completedFuture(
                errorResult(url, startedAt, "invalid_url", "URL must be an absolute http(s) URL")
            );
        }
        HttpRequest request;
        try {
            HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                .header("User-Agent", USER_AGENT)
                .header("Content-Type", "application/json");
            if (headers != null) {
                headers.forEach(builder::header);
            }
            request = builder
                .POST(HttpRequest.BodyPublishers.ofString(jsonBody == null ? "" : jsonBody, StandardCharsets.UTF_8))
                .build();
        } catch (IllegalArgumentException e) {
            return CompletableFuture.completedFuture(errorResult(url, startedAt, "http_error", e.getMessage()));
        }
        int maxAttempts = retry ? Math.max(1, 1 + properties.getMaxRetries()) : 1;
        CompletableFuture<WebhookDeliveryResult> outcome = new CompletableFuture<>();
        attempt(url, request, 1, maxAttempts, outcome);
        return outcome;
    }

    private void attempt(
        String url,
        HttpRequest request,
        int attempt,
        int maxAttempts,
        CompletableFuture<WebhookDeliveryResult> outcome
    ) {
        Instant startedAt = Instant.now();
        CompletableFuture<HttpResponse<Void>> response;
        try {
            response = client.sendAsync(request, HttpResponse.BodyHandlers.discarding());
        } catch (RuntimeException e) {
            outcome.complete(errorResult(url, startedAt, "http_error", e.getMessage()).withAttempts(attempt));
            return;
        }
        response
            .handle((resp, error) -> toResult(url, startedAt, resp, error).withAttempts(attempt))
            .thenAccept(result -> {
                if (!shouldRetry(result) || attempt >= maxAttempts) {
                    outcome.complete(result);
                    return;
                }
                try {
                    retryScheduler.schedule(
                        () -> attempt(url, request, attempt + 1, maxAttempts, outcome),
                        backoffMs(attempt),
                        TimeUnit.MILLISECONDS
                    );
                } catch (RejectedExecutionException e) {
                    log.debug("Retry of {} not scheduled: {}", url, e.getMessage());
                    outcome.complete(result);
                }
            })
            .exceptionally(error -> {
                outcome.complete(errorResult(url, startedAt, "http_error", error.getMessage()).withAttempts(attempt));
                return null;
            });
    }

    private WebhookDeliveryResult toResult(String url, Instant startedAt, HttpResponse<Void> response, Throwable error) {
        if (error == null) {
            return new WebhookDeliveryResult(
                url,
                response.statusCode(),
                startedAt,
                Duration.between(startedAt, Instant.now()),
                1,
                null,
                null
            );
        }
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof HttpTimeoutException) {
            return errorResult(url, startedAt, "timeout", cause.getMessage());
        }
        if (cause instanceof IOException) {
            return errorResult(url, startedAt, "io_error", cause.getMessage());
        }
        return errorResult(url, startedAt, "http_error", cause.getMessage());
    }

    private boolean shouldRetry(WebhookDeliveryResult result) {
        String errorCode = result.errorCode();
        if (errorCode != null && !errorCode.isBlank()) {
            return !errorCode.equals("invalid_url");
        }
        int status = result.statusCode() == null ? 0 : result.statusCode();
        return status == 408 || status == 429 || status >= 500;
    }

    private long backoffMs(int attempt) {
        int baseDelayMs = properties.getRetryBaseDelayMs();
        if (baseDelayMs <= 0) {
            return 0L;
        }
        int maxDelayMs = properties.getRetryMaxDelayMs();
        long delay = (long) baseDelayMs * (1L << Math.min(20, Math.max(0, attempt - 1)));
        if (maxDelayMs > 0) {
            delay = Math.min(delay, maxDelayMs);
        }
        long jitter = ThreadLocalRandom.current().nextLong(Math.max(1L, delay / 2));
        return (delay / 2) + jitter;
    }

    private WebhookDeliveryResult errorResult(String url, Instant startedAt, String code, String message) {
        return new WebhookDeliveryResult(
            url,
            null,
            startedAt,
            Duration.between(startedAt, Instant.now()),
            1,
            code,
            message
        );
    }

    private URI parseUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        try {
            URI uri = new URI(input.trim());
            String scheme = uri.getScheme() == null ? null : uri.getScheme().toLowerCase(Locale.ROOT);
            if (uri.getHost() == null || !("http".equals(scheme) || "https".equals(scheme))) {
                return null;
            }
            return uri;
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
