package com.catalog.importer.imports.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of one outbound webhook request. {@code statusCode} is null when no HTTP response
 * was received.
 */
public record WebhookDeliveryResult(
    String url,
    Integer statusCode,
    Instant attemptedAt,
    Duration duration,
    int attempts,
    String errorCode,
    String errorMessage
) {
    public boolean success() {
        return errorCode == null && statusCode != null && statusCode < 400;
    }

    public long responseTimeMs() {
        return duration == null ? 0L : duration.toMillis();
    }

    public String failureReason() {
        if (errorCode != null) {
            return errorMessage == null || errorMessage.isBlank() ? errorCode : errorCode + ": " + errorMessage;
        }
        if (statusCode != null && statusCode >= 400) {
            return "HTTP " + statusCode;
        }
        return null;
    }

    public WebhookDeliveryResult withAttempts(int attemptCount) {
        return new WebhookDeliveryResult(url, statusCode, attemptedAt, duration, attemptCount, errorCode, errorMessage);
    }
}
