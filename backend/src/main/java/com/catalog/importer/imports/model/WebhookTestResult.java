package com.catalog.importer.imports.model;

public record WebhookTestResult(boolean success, Integer statusCode, long responseTimeMs, String error) {
    public static WebhookTestResult from(WebhookDeliveryResult result) {
        return new WebhookTestResult(
            result.success(),
            result.statusCode(),
            result.responseTimeMs(),
            result.success() ? null : result.failureReason()
        );
    }
}
