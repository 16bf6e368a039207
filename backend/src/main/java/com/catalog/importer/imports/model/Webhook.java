package com.catalog.importer.imports.model;

import java.time.Instant;

public record Webhook(
    long id,
    String name,
    String url,
    String eventType,
    String secret,
    boolean enabled,
    Instant lastTriggeredAt,
    Integer lastResponseCode,
    Integer lastResponseTimeMs,
    int failureCount
) {
    public boolean hasSecret() {
        return secret != null && !secret.isBlank();
    }
}
