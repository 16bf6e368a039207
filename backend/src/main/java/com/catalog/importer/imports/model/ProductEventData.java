package com.catalog.importer.imports.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;

public record ProductEventData(
    Long id,
    String sku,
    String name,
    String description,
    BigDecimal price,
    int quantity,
    @JsonProperty("is_active") boolean active,
    Instant createdAt,
    Instant updatedAt
) {}
