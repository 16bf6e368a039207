package com.catalog.importer.imports.model;

import java.math.BigDecimal;

public record ProductRecord(
    int rowNumber,
    String sku,
    String name,
    String description,
    BigDecimal price,
    int quantity,
    boolean active
) {}
