package com.catalog.importer.imports.model;

import java.util.List;

public record ImportJobListResponse(List<ImportJobSnapshot> items, int total) {}
