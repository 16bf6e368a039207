package com.catalog.importer.imports.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class ImportJobConflictException extends RuntimeException {
    public ImportJobConflictException(String message) {
        super(message);
    }
}
