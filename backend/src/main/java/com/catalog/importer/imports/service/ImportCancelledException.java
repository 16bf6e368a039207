package com.catalog.importer.imports.service;

public class ImportCancelledException extends RuntimeException {
    public ImportCancelledException() {
        super("Import cancelled");
    }
}
