package com.catalog.importer.imports.progress;

import com.catalog.importer.imports.model.ImportJobStatus;

/** Thrown when a job row was completed or failed by someone other than the tracker's owner. */
public class ImportAlreadyFinishedException extends RuntimeException {
    private final ImportJobStatus status;

    public ImportAlreadyFinishedException(String jobId, ImportJobStatus status) {
        super("Import " + jobId + " is already " + (status == null ? "gone" : status.value()));
        this.status = status;
    }

    /** Stored status, or null if the job row no longer exists. */
    public ImportJobStatus getStatus() {
        return status;
    }
}
