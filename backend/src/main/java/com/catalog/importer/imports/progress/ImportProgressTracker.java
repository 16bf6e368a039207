package com.catalog.importer.imports.progress;

import com.catalog.importer.imports.model.BatchUpsertResult;
import com.catalog.importer.imports.model.ImportBatch;
import com.catalog.importer.imports.model.ImportJobSnapshot;
import com.catalog.importer.imports.model.ImportJobStatus;
import com.catalog.importer.imports.model.RowError;
import com.catalog.importer.imports.persistence.ImportJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the state machine of one import job. Only the worker running the job calls the mutators;
 * every change is written as a complete new snapshot, persisted, and then published.
 */
public class ImportProgressTracker {
    private static final Logger log = LoggerFactory.getLogger(ImportProgressTracker.class);

    private final ImportJobRepository repository;
    private final ImportProgressPublisher publisher;
    private final int errorSampleLimit;
    private final AtomicReference<ImportJobSnapshot> current;
    private final List<RowError> errorSample = new ArrayList<>();

    public ImportProgressTracker(
        ImportJobRepository repository,
        ImportProgressPublisher publisher,
        ImportJobSnapshot initial,
        int errorSampleLimit
    ) {
        this.repository = repository;
        this.publisher = publisher;
        this.errorSampleLimit = Math.max(0, errorSampleLimit);
        this.current = new AtomicReference<>(initial);
        errorSample.addAll(initial.errorDetails());
    }

    public ImportJobSnapshot snapshot() {
        return current.get();
    }

    public ImportJobSnapshot start() {
        ImportJobSnapshot before = current.get();
        Instant now = Instant.now();
        return commit(copy(
            before,
            ImportJobStatus.RUNNING,
            before.totalRows(),
            before.processedRows(),
            before.createdCount(),
            before.updatedCount(),
            before.errorCount(),
            "Processing started",
            null,
            now,
            null,
            now
        ));
    }

    public ImportJobSnapshot totalRowsKnown(int totalRows) {
        ImportJobSnapshot before = current.get();
        int total = Math.max(totalRows, before.processedRows());
        return commit(copy(
            before,
            ImportJobStatus.RUNNING,
            total,
            before.processedRows(),
            before.createdCount(),
            before.updatedCount(),
            before.errorCount(),
            progressMessage(before.processedRows(), total),
            null,
            before.startedAt(),
            null,
            Instant.now()
        ));
    }

    /**
     * Folds one applied batch into the counters. Every source row of the batch is either created,
     * updated, or an error, so the counters always add up to {@code processed_rows}.
     */
    public ImportJobSnapshot recordBatch(ImportBatch batch, BatchUpsertResult result) {
        int applied = result.createdCount() + result.updatedCount() + result.rowErrors().size();
        if (applied != batch.records().size()) {
            throw new IllegalStateException(
                "Batch " + batch.sequence() + " accounted for " + applied + " of " + batch.records().size() + " records"
            );
        }
        ImportJobSnapshot before = current.get();
        int processed = before.processedRows() + batch.rowCount();
        Integer total = before.totalRows();
        if (total != null && processed > total) {
            // the row count pre-pass saw fewer records than the import did
            total = processed;
        }
        sample(batch.rowErrors());
        sample(result.rowErrors());
        return commit(copy(
            before,
            ImportJobStatus.RUNNING,
            total,
            processed,
            before.createdCount() + result.createdCount(),
            before.updatedCount() + result.updatedCount(),
            before.errorCount() + batch.rowErrors().size() + result.rowErrors().size(),
            progressMessage(processed, total),
            null,
            before.startedAt(),
            null,
            Instant.now()
        ));
    }

    public ImportJobSnapshot complete() {
        ImportJobSnapshot before = current.get();
        Instant now = Instant.now();
        Integer total = before.totalRows() == null ? before.processedRows() : before.totalRows();
        String message = "Import completed: %d created, %d updated, %d errors".formatted(
            before.createdCount(),
            before.updatedCount(),
            before.errorCount()
        );
        return commit(copy(
            before,
            ImportJobStatus.COMPLETED,
            total,
            before.processedRows(),
            before.createdCount(),
            before.updatedCount(),
            before.errorCount(),
            message,
            null,
            before.startedAt(),
            now,
            now
        ));
    }

    /**
     * Moves the job to failed, keeping the counters already committed. Returns empty, without
     * publishing, when the job is already terminal here or in the store. The failed snapshot is
     * published even if it cannot be stored.
     */
    public Optional<ImportJobSnapshot> fail(String reason) {
        ImportJobSnapshot before = current.get();
        if (before.status().isTerminal()) {
            log.debug("Ignoring failure of import {} already {}", before.id(), before.status().value());
            return Optional.empty();
        }
        String safeReason = reason == null || reason.isBlank() ? "Import failed" : reason.trim();
        Instant now = Instant.now();
        ImportJobSnapshot next = copy(
            before,
            ImportJobStatus.FAILED,
            before.totalRows(),
            before.processedRows(),
            before.createdCount(),
            before.updatedCount(),
            before.errorCount(),
            safeReason,
            safeReason,
            before.startedAt(),
            now,
            now
        );
        try {
            if (!repository.save(next)) {
                ImportJobSnapshot stored = refresh(before.id());
                log.info("Not failing import {}: already {}", before.id(),
                    stored == null ? "deleted" : stored.status().value());
                return Optional.empty();
            }
        } catch (RuntimeException e) {
            log.error("Failed to persist failure of import {}", before.id(), e);
        }
        current.set(next);
        publisher.publish(next);
        return Optional.of(next);
    }

    private ImportJobSnapshot commit(ImportJobSnapshot next) {
        ImportJobSnapshot before = current.get();
        if (!before.status().canTransitionTo(next.status())) {
            throw new IllegalStateException(
                "Import " + before.id() + " cannot move from " + before.status().value() + " to " + next.status().value()
            );
        }
        if (!repository.save(next)) {
            ImportJobSnapshot stored = refresh(before.id());
            throw new ImportAlreadyFinishedException(before.id(), stored == null ? null : stored.status());
        }
        current.set(next);
        publisher.publish(next);
        return next;
    }

    // adopts the stored row so later calls see the terminal state
    private ImportJobSnapshot refresh(String jobId) {
        ImportJobSnapshot stored = repository.findById(jobId).orElse(null);
        if (stored != null) {
            current.set(stored);
        }
        return stored;
    }

    private void sample(List<RowError> errors) {
        for (RowError error : errors) {
            if (errorSample.size() >= errorSampleLimit) {
                return;
            }
            errorSample.add(error);
        }
    }

    private ImportJobSnapshot copy(
        ImportJobSnapshot base,
        ImportJobStatus status,
        Integer totalRows,
        int processedRows,
        int createdCount,
        int updatedCount,
        int errorCount,
        String message,
        String error,
        Instant startedAt,
        Instant completedAt,
        Instant updatedAt
    ) {
        return new ImportJobSnapshot(
            base.id(),
            base.filename(),
            status,
            totalRows,
            processedRows,
            createdCount,
            updatedCount,
            errorCount,
            message,
            error,
            errorSample,
            base.createdAt(),
            startedAt,
            completedAt,
            updatedAt
        );
    }

    private static String progressMessage(int processed, Integer total) {
        if (total == null) {
            return "Processed " + processed + " rows";
        }
        return "Processed " + processed + " of " + total + " rows";
    }
}
