package com.catalog.importer.imports.service;

import com.catalog.importer.config.ImporterProperties;
import com.catalog.importer.imports.csv.ChunkBatcher;
import com.catalog.importer.imports.csv.CsvFormatException;
import com.catalog.importer.imports.csv.CsvHeaderException;
import com.catalog.importer.imports.csv.ProductCsvReader;
import com.catalog.importer.imports.model.BatchUpsertResult;
import com.catalog.importer.imports.model.ImportBatch;
import com.catalog.importer.imports.model.ImportEventData;
import com.catalog.importer.imports.model.ImportJobSnapshot;
import com.catalog.importer.imports.model.WebhookEvent;
import com.catalog.importer.imports.persistence.ImportJobRepository;
import com.catalog.importer.imports.progress.ImportAlreadyFinishedException;
import com.catalog.importer.imports.progress.ImportProgressPublisher;
import com.catalog.importer.imports.progress.ImportProgressTracker;
import com.catalog.importer.imports.webhook.WebhookDispatcher;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Runs accepted imports on the import executor: parse, batch, upsert, and track progress, one
 * worker per job with batches applied strictly in file order.
 */
@Service
public class ImportJobRunner {
  private static final Logger log = LoggerFactory.getLogger(ImportJobRunner.class);

  private final ProductCsvReader csvReader;
  private final ProductUpsertEngine upsertEngine;
  private final ImportJobRepository jobRepository;
  private final ImportProgressPublisher publisher;
  private final WebhookDispatcher webhookDispatcher;
  private final ExecutorService importExecutor;
  private final ImporterProperties properties;
  private final ConcurrentMap<String, AtomicBoolean> cancellations = new ConcurrentHashMap<>();

  public ImportJobRunner(
      ProductCsvReader csvReader,
      ProductUpsertEngine upsertEngine,
      ImportJobRepository jobRepository,
      ImportProgressPublisher publisher,
      WebhookDispatcher webhookDispatcher,
      @Qualifier("importExecutor") ExecutorService importExecutor,
      ImporterProperties properties) {
    this.csvReader = csvReader;
    this.upsertEngine = upsertEngine;
    this.jobRepository = jobRepository;
    this.publisher = publisher;
    this.webhookDispatcher = webhookDispatcher;
    this.importExecutor = importExecutor;
    this.properties = properties;
  }

  /**
   * Queues the job. Throws {@link RejectedExecutionException} if the executor will not take it.
   */
  public void submit(ImportJobSnapshot job, Path file) {
    cancellations.put(job.id(), new AtomicBoolean(false));
    try {
      importExecutor.submit(() -> run(job, file));
    } catch (RejectedExecutionException e) {
      cancellations.remove(job.id());
      throw e;
    }
  }

  /** Returns false if the job is not queued or running in this process. */
  public boolean requestCancel(String jobId) {
    AtomicBoolean flag = cancellations.get(jobId);
    if (flag == null) {
      return false;
    }
    flag.set(true);
    log.info("Cancellation requested for import {}", jobId);
    return true;
  }

  public boolean isActive(String jobId) {
    return cancellations.containsKey(jobId);
  }

  public ImportProgressTracker newTracker(ImportJobSnapshot job) {
    return new ImportProgressTracker(
        jobRepository, publisher, job, properties.getBatch().getErrorSampleLimit());
  }

  ImportJobSnapshot run(ImportJobSnapshot job, Path file) {
    ImportProgressTracker tracker = newTracker(job);
    AtomicBoolean cancelled = cancellations.computeIfAbsent(job.id(), id -> new AtomicBoolean(false));
    Instant startedAt = Instant.now();
    try {
      if (cancelled.get()) {
        throw new ImportCancelledException();
      }
      tracker.start();
      log.info("Import {} started for file {}", job.id(), job.filename());

      try (ProductCsvReader.CsvRowStream rows = csvReader.open(file)) {
        tracker.totalRowsKnown(csvReader.countRecords(file));
        ChunkBatcher batcher = new ChunkBatcher(rows, properties.getBatch().getChunkSize());
        while (batcher.hasNext()) {
          if (cancelled.get()) {
            throw new ImportCancelledException();
          }
          ImportBatch batch = batcher.next();
          BatchUpsertResult result = upsertEngine.apply(batch.records(), rows.columns());
          tracker.recordBatch(batch, result);
        }
      }

      ImportJobSnapshot done = tracker.complete();
      log.info(
          "Import {} completed in {} ms: processed={} created={} updated={} errors={}",
          job.id(),
          Duration.between(startedAt, Instant.now()).toMillis(),
          done.processedRows(),
          done.createdCount(),
          done.updatedCount(),
          done.errorCount());
      webhookDispatcher.dispatch(new WebhookEvent.ImportCompleted(ImportEventData.from(done)));
      return done;
    } catch (ImportAlreadyFinishedException e) {
      log.info("Import {} stopped: {}", job.id(), e.getMessage());
      return tracker.snapshot();
    } catch (ImportCancelledException e) {
      log.info("Import {} cancelled", job.id());
      return fail(tracker, e.getMessage());
    } catch (CsvHeaderException | CsvFormatException e) {
      log.warn("Import {} rejected: {}", job.id(), e.getMessage());
      return fail(tracker, e.getMessage());
    } catch (DataAccessException e) {
      log.warn("Import {} aborted by a database failure", job.id(), e);
      return fail(tracker, "Database error: " + e.getMostSpecificCause().getMessage());
    } catch (IOException e) {
      log.warn("Import {} could not read its upload", job.id(), e);
      return fail(tracker, "Unable to read uploaded file: " + e.getMessage());
    } catch (RuntimeException e) {
      log.warn("Import {} failed", job.id(), e);
      return fail(tracker, "Import failed: " + e.getMessage());
    } finally {
      cancellations.remove(job.id());
      deleteUpload(job.id(), file);
    }
  }

  private ImportJobSnapshot fail(ImportProgressTracker tracker, String reason) {
    return tracker
        .fail(reason)
        .map(
            failed -> {
              webhookDispatcher.dispatch(new WebhookEvent.ImportFailed(ImportEventData.from(failed)));
              return failed;
            })
        .orElseGet(tracker::snapshot);
  }

  private void deleteUpload(String jobId, Path file) {
    if (file == null) {
      return;
    }
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      log.warn("Could not delete upload {} of import {}", file, jobId, e);
    }
  }
}
