package com.catalog.importer.imports.service;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.INTERNAL_SERVER_ERROR;
import static org.springframework.http.HttpStatus.NOT_FOUND;
import static org.springframework.http.HttpStatus.SERVICE_UNAVAILABLE;

import com.catalog.importer.config.ImporterProperties;
import com.catalog.importer.imports.model.ImportEventData;
import com.catalog.importer.imports.model.ImportJobListResponse;
import com.catalog.importer.imports.model.ImportJobSnapshot;
import com.catalog.importer.imports.model.ImportJobStatus;
import com.catalog.importer.imports.model.ImportUploadResponse;
import com.catalog.importer.imports.model.WebhookEvent;
import com.catalog.importer.imports.persistence.ImportJobRepository;
import com.catalog.importer.imports.progress.ImportProgressPublisher;
import com.catalog.importer.imports.webhook.WebhookDispatcher;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@Service
public class ImportJobService {
  private static final Logger log = LoggerFactory.getLogger(ImportJobService.class);
  private static final int MAX_FILENAME_LENGTH = 255;

  private final ImportJobRepository jobRepository;
  private final ImportJobRunner runner;
  private final ImportProgressPublisher publisher;
  private final WebhookDispatcher webhookDispatcher;
  private final ImporterProperties properties;

  public ImportJobService(
      ImportJobRepository jobRepository,
      ImportJobRunner runner,
      ImportProgressPublisher publisher,
      WebhookDispatcher webhookDispatcher,
      ImporterProperties properties) {
    this.jobRepository = jobRepository;
    this.runner = runner;
    this.publisher = publisher;
    this.webhookDispatcher = webhookDispatcher;
    this.properties = properties;
  }

  /**
   * Stores the upload, records a pending job and hands it to a worker. Returns without waiting
   * for any row to be processed.
   */
  public ImportUploadResponse accept(MultipartFile file) {
    String filename = validateUpload(file);
    String jobId = UUID.randomUUID().toString();
    Path target = uploadPath(jobId);
    try {
      Files.createDirectories(target.getParent());
      try (InputStream in = file.getInputStream()) {
        Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      log.warn("Failed to store upload {} for import {}", filename, jobId, e);
      throw new ResponseStatusException(INTERNAL_SERVER_ERROR, "Unable to store uploaded file", e);
    }

    ImportJobSnapshot job = ImportJobSnapshot.pending(jobId, filename, Instant.now());
    jobRepository.insert(job);
    webhookDispatcher.dispatch(new WebhookEvent.ImportStarted(ImportEventData.from(job)));

    try {
      runner.submit(job, target);
    } catch (RejectedExecutionException e) {
      log.warn("Import executor rejected import {}", jobId);
      runner.newTracker(job).fail("Import could not be scheduled");
      deleteUpload(target);
      throw new ResponseStatusException(SERVICE_UNAVAILABLE, "Import workers are unavailable", e);
    }
    log.info("Accepted import {} for file {} ({} bytes)", jobId, filename, file.getSize());

    return new ImportUploadResponse(
        jobId,
        ImportJobStatus.PENDING,
        "File uploaded successfully. Processing started.",
        "/api/imports/" + jobId + "/status",
        "/api/imports/" + jobId + "/stream");
  }

  public ImportJobSnapshot getStatus(String jobId) {
    return jobRepository
        .findById(jobId)
        .orElseThrow(() -> new ResponseStatusException(NOT_FOUND, "Import job not found: " + jobId));
  }

  public ImportJobListResponse list(Integer limit) {
    ImporterProperties.Jobs jobs = properties.getJobs();
    int safeLimit =
        limit == null
            ? jobs.getDefaultListLimit()
            : Math.max(1, Math.min(limit, jobs.getMaxListLimit()));
    List<ImportJobSnapshot> items = jobRepository.findRecent(safeLimit);
    long total = jobRepository.countJobs();
    return new ImportJobListResponse(items, (int) Math.min(Integer.MAX_VALUE, total));
  }

  public SseEmitter subscribe(String jobId, SseEmitter emitter) {
    getStatus(jobId);
    return publisher.subscribe(jobId, emitter);
  }

  /**
   * Flags a queued or running job for cancellation. The worker stops before its next batch; the
   * returned snapshot may still show the job as pending or running.
   */
  public ImportJobSnapshot cancel(String jobId) {
    ImportJobSnapshot job = getStatus(jobId);
    if (job.status().isTerminal()) {
      throw new ImportJobConflictException(
          "Import " + jobId + " is already " + job.status().value());
    }
    if (!runner.requestCancel(jobId)) {
      // no worker owns the job in this process; it may also have just finished
      Optional<ImportJobSnapshot> failed = runner.newTracker(job).fail("Import cancelled");
      if (failed.isEmpty()) {
        ImportJobSnapshot finished = getStatus(jobId);
        throw new ImportJobConflictException(
            "Import " + jobId + " is already " + finished.status().value());
      }
      webhookDispatcher.dispatch(
          new WebhookEvent.ImportFailed(ImportEventData.from(failed.get())));
      return failed.get();
    }
    return getStatus(jobId);
  }

  public String delete(String jobId) {
    ImportJobSnapshot job = getStatus(jobId);
    if (!job.status().isTerminal() || runner.isActive(jobId)) {
      throw new ImportJobConflictException(
          "Import " + jobId + " is still " + job.status().value() + "; cancel it first");
    }
    jobRepository.delete(jobId);
    deleteUpload(uploadPath(jobId));
    log.info("Deleted import {}", jobId);
    return "Import job " + jobId + " deleted";
  }

  private String validateUpload(MultipartFile file) {
    if (file == null || file.isEmpty()) {
      throw new ResponseStatusException(BAD_REQUEST, "Uploaded file is empty");
    }
    String original = StringUtils.getFilename(StringUtils.cleanPath(
        file.getOriginalFilename() == null ? "" : file.getOriginalFilename()));
    if (original == null || original.isBlank()) {
      throw new ResponseStatusException(BAD_REQUEST, "Uploaded file has no name");
    }
    String extension = properties.getUpload().getAllowedExtension();
    if (!original.toLowerCase(Locale.ROOT).endsWith(extension)) {
      throw new ResponseStatusException(BAD_REQUEST, "Only " + extension + " files are accepted");
    }
    return original.length() <= MAX_FILENAME_LENGTH
        ? original
        : original.substring(original.length() - MAX_FILENAME_LENGTH);
  }

  private Path uploadPath(String jobId) {
    return properties.getUpload().getDirPath().resolve(jobId + properties.getUpload().getAllowedExtension());
  }

  private void deleteUpload(Path file) {
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      log.warn("Could not delete upload {}", file, e);
    }
  }
}
