package com.catalog.importer.imports.api;

import com.catalog.importer.config.ImporterProperties;
import com.catalog.importer.imports.model.ImportJobListResponse;
import com.catalog.importer.imports.model.ImportJobSnapshot;
import com.catalog.importer.imports.model.ImportUploadResponse;
import com.catalog.importer.imports.service.ImportJobService;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.Map;

@RestController
@RequestMapping("/api/imports")
public class ImportController {
    private final ImportJobService importJobService;
    private final ImporterProperties properties;

    public ImportController(ImportJobService importJobService, ImporterProperties properties) {
        this.importJobService = importJobService;
        this.properties = properties;
    }

    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ImportUploadResponse> upload(@RequestPart("file") MultipartFile file) {
        return ResponseEntity.accepted().body(importJobService.accept(file));
    }

    @GetMapping("/{jobId}/status")
    public ImportJobSnapshot status(@PathVariable String jobId) {
        return importJobService.getStatus(jobId);
    }

    @GetMapping(value = "/{jobId}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@PathVariable String jobId) {
        SseEmitter emitter = new SseEmitter(properties.getStream().getTimeoutMs());
        return importJobService.subscribe(jobId, emitter);
    }

    @GetMapping
    public ImportJobListResponse list(@RequestParam(name = "limit", required = false) Integer limit) {
        return importJobService.list(limit);
    }

    @PostMapping("/{jobId}/cancel")
    public ResponseEntity<ImportJobSnapshot> cancel(@PathVariable String jobId) {
        return ResponseEntity.accepted().body(importJobService.cancel(jobId));
    }

    @DeleteMapping("/{jobId}")
    public Map<String, String> delete(@PathVariable String jobId) {
        return Map.of("message", importJobService.delete(jobId));
    }
}
