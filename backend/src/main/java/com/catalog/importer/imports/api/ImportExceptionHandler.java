package com.catalog.importer.imports.api;

import com.catalog.importer.imports.service.ImportJobConflictException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

@RestControllerAdvice
public class ImportExceptionHandler {

  @ExceptionHandler(ImportJobConflictException.class)
  public ResponseEntity<Map<String, String>> handleConflict(ImportJobConflictException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "import_job_conflict", "message", ex.getMessage()));
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<Map<String, String>> handleTooLarge(MaxUploadSizeExceededException ex) {
    return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
        .body(Map.of("error", "file_too_large", "message", "Uploaded file exceeds the size limit"));
  }
}
