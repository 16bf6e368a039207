package com.catalog.importer.imports.service;

import com.catalog.importer.imports.model.BatchUpsertResult;
import com.catalog.importer.imports.model.ProductColumn;
import com.catalog.importer.imports.model.ProductRecord;
import com.catalog.importer.imports.model.RowError;
import com.catalog.importer.imports.persistence.ProductJdbcRepository;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Applies one batch of products as a single insert-or-update keyed on the normalized SKU.
 *
 * <p>The whole batch runs in one transaction. If the store rejects any row on a constraint, the
 * batch is rolled back and re-applied one row at a time so only the offending rows are reported.
 * Any other data access failure propagates and fails the job.
 */
@Service
public class ProductUpsertEngine {
  private static final Logger log = LoggerFactory.getLogger(ProductUpsertEngine.class);
  private static final int MAX_REASON_LENGTH = 500;

  private final ProductJdbcRepository repository;
  private final TransactionTemplate transactionTemplate;

  public ProductUpsertEngine(
      ProductJdbcRepository repository, PlatformTransactionManager transactionManager) {
    this.repository = repository;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
  }

  public BatchUpsertResult apply(List<ProductRecord> records, Set<ProductColumn> columns) {
    if (records == null || records.isEmpty()) {
      return BatchUpsertResult.empty();
    }
    Set<String> existing =
        repository.findExistingSkus(records.stream().map(ProductRecord::sku).toList());
    try {
      transactionTemplate.executeWithoutResult(status -> repository.upsertAll(records, columns));
    } catch (DataIntegrityViolationException e) {
      log.warn(
          "Batch of {} products rejected by a constraint ({}); retrying row by row",
          records.size(),
          reason(e));
      return applyRowByRow(records, columns, existing);
    }

    Set<String> seen = new HashSet<>(existing);
    int created = 0;
    int updated = 0;
    for (ProductRecord record : records) {
      if (seen.add(record.sku())) {
        created++;
      } else {
        updated++;
      }
    }
    return new BatchUpsertResult(created, updated, List.of());
  }

  private BatchUpsertResult applyRowByRow(
      List<ProductRecord> records, Set<ProductColumn> columns, Set<String> existing) {
    Set<String> seen = new HashSet<>(existing);
    List<RowError> rowErrors = new ArrayList<>();
    int created = 0;
    int updated = 0;
    for (ProductRecord record : records) {
      try {
        repository.upsert(record, columns);
      } catch (DataIntegrityViolationException e) {
        rowErrors.add(new RowError(record.rowNumber(), null, reason(e)));
        continue;
      }
      if (seen.add(record.sku())) {
        created++;
      } else {
        updated++;
      }
    }
    return new BatchUpsertResult(created, updated, rowErrors);
  }

  private String reason(DataIntegrityViolationException e) {
    Throwable cause = e.getMostSpecificCause();
    String message = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
    String trimmed = message.trim();
    return trimmed.length() <= MAX_REASON_LENGTH ? trimmed : trimmed.substring(0, MAX_REASON_LENGTH);
  }
}
