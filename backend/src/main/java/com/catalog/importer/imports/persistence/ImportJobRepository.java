package com.catalog.importer.imports.persistence;

import com.catalog.importer.imports.model.ImportJobSnapshot;
import com.catalog.importer.imports.model.ImportJobStatus;
import com.catalog.importer.imports.model.RowError;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class ImportJobRepository {
    private static final Logger log = LoggerFactory.getLogger(ImportJobRepository.class);
    private static final TypeReference<List<RowError>> ROW_ERRORS = new TypeReference<>() {};
    private static final int MAX_TEXT = 1000;

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public ImportJobRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    public void insert(ImportJobSnapshot snapshot) {
        jdbc.update(
            """
                INSERT INTO import_jobs (
                    id,
                    filename,
                    status,
                    total_rows,
                    processed_rows,
                    created_count,
                    updated_count,
                    error_count,
                    message,
                    error_message,
                    error_details,
                    created_at,
                    started_at,
                    completed_at,
                    updated_at
                )
                VALUES (
                    :id,
                    :filename,
                    :status,
                    :totalRows,
                    :processedRows,
                    :createdCount,
                    :updatedCount,
                    :errorCount,
                    :message,
                    :error,
                    :errorDetails,
                    :createdAt,
                    :startedAt,
                    :completedAt,
                    :updatedAt
                )
                """,
            params(snapshot)
        );
    }

    /**
     * Writes every mutable column of the snapshot in one statement so a reader never sees
     * counters from two different batches. A row that is already completed or failed is never
     * overwritten.
     *
     * @return false if the job is missing or already terminal
     */
    public boolean save(ImportJobSnapshot snapshot) {
        int updated = jdbc.update(
            """
                UPDATE import_jobs
                SET status = :status,
                    total_rows = :totalRows,
                    processed_rows = :processedRows,
                    created_count = :createdCount,
                    updated_count = :updatedCount,
                    error_count = :errorCount,
                    message = :message,
                    error_message = :error,
                    error_details = :errorDetails,
                    started_at = :startedAt,
                    completed_at = :completedAt,
                    updated_at = :updatedAt
                WHERE id = :id
                  AND status NOT IN (:completed, :failed)
                """,
            params(snapshot)
                .addValue("completed", ImportJobStatus.COMPLETED.value())
                .addValue("failed", ImportJobStatus.FAILED.value())
        );
        return updated > 0;
    }

    public Optional<ImportJobSnapshot> findById(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        List<ImportJobSnapshot> rows = jdbc.query(
            """
                SELECT *
                FROM import_jobs
                WHERE id = :id
                """,
            new MapSqlParameterSource("id", id),
            snapshotRowMapper()
        );
        return rows.stream().findFirst();
    }

    public List<ImportJobSnapshot> findRecent(int limit) {
        int safeLimit = Math.max(1, Math.min(limit, 500));
        return jdbc.query(
            """
                SELECT *
                FROM import_jobs
                ORDER BY created_at DESC, id DESC
                LIMIT :limit
                """,
            new MapSqlParameterSource("limit", safeLimit),
            snapshotRowMapper()
        );
    }

    public long countJobs() {
        Long value = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM import_jobs", Long.class);
        return value == null ? 0L : value;
    }

    public boolean delete(String id) {
        return jdbc.update("DELETE FROM import_jobs WHERE id = :id", new MapSqlParameterSource("id", id)) > 0;
    }

    public int failUnfinishedJobs(String message, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("failed", ImportJobStatus.FAILED.value())
            .addValue("pending", ImportJobStatus.PENDING.value())
            .addValue("running", ImportJobStatus.RUNNING.value())
            .addValue("message", truncate(message))
            .addValue("now", toTimestamp(now));
        return jdbc.update(
            """
                UPDATE import_jobs
                SET status = :failed,
                    message = :message,
                    error_message = :message,
                    completed_at = :now,
                    updated_at = :now
                WHERE status IN (:pending, :running)
                """,
            params
        );
    }

    private MapSqlParameterSource params(ImportJobSnapshot snapshot) {
        return new MapSqlParameterSource()
            .addValue("id", snapshot.id())
            .addValue("filename", snapshot.filename())
            .addValue("status", snapshot.status().value())
            .addValue("totalRows", snapshot.totalRows(), Types.INTEGER)
            .addValue("processedRows", snapshot.processedRows())
            .addValue("createdCount", snapshot.createdCount())
            .addValue("updatedCount", snapshot.updatedCount())
            .addValue("errorCount", snapshot.errorCount())
            .addValue("message", truncate(snapshot.message()), Types.VARCHAR)
            .addValue("error", truncate(snapshot.error()), Types.VARCHAR)
            .addValue("errorDetails", writeErrors(snapshot.errorDetails()), Types.VARCHAR)
            .addValue("createdAt", toTimestamp(snapshot.createdAt()))
            .addValue("startedAt", toTimestamp(snapshot.startedAt()), Types.TIMESTAMP)
            .addValue("completedAt", toTimestamp(snapshot.completedAt()), Types.TIMESTAMP)
            .addValue("updatedAt", toTimestamp(snapshot.updatedAt()));
    }

    private RowMapper<ImportJobSnapshot> snapshotRowMapper() {
        return (rs, rowNum) -> new ImportJobSnapshot(
            rs.getString("id"),
            rs.getString("filename"),
            ImportJobStatus.fromValue(rs.getString("status")),
            rs.getObject("total_rows", Integer.class),
            rs.getInt("processed_rows"),
            rs.getInt("created_count"),
            rs.getInt("updated_count"),
            rs.getInt("error_count"),
            rs.getString("message"),
            rs.getString("error_message"),
            readErrors(rs.getString("error_details")),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("started_at")),
            toInstant(rs.getTimestamp("completed_at")),
            toInstant(rs.getTimestamp("updated_at"))
        );
    }

    private String writeErrors(List<RowError> errors) {
        if (errors == null || errors.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(errors);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize {} row errors", errors.size(), e);
            return null;
        }
    }

    private List<RowError> readErrors(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, ROW_ERRORS);
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable error_details payload", e);
            return List.of();
        }
    }

    private String truncate(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.length() <= MAX_TEXT) {
            return trimmed;
        }
        return trimmed.substring(0, MAX_TEXT);
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
