package com.catalog.importer.imports.persistence;

import com.catalog.importer.imports.model.Webhook;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Webhook rows are configured elsewhere; this side only reads them and records delivery outcomes.
 */
@Repository
public class WebhookRepository {
    private final NamedParameterJdbcTemplate jdbc;

    public WebhookRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public List<Webhook> findEnabledByEventType(String eventType) {
        return jdbc.query(
            """
                SELECT *
                FROM webhooks
                WHERE event_type = :eventType
                  AND is_enabled = TRUE
                ORDER BY id
                """,
            new MapSqlParameterSource("eventType", eventType),
            webhookRowMapper()
        );
    }

    public Optional<Webhook> findById(long id) {
        List<Webhook> rows = jdbc.query(
            "SELECT * FROM webhooks WHERE id = :id",
            new MapSqlParameterSource("id", id),
            webhookRowMapper()
        );
        return rows.stream().findFirst();
    }

    public void recordDelivery(
        long id,
        Instant triggeredAt,
        Integer responseCode,
        long responseTimeMs,
        boolean success
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("triggeredAt", toTimestamp(triggeredAt))
            .addValue("responseCode", responseCode, Types.INTEGER)
            .addValue("responseTimeMs", (int) Math.min(Integer.MAX_VALUE, Math.max(0L, responseTimeMs)));
        if (success) {
            jdbc.update(
                """
                    UPDATE webhooks
                    SET last_triggered_at = :triggeredAt,
                        last_response_code = :responseCode,
                        last_response_time_ms = :responseTimeMs,
                        failure_count = 0,
                        updated_at = :triggeredAt
                    WHERE id = :id
                    """,
                params
            );
            return;
        }
        jdbc.update(
            """
                UPDATE webhooks
                SET last_triggered_at = :triggeredAt,
                    last_response_code = :responseCode,
                    last_response_time_ms = :responseTimeMs,
                    failure_count = failure_count + 1,
                    updated_at = :triggeredAt
                WHERE id = :id
                """,
            params
        );
    }

    private RowMapper<Webhook> webhookRowMapper() {
        return (rs, rowNum) -> new Webhook(
            rs.getLong("id"),
            rs.getString("name"),
            rs.getString("url"),
            rs.getString("event_type"),
            rs.getString("secret"),
            rs.getBoolean("is_enabled"),
            toInstant(rs.getTimestamp("last_triggered_at")),
            rs.getObject("last_response_code", Integer.class),
            rs.getObject("last_response_time_ms", Integer.class),
            rs.getInt("failure_count")
        );
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
