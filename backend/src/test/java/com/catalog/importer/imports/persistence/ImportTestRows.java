package com.catalog.importer.imports.persistence;

import com.catalog.importer.imports.model.ProductEventData;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;

import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/** Direct row access for tests; webhook configuration and product reads live outside the importer. */
public final class ImportTestRows {

    private ImportTestRows() {
    }

    public static Optional<ProductEventData> findProduct(NamedParameterJdbcTemplate jdbc, String sku) {
        List<ProductEventData> rows = jdbc.query(
            """
                SELECT id, sku, name, description, price, quantity, is_active, created_at, updated_at
                FROM products
                WHERE sku = :sku
                """,
            new MapSqlParameterSource("sku", sku.trim().toUpperCase(Locale.ROOT)),
            (rs, rowNum) -> new ProductEventData(
                rs.getLong("id"),
                rs.getString("sku"),
                rs.getString("name"),
                rs.getString("description"),
                rs.getBigDecimal("price"),
                rs.getInt("quantity"),
                rs.getBoolean("is_active"),
                toInstant(rs.getTimestamp("created_at")),
                toInstant(rs.getTimestamp("updated_at"))
            )
        );
        return rows.stream().findFirst();
    }

    public static long insertWebhook(
        NamedParameterJdbcTemplate jdbc,
        String name,
        String url,
        String eventType,
        String secret,
        boolean enabled
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("name", name)
            .addValue("url", url)
            .addValue("eventType", eventType)
            .addValue("secret", secret, Types.VARCHAR)
            .addValue("enabled", enabled);
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO webhooks (name, url, event_type, secret, is_enabled)
                VALUES (:name, :url, :eventType, :secret, :enabled)
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        return keyHolder.getKey().longValue();
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
