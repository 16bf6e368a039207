package com.catalog.importer.imports.persistence;

import com.catalog.importer.imports.model.ProductColumn;
import com.catalog.importer.imports.model.ProductRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

@Repository
public class ProductJdbcRepository {
    private static final Logger log = LoggerFactory.getLogger(ProductJdbcRepository.class);
    private static final int LOOKUP_SLICE = 1000;

    private final NamedParameterJdbcTemplate jdbc;
    private final boolean postgres;

    public ProductJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
        this.postgres = detectPostgres(jdbc);
    }

    public Set<String> findExistingSkus(Collection<String> skus) {
        if (skus == null || skus.isEmpty()) {
            return Set.of();
        }
        List<String> distinct = new ArrayList<>(new LinkedHashSet<>(skus));
        Set<String> existing = new LinkedHashSet<>();
        for (int i = 0; i < distinct.size(); i += LOOKUP_SLICE) {
            int end = Math.min(distinct.size(), i + LOOKUP_SLICE);
            MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("skus", distinct.subList(i, end));
            jdbc.query(
                """
                    SELECT sku
                    FROM products
                    WHERE sku IN (:skus)
                    """,
                params,
                rs -> {
                    String sku = rs.getString("sku");
                    if (sku != null) {
                        existing.add(sku);
                    }
                }
            );
        }
        return existing;
    }

    /**
     * Applies every record in file order as one JDBC batch. Later statements for a repeated SKU
     * overwrite earlier ones. Only the given columns are written; the rest keep their defaults on
     * insert and their stored values on update.
     */
    public void upsertAll(List<ProductRecord> records, Set<ProductColumn> columns) {
        if (records == null || records.isEmpty()) {
            return;
        }
        String sql = upsertSql(columns);
        MapSqlParameterSource[] batch = records.stream()
            .map(this::params)
            .toArray(MapSqlParameterSource[]::new);
        jdbc.batchUpdate(sql, batch);
    }

    public void upsert(ProductRecord record, Set<ProductColumn> columns) {
        jdbc.update(upsertSql(columns), params(record));
    }

    private String upsertSql(Set<ProductColumn> columns) {
        List<String> names = new ArrayList<>();
        names.add(ProductColumn.SKU.columnName());
        names.add(ProductColumn.NAME.columnName());
        for (ProductColumn column : ProductColumn.values()) {
            if (!column.isRequired() && columns != null && columns.contains(column)) {
                names.add(column.columnName());
            }
        }
        String columnList = String.join(", ", names);
        String valueList = names.stream().map(name -> ":" + name).collect(Collectors.joining(", "));

        if (postgres) {
            String updates = names.stream()
                .filter(name -> !name.equals(ProductColumn.SKU.columnName()))
                .map(name -> name + " = EXCLUDED." + name)
                .collect(Collectors.joining(", "));
            return """
                INSERT INTO products (%s, created_at, updated_at)
                VALUES (%s, NOW(), NOW())
                ON CONFLICT (sku)
                DO UPDATE SET %s, updated_at = NOW()
                """.formatted(columnList, valueList, updates);
        }

        return """
            MERGE INTO products (%s, updated_at)
            KEY(sku)
            VALUES (%s, CURRENT_TIMESTAMP())
            """.formatted(columnList, valueList);
    }

    private MapSqlParameterSource params(ProductRecord record) {
        return new MapSqlParameterSource()
            .addValue("sku", record.sku())
            .addValue("name", record.name())
            .addValue("description", record.description(), Types.VARCHAR)
            .addValue("price", record.price(), Types.NUMERIC)
            .addValue("quantity", record.quantity())
            .addValue("is_active", record.active());
    }

    private boolean detectPostgres(NamedParameterJdbcTemplate jdbcTemplate) {
        if (jdbcTemplate.getJdbcTemplate().getDataSource() == null) {
            return false;
        }
        try (Connection connection = jdbcTemplate.getJdbcTemplate().getDataSource().getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            String productName = metaData == null ? null : metaData.getDatabaseProductName();
            String url = metaData == null ? null : metaData.getURL();
            if (url != null && url.toLowerCase(Locale.ROOT).startsWith("jdbc:h2:")) {
                return false;
            }
            return productName != null && productName.toLowerCase(Locale.ROOT).contains("postgres");
        } catch (Exception e) {
            log.warn("Unable to detect database product; defaulting to MERGE upserts", e);
            return false;
        }
    }
}
