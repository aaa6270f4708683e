package com.netbet.bybit.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.regex.Pattern;

/**
 * {@link RecordStore} on PostgreSQL through {@link JdbcTemplate}. Values are always bound as
 * parameters; table and column names are checked against a plain identifier pattern
 * (optionally schema-qualified) since they cannot be bound.
 */
@Component
public class JdbcRecordStore implements RecordStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcRecordStore.class);
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

    private final JdbcTemplate jdbc;

    public JdbcRecordStore(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public boolean createCollection(String name, List<String> columnDefinitions) {
        String table = identifier(name);
        if (columnDefinitions == null || columnDefinitions.isEmpty()) {
            throw new IllegalArgumentException("At least one column definition is required for " + name);
        }
        String sql = "CREATE TABLE IF NOT EXISTS " + table + " (" + String.join(", ", columnDefinitions) + ")";
        try {
            jdbc.execute(sql);
            log.info("Table {} ready", table);
            return true;
        } catch (DataAccessException e) {
            log.warn("Failed to create table {}: {}", table, e.getMessage());
            return false;
        }
    }

    @Override
    public boolean collectionExists(String name) {
        String table = identifier(name);
        String schema = "public";
        int dot = table.indexOf('.');
        if (dot > 0) {
            schema = table.substring(0, dot);
            table = table.substring(dot + 1);
        }
        try {
            Boolean exists = jdbc.queryForObject(
                    "SELECT EXISTS (SELECT 1 FROM information_schema.tables WHERE table_schema = ? AND table_name = ?)",
                    Boolean.class, schema, table);
            return Boolean.TRUE.equals(exists);
        } catch (DataAccessException e) {
            log.warn("Failed to check table {}: {}", name, e.getMessage());
            return false;
        }
    }

    @Override
    public boolean insert(String collection, Map<String, ?> record) {
        String table = identifier(collection);
        if (record == null || record.isEmpty()) {
            throw new IllegalArgumentException("Empty record for " + collection);
        }
        StringJoiner columns = new StringJoiner(", ");
        StringJoiner placeholders = new StringJoiner(", ");
        List<Object> args = new ArrayList<>(record.size());
        record.forEach((column, value) -> {
            columns.add(identifier(column));
            placeholders.add("?");
            args.add(value);
        });
        String sql = "INSERT INTO " + table + " (" + columns + ") VALUES (" + placeholders + ")";
        try {
            jdbc.update(sql, args.toArray());
            log.debug("Inserted into {}: {}", table, record.keySet());
            return true;
        } catch (DataAccessException e) {
            log.warn("Failed to insert into {}: {}", table, e.getMessage());
            return false;
        }
    }

    @Override
    public int update(String collection, Map<String, ?> fields, Map<String, ?> predicate) {
        String table = identifier(collection);
        if (fields == null || fields.isEmpty()) {
            throw new IllegalArgumentException("No fields to update in " + collection);
        }
        requirePredicate(predicate, "update", collection);
        StringJoiner assignments = new StringJoiner(", ");
        List<Object> args = new ArrayList<>();
        fields.forEach((column, value) -> {
            assignments.add(identifier(column) + " = ?");
            args.add(value);
        });
        String sql = "UPDATE " + table + " SET " + assignments + " WHERE " + where(predicate, args);
        try {
            int rows = jdbc.update(sql, args.toArray());
            log.debug("Updated {} row(s) in {}", rows, table);
            return rows;
        } catch (DataAccessException e) {
            log.warn("Failed to update {}: {}", table, e.getMessage());
            return 0;
        }
    }

    @Override
    public int delete(String collection, Map<String, ?> predicate) {
        String table = identifier(collection);
        requirePredicate(predicate, "delete", collection);
        List<Object> args = new ArrayList<>();
        String sql = "DELETE FROM " + table + " WHERE " + where(predicate, args);
        try {
            return jdbc.update(sql, args.toArray());
        } catch (DataAccessException e) {
            log.warn("Failed to delete from {}: {}", table, e.getMessage());
            return 0;
        }
    }

    @Override
    public List<Map<String, Object>> select(String collection, Map<String, ?> predicate) {
        return query(collection, predicate, null, 0);
    }

    @Override
    public List<Map<String, Object>> selectLatest(String collection, Map<String, ?> predicate, String orderByColumn, int limit) {
        return query(collection, predicate, identifier(orderByColumn), limit);
    }

    private List<Map<String, Object>> query(String collection, Map<String, ?> predicate, String orderBy, int limit) {
        String table = identifier(collection);
        List<Object> args = new ArrayList<>();
        StringBuilder sql = new StringBuilder("SELECT * FROM ").append(table);
        if (predicate != null && !predicate.isEmpty()) {
            sql.append(" WHERE ").append(where(predicate, args));
        }
        if (orderBy != null) {
            sql.append(" ORDER BY ").append(orderBy).append(" DESC");
        }
        if (limit > 0) {
            sql.append(" LIMIT ?");
            args.add(limit);
        }
        try {
            return jdbc.queryForList(sql.toString(), args.toArray());
        } catch (DataAccessException e) {
            log.warn("Failed to select from {}: {}", table, e.getMessage());
            return List.of();
        }
    }

    /** Appends bound values to {@code args} in clause order. */
    private static String where(Map<String, ?> predicate, List<Object> args) {
        StringJoiner clauses = new StringJoiner(" AND ");
        predicate.forEach((column, value) -> {
            String col = identifier(column);
            if (value == null) {
                clauses.add(col + " IS NULL");
            } else if (value instanceof Collection<?> values) {
                if (values.isEmpty()) {
                    clauses.add("FALSE");
                    return;
                }
                StringJoiner in = new StringJoiner(", ", col + " IN (", ")");
                for (Object v : values) {
                    in.add("?");
                    args.add(v);
                }
                clauses.add(in.toString());
            } else {
                clauses.add(col + " = ?");
                args.add(value);
            }
        });
        return clauses.toString();
    }

    private static void requirePredicate(Map<String, ?> predicate, String operation, String collection) {
        if (predicate == null || predicate.isEmpty()) {
            throw new IllegalArgumentException("Refusing " + operation + " on " + collection + " without a predicate");
        }
    }

    private static String identifier(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid identifier: " + name);
        }
        return name;
    }
}
