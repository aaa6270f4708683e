package com.netbet.bybit.persistence;

import java.util.List;
import java.util.Map;

/**
 * Minimal table-oriented store used by the order manager.
 * <p>
 * Predicates are column to value maps joined with {@code AND}: a {@code null} value matches
 * {@code IS NULL}, a {@link java.util.Collection} value matches {@code IN (...)}, anything else
 * matches by equality. An empty predicate matches every row. Failures are logged and reported
 * as {@code false}, {@code 0} or an empty list.
 */
public interface RecordStore {

    /** Create the collection if it does not exist. Column definitions are SQL fragments. */
    boolean createCollection(String name, List<String> columnDefinitions);

    boolean collectionExists(String name);

    boolean insert(String collection, Map<String, ?> record);

    /** @throws IllegalArgumentException if {@code predicate} is empty */
    int update(String collection, Map<String, ?> fields, Map<String, ?> predicate);

    /** @throws IllegalArgumentException if {@code predicate} is empty */
    int delete(String collection, Map<String, ?> predicate);

    List<Map<String, Object>> select(String collection, Map<String, ?> predicate);

    /** Rows ordered by {@code orderByColumn} descending, at most {@code limit} ({@code <= 0} means no limit). */
    List<Map<String, Object>> selectLatest(String collection, Map<String, ?> predicate, String orderByColumn, int limit);
}
