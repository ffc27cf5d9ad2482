package com.entity.network.graph;

import java.util.List;
import java.util.Map;

/**
 * Cypher endpoint backing {@link com.entity.network.store.CypherGraphStore}.
 * Parameters are referenced as {@code $name} in the query text.
 */
public interface GraphConnection extends AutoCloseable {

    /**
     * Runs a write query, discarding any result.
     */
    void execute(String query, Map<String, Object> params);

    /**
     * Runs a read query; each row maps the returned column aliases to their values.
     */
    List<Map<String, Object>> query(String query, Map<String, Object> params);

    boolean isConnected();

    /**
     * Creates the scope and id indexes. Indexes that already exist are left alone.
     */
    void createIndexes();

    @Override
    void close();
}
