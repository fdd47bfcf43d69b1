package io.queryspan.store;

/**
 * Persists the discovered hint-sets of queries.
 */
public interface SpanStorage {

    void registerQuery(String queryId) throws StorageException;

    /**
     * Load the sql text of a registered query.
     */
    String readSql(String queryId) throws StorageException;

    void registerOptimizer(String queryId, String knobKey, String tableName) throws StorageException;

    void registerOptimizerDependency(String queryId, String childKey, String parentKey, String tableName) throws StorageException;
}
