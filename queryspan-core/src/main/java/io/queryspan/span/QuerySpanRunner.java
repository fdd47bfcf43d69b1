package io.queryspan.span;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.queryspan.store.SpanStorage;
import io.queryspan.store.StorageException;

/**
 * Computes the span of a stored query and records it.
 */
public class QuerySpanRunner {
    private static final Logger logger = LoggerFactory.getLogger(QuerySpanRunner.class);

    public static final String EFFECTIVE_TABLE = "query_effective_optimizers";
    public static final String DEPENDENCY_TABLE = "query_effective_optimizers_dependencies";

    private final SpanStorage storage;
    private final SpanSearch search;

    public QuerySpanRunner(SpanStorage storage, SpanSearch search) {
        this.storage = storage;
        this.search = search;
    }

    public QuerySpan run(String queryId) throws StorageException {
        logger.info("Approximate query span for query: {}", queryId);
        storage.registerQuery(queryId);
        String sql = storage.readSql(queryId);

        QuerySpan span = search.search(sql);

        for (HintSet hintSet : span) {
            logger.info("Found new hint-set: [{}]{}", hintSet, hintSet.isRequired() ? " (required)" : "");
            String key = hintSet.toString();
            storage.registerOptimizer(queryId, key, EFFECTIVE_TABLE);
            HintSet parent = hintSet.dependency();
            if (parent != null) {
                storage.registerOptimizerDependency(queryId, key, parent.toString(), DEPENDENCY_TABLE);
            }
        }
        return span;
    }
}
