package io.queryspan.span;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import io.queryspan.connector.ConnectorFactory;

/**
 * Fetches plans of one query through the worker pool. Rounds are strictly sequential: a call
 * returns only after every plan of the round has been fetched.
 */
public class Explainer {
    private final ConnectorFactory connectorFactory;
    private final String sql;
    private final ExplainWorkerPool workerPool;

    private int fetchCount;
    private int roundCount;

    public Explainer(ConnectorFactory connectorFactory, String sql, ExplainWorkerPool workerPool) {
        this.connectorFactory = connectorFactory;
        this.sql = sql;
        this.workerPool = workerPool;
    }

    public HintSet fetch(HintSet hintSet) {
        return fetchAll(Collections.singletonList(hintSet)).get(0);
    }

    public List<HintSet> fetchAll(List<HintSet> hintSets) {
        if (hintSets.isEmpty()) {
            return Collections.emptyList();
        }
        List<PlanFetcher> fetchers = new ArrayList<>(hintSets.size());
        for (HintSet hintSet : hintSets) {
            fetchers.add(new PlanFetcher(connectorFactory, sql, hintSet));
        }
        roundCount++;
        fetchCount += fetchers.size();
        return workerPool.fetchAll(fetchers);
    }

    /** Number of plans requested so far. */
    public int fetchCount() {
        return fetchCount;
    }

    /** Number of fetch batches issued so far. */
    public int roundCount() {
        return roundCount;
    }
}
