package io.queryspan.span;

import com.google.common.base.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

import io.queryspan.connector.ConnectorException;
import io.queryspan.connector.ConnectorFactory;
import io.queryspan.span.explore.ExplorationMode;
import io.queryspan.span.explore.ExplorationStrategy;

/**
 * Approximates the span of a query: the hint-sets which make the optimizer produce a different
 * plan, or which are required for it to produce a plan at all.
 *
 * <p>The search first fetches the unmodified plan, then the plan with each single knob
 * disabled. Singletons which fail are required. Singletons which produce an alternative plan
 * are expanded further by the {@link ExplorationStrategy} of the configured mode. Singletons
 * without effect are dropped from the span but stay pending, an effective hint-set may give
 * them an effect later.
 */
public class SpanSearch {
    private static final Logger logger = LoggerFactory.getLogger(SpanSearch.class);

    private final ConnectorFactory connectorFactory;
    private final int threads;
    private final ExplorationMode mode;

    public SpanSearch(ConnectorFactory connectorFactory, int threads, ExplorationMode mode) {
        Preconditions.checkNotNull(connectorFactory, "connectorFactory");
        Preconditions.checkArgument(threads > 0, "explain threads should be positive, got %s", threads);
        Preconditions.checkNotNull(mode, "mode");
        this.connectorFactory = connectorFactory;
        this.threads = threads;
        this.mode = mode;
    }

    /**
     * @throws SpanSearchException if the connector fails, nothing of the search is kept then.
     */
    public QuerySpan search(String sql) {
        Preconditions.checkNotNull(sql, "sql");
        PendingPool pending = new PendingPool();
        for (String knob : knobs()) {
            pending.add(HintSet.singleton(knob));
        }

        try (ExplainWorkerPool workerPool = new ExplainWorkerPool(threads)) {
            Explainer explainer = new Explainer(connectorFactory, sql, workerPool);
            List<HintSet> span = new ArrayList<>();

            HintSet baseline = explainer.fetch(HintSet.baseline());
            span.add(baseline);
            long baselineHash = baseline.planHash();
            logger.info("default plan hash: #{}", baselineHash);
            logger.info("failed query hash: #{}", PlanHashes.FAILED_HASH);

            List<HintSet> results = explainer.fetchAll(pending.snapshot());
            Classification classification = PlanClassifier.classify(baselineHash, PlanHashes.FAILED_HASH, results);
            logger.info("there are {} alternative plans and {} required hint-sets",
                    classification.alternatives().size(), classification.failed().size());

            for (HintSet required : classification.failed()) {
                required.markRequired();
                span.add(required);
                pending.remove(required);
            }
            Deque<HintSet> frontier = new ArrayDeque<>();
            for (HintSet alternative : classification.alternatives()) {
                frontier.add(alternative);
                pending.remove(alternative);
            }

            span.addAll(ExplorationStrategy.of(mode).explore(explainer, frontier, pending));
            return new QuerySpan(span, baselineHash, explainer.fetchCount(), explainer.roundCount());
        }
    }

    private Set<String> knobs() {
        try {
            return connectorFactory.knobs();
        } catch (ConnectorException e) {
            throw new SpanSearchException("Load knobs failed", e);
        }
    }
}
