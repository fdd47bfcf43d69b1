package io.queryspan.span;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * A fixed number of workers running {@link PlanFetcher}s. One pool lives as long as the span
 * search of one query.
 */
public class ExplainWorkerPool implements Closeable {
    private static final Logger logger = LoggerFactory.getLogger(ExplainWorkerPool.class);

    private final ExecutorService executor;

    public ExplainWorkerPool(int threads) {
        Preconditions.checkArgument(threads > 0, "worker count should be positive, got %s", threads);
        this.executor = Executors.newFixedThreadPool(threads, new ThreadFactoryBuilder()
                .setNameFormat("explain-worker-%d")
                .setDaemon(true)
                .build());
    }

    /**
     * Run all fetchers and wait until every one of them is done. The first failing fetcher aborts
     * the whole batch, the remaining fetchers are cancelled.
     *
     * @return the fetched hint-sets, in the order of the fetchers.
     */
    public List<HintSet> fetchAll(List<PlanFetcher> fetchers) {
        List<Future<HintSet>> futures = new ArrayList<>(fetchers.size());
        for (PlanFetcher fetcher : fetchers) {
            futures.add(executor.submit(fetcher));
        }
        List<HintSet> results = new ArrayList<>(fetchers.size());
        try {
            for (Future<HintSet> future : futures) {
                results.add(future.get());
            }
        } catch (InterruptedException e) {
            cancelAll(futures);
            Thread.currentThread().interrupt();
            throw new SpanSearchException("Interrupted while waiting for plans", e);
        } catch (ExecutionException e) {
            cancelAll(futures);
            throw new SpanSearchException("Fetch plan failed", e.getCause());
        }
        return results;
    }

    private static void cancelAll(List<Future<HintSet>> futures) {
        for (Future<HintSet> future : futures) {
            future.cancel(true);
        }
    }

    @Override
    public void close() {
        List<Runnable> notStarted = executor.shutdownNow();
        if (!notStarted.isEmpty()) {
            logger.debug("{} fetches dropped on close", notStarted.size());
        }
    }
}
