package io.queryspan.span.explore;

import java.util.Deque;
import java.util.List;

import io.queryspan.span.Explainer;
import io.queryspan.span.HintSet;
import io.queryspan.span.PendingPool;

/**
 * Expands the hint-sets found effective in the singleton round.
 */
public interface ExplorationStrategy {

    /**
     * @param explainer fetches plans of the current query.
     * @param frontier  effective hint-sets not explored yet, in discovery order. Drained by this call.
     * @param pending   singleton hint-sets not consumed yet. Updated by this call.
     * @return the hint-sets to append to the span, in discovery order.
     */
    List<HintSet> explore(Explainer explainer, Deque<HintSet> frontier, PendingPool pending);

    static ExplorationStrategy of(ExplorationMode mode) {
        switch (mode) {
            case NONE:
                return new DrainExploration();
            case ITERATIVE:
                return new IterativeExploration();
            case BATCH:
                return new BatchExploration();
            default:
                throw new IllegalStateException("Illegal exploration mode: " + mode);
        }
    }
}
