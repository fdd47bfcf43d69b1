package io.queryspan.span.explore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import io.queryspan.span.Classification;
import io.queryspan.span.Explainer;
import io.queryspan.span.HintSet;
import io.queryspan.span.PendingPool;
import io.queryspan.span.PlanClassifier;
import io.queryspan.span.PlanHashes;

/**
 * Pops effective hint-sets in FIFO order and tries every pending knob on top of each, with the
 * popped hint-set's plan as the baseline. A pending knob which changes that plan is chained under
 * the popped hint-set, queued, and never tried again, so every knob ends up at most once in the
 * resulting dependency tree.
 *
 * <p>Candidates which fail on top of an effective hint-set are not required for the query, they
 * are left pending.
 */
public class IterativeExploration implements ExplorationStrategy {
    private static final Logger logger = LoggerFactory.getLogger(IterativeExploration.class);

    @Override
    public List<HintSet> explore(Explainer explainer, Deque<HintSet> frontier, PendingPool pending) {
        List<HintSet> found = new ArrayList<>();
        while (!frontier.isEmpty()) {
            HintSet effective = frontier.poll();
            found.add(effective);
            if (pending.isEmpty()) {
                continue;
            }

            List<HintSet> results = explainer.fetchAll(pending.chainUnder(effective));
            Classification classification = PlanClassifier.classify(effective.planHash(), PlanHashes.FAILED_HASH, results);
            logger.info("[{}] has {} alternative plans", effective, classification.alternatives().size());

            for (HintSet alternative : classification.alternatives()) {
                frontier.add(alternative);
                pending.remove(alternative);
            }
        }
        return found;
    }
}
