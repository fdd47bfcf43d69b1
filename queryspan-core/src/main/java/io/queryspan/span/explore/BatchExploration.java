package io.queryspan.span.explore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import io.queryspan.span.Classification;
import io.queryspan.span.Explainer;
import io.queryspan.span.HintSet;
import io.queryspan.span.PendingPool;
import io.queryspan.span.PlanClassifier;
import io.queryspan.span.PlanHashes;

/**
 * Keeps one flat hint-set holding the union of all effective knobs found so far. Each round
 * fetches the plan of the union as baseline, then every pending knob on top of it, and folds
 * the knobs of the alternatives into the union. Stops after a round without alternatives, or
 * once the union holds every knob that is not required.
 *
 * <p>The hint-sets found in a round are chained under that round's union, but the union itself
 * has no dependency: which earlier knob an alternative interacts with is not recorded. This
 * needs one round per depth of interaction instead of one round per effective hint-set.
 */
public class BatchExploration implements ExplorationStrategy {
    private static final Logger logger = LoggerFactory.getLogger(BatchExploration.class);

    private final List<Set<String>> unions = new ArrayList<>();

    @Override
    public List<HintSet> explore(Explainer explainer, Deque<HintSet> frontier, PendingPool pending) {
        List<HintSet> found = new ArrayList<>();
        List<HintSet> discovered = new ArrayList<>(frontier);
        frontier.clear();

        Set<String> union = new HashSet<>();
        while (!discovered.isEmpty()) {
            for (HintSet hintSet : discovered) {
                found.add(hintSet);
                pending.remove(hintSet);
                union.addAll(hintSet.knobs());
            }

            HintSet cumulative = new HintSet(union, null);
            unions.add(cumulative.knobs());
            long baselineHash = explainer.fetch(cumulative).planHash();
            logger.info("round {}: union [{}] plan hash #{}", unions.size() + 1, cumulative, baselineHash);
            if (pending.isEmpty()) {
                // Every knob is folded into the union, nothing left to try on top of it.
                break;
            }

            List<HintSet> results = explainer.fetchAll(pending.chainUnder(cumulative));
            Classification classification = PlanClassifier.classify(baselineHash, PlanHashes.FAILED_HASH, results);
            logger.info("round {}: {}", unions.size() + 1, classification);
            discovered = new ArrayList<>(classification.alternatives());
        }
        return found;
    }

    /**
     * The knobs of the union used as baseline in each refinement round, oldest first.
     */
    public List<Set<String>> unions() {
        return unions;
    }
}
