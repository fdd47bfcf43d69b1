package io.queryspan.span.explore;

import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import io.queryspan.span.Explainer;
import io.queryspan.span.HintSet;
import io.queryspan.span.PendingPool;

/**
 * Takes the frontier as it is, no more plans are fetched.
 */
public class DrainExploration implements ExplorationStrategy {
    @Override
    public List<HintSet> explore(Explainer explainer, Deque<HintSet> frontier, PendingPool pending) {
        List<HintSet> found = new ArrayList<>(frontier.size());
        while (!frontier.isEmpty()) {
            found.add(frontier.poll());
        }
        return found;
    }
}
