package io.queryspan.span;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The singleton hint-sets not yet consumed by the search, keyed by {@link HintSet#knobKey()}.
 */
public class PendingPool {
    private final Map<String, HintSet> pool = new LinkedHashMap<>();

    public void add(HintSet hintSet) {
        pool.putIfAbsent(hintSet.knobKey(), hintSet);
    }

    /**
     * Remove the pending hint-set with the same knobs as the given one, whatever its dependency.
     */
    public boolean remove(HintSet hintSet) {
        return pool.remove(hintSet.knobKey()) != null;
    }

    public boolean contains(HintSet hintSet) {
        return pool.containsKey(hintSet.knobKey());
    }

    public int size() {
        return pool.size();
    }

    public boolean isEmpty() {
        return pool.isEmpty();
    }

    /**
     * A new candidate for every pending hint-set, with the same knobs, chained under {@code parent}.
     */
    public List<HintSet> chainUnder(HintSet parent) {
        List<HintSet> candidates = new ArrayList<>(pool.size());
        for (HintSet pending : pool.values()) {
            candidates.add(new HintSet(pending.knobs(), parent));
        }
        return candidates;
    }

    public List<HintSet> snapshot() {
        return new ArrayList<>(pool.values());
    }
}
