package io.queryspan.span;

import com.google.common.collect.ImmutableList;

import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The hint-sets worth benchmarking for one query: the baseline first, then the required
 * hint-sets, then the ones producing alternative plans, each group in discovery order.
 */
public class QuerySpan implements Iterable<HintSet> {
    private final List<HintSet> hintSets;
    private final long baselineHash;
    private final int fetchCount;
    private final int roundCount;

    public QuerySpan(List<HintSet> hintSets, long baselineHash, int fetchCount, int roundCount) {
        this.hintSets = ImmutableList.copyOf(hintSets);
        this.baselineHash = baselineHash;
        this.fetchCount = fetchCount;
        this.roundCount = roundCount;
    }

    public List<HintSet> hintSets() {
        return hintSets;
    }

    public HintSet baseline() {
        return hintSets.get(0);
    }

    public List<HintSet> required() {
        return hintSets.stream().filter(HintSet::isRequired).collect(Collectors.toList());
    }

    public List<HintSet> alternatives() {
        return hintSets.stream().skip(1).filter(hs -> !hs.isRequired()).collect(Collectors.toList());
    }

    public int size() {
        return hintSets.size();
    }

    public long baselineHash() {
        return baselineHash;
    }

    /** Plans fetched to compute this span, the baseline included. */
    public int fetchCount() {
        return fetchCount;
    }

    public int roundCount() {
        return roundCount;
    }

    @Override
    public Iterator<HintSet> iterator() {
        return hintSets.iterator();
    }

    @Override
    public String toString() {
        return hintSets.toString();
    }
}
