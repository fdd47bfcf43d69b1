package io.queryspan.span;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Fetched hint-sets of one round, bucketed by {@link PlanClass}. Each bucket keeps the order of the input.
 */
public class Classification {
    private final List<HintSet> same = new ArrayList<>();
    private final List<HintSet> failed = new ArrayList<>();
    private final List<HintSet> alternatives = new ArrayList<>();

    void add(PlanClass planClass, HintSet hintSet) {
        switch (planClass) {
            case SAME:
                same.add(hintSet);
                break;
            case FAILED:
                failed.add(hintSet);
                break;
            case ALTERNATIVE:
                alternatives.add(hintSet);
                break;
            default:
                throw new IllegalStateException("Illegal plan class: " + planClass);
        }
    }

    public List<HintSet> same() {
        return Collections.unmodifiableList(same);
    }

    public List<HintSet> failed() {
        return Collections.unmodifiableList(failed);
    }

    public List<HintSet> alternatives() {
        return Collections.unmodifiableList(alternatives);
    }

    @Override
    public String toString() {
        return String.format("same: %d, failed: %d, alternative: %d", same.size(), failed.size(), alternatives.size());
    }
}
