package io.queryspan.span;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSortedSet;

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import javax.annotation.Nullable;

/**
 * A set of optimizer knobs which are disabled together, optionally on top of the knobs of a
 * parent hint-set.
 *
 * <p>The parent is fixed at construction, so the dependency chain can never form a cycle.
 * Instances are compared by identity; use {@link #knobKey()} to compare knob sets by value.
 */
public class HintSet {
    public static final String KNOB_SEPARATOR = ",";
    public static final String CHAIN_SEPARATOR = "/";
    public static final double UNKNOWN_RUNTIME = -1.0;

    private static final Joiner KNOB_JOINER = Joiner.on(KNOB_SEPARATOR);

    private final ImmutableSortedSet<String> knobs;
    private final HintSet dependency;

    private volatile String plan;
    private boolean required;
    private double predictedRuntime = UNKNOWN_RUNTIME;

    public HintSet(Set<String> knobs, @Nullable HintSet dependency) {
        Preconditions.checkNotNull(knobs, "knobs");
        this.knobs = ImmutableSortedSet.copyOf(knobs);
        this.dependency = dependency;
    }

    /**
     * The hint-set with nothing disabled, used to fetch the unmodified plan.
     */
    public static HintSet baseline() {
        return new HintSet(Collections.emptySet(), null);
    }

    public static HintSet singleton(String knob) {
        return new HintSet(Collections.singleton(knob), null);
    }

    public Set<String> knobs() {
        return knobs;
    }

    @Nullable
    public HintSet dependency() {
        return dependency;
    }

    public boolean isBaseline() {
        return knobs.isEmpty() && dependency == null;
    }

    /**
     * Own knobs plus the knobs of every ancestor. This is what must be disabled on the optimizer.
     */
    public Set<String> resolvedKnobs() {
        Set<String> all = new HashSet<>(knobs);
        for (HintSet parent = dependency; parent != null; parent = parent.dependency) {
            all.addAll(parent.knobs);
        }
        return all;
    }

    /**
     * Own knobs in sorted order, joined by {@link #KNOB_SEPARATOR}.
     */
    public String knobKey() {
        return KNOB_JOINER.join(knobs);
    }

    @Nullable
    public String plan() {
        return plan;
    }

    public boolean hasPlan() {
        return plan != null;
    }

    void setPlan(String plan) {
        Preconditions.checkNotNull(plan, "plan");
        Preconditions.checkState(this.plan == null, "plan of hint-set [%s] already fetched", this);
        this.plan = plan;
    }

    public long planHash() {
        Preconditions.checkState(plan != null, "plan of hint-set [%s] not fetched yet", this);
        return PlanHashes.hash(plan);
    }

    public boolean isRequired() {
        return required;
    }

    void markRequired() {
        this.required = true;
    }

    public double predictedRuntime() {
        return predictedRuntime;
    }

    public void setPredictedRuntime(double predictedRuntime) {
        this.predictedRuntime = predictedRuntime;
    }

    /**
     * The canonical form, e.g. "a,b/c": the parent's form, then the own knobs. Used as storage key.
     */
    @Override
    public String toString() {
        return dependency == null
                ? knobKey()
                : dependency.toString() + CHAIN_SEPARATOR + knobKey();
    }
}
