package io.queryspan.span;

public enum PlanClass {
    /** Same plan as the baseline, the knobs had no effect. */
    SAME,
    /** The optimizer failed to produce a plan. */
    FAILED,
    /** A plan different from the baseline. */
    ALTERNATIVE,
}
