package io.queryspan.span;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Buckets fetched plans by comparing their hashes with a baseline hash and the hash of the
 * failure sentinel. No other property of a plan is looked at.
 */
public final class PlanClassifier {
    private static final Logger logger = LoggerFactory.getLogger(PlanClassifier.class);

    private PlanClassifier() {
    }

    /**
     * A failed plan is always {@link PlanClass#FAILED}, even when the baseline itself failed.
     */
    public static PlanClass classify(long planHash, long baselineHash, long failedHash) {
        if (planHash == failedHash) {
            return PlanClass.FAILED;
        }
        if (planHash == baselineHash) {
            return PlanClass.SAME;
        }
        return PlanClass.ALTERNATIVE;
    }

    public static Classification classify(long baselineHash, long failedHash, List<HintSet> fetched) {
        Classification classification = new Classification();
        for (HintSet hintSet : fetched) {
            PlanClass planClass = classify(hintSet.planHash(), baselineHash, failedHash);
            logger.debug("[{}] -> {}", hintSet, planClass);
            classification.add(planClass, hintSet);
        }
        return classification;
    }
}
