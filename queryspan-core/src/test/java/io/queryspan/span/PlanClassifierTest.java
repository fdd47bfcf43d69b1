package io.queryspan.span;

import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import io.queryspan.connector.Connector;

public class PlanClassifierTest {
    private static final long BASELINE = PlanHashes.hash("H0");

    private static HintSet fetched(String knob, String plan) {
        HintSet hintSet = HintSet.singleton(knob);
        hintSet.setPlan(plan);
        return hintSet;
    }

    @Test
    public void bucketTest() {
        HintSet same = fetched("k1", "H0");
        HintSet alternative = fetched("k2", "H1");
        HintSet failed = fetched("k3", Connector.FAILED);
        HintSet alternative2 = fetched("k4", "H2");

        Classification c = PlanClassifier.classify(BASELINE, PlanHashes.FAILED_HASH,
                Arrays.asList(same, alternative, failed, alternative2));
        Assert.assertEquals(Arrays.asList(same), c.same());
        Assert.assertEquals(Arrays.asList(failed), c.failed());
        Assert.assertEquals(Arrays.asList(alternative, alternative2), c.alternatives());
    }

    @Test
    public void idempotenceTest() {
        List<HintSet> fetched = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            fetched.add(fetched("k" + i, i % 3 == 0 ? "H0" : i % 3 == 1 ? Connector.FAILED : "H" + i));
        }
        Classification first = PlanClassifier.classify(BASELINE, PlanHashes.FAILED_HASH, fetched);
        Classification second = PlanClassifier.classify(BASELINE, PlanHashes.FAILED_HASH, fetched);
        Assert.assertEquals(first.same(), second.same());
        Assert.assertEquals(first.failed(), second.failed());
        Assert.assertEquals(first.alternatives(), second.alternatives());
        Assert.assertEquals(17, first.same().size());
        Assert.assertEquals(17, first.failed().size());
        Assert.assertEquals(16, first.alternatives().size());
    }

    @Test
    public void failedBaselineTest() {
        long failed = PlanHashes.FAILED_HASH;
        Assert.assertEquals(PlanClass.FAILED, PlanClassifier.classify(failed, failed, failed));
        Assert.assertEquals(PlanClass.SAME, PlanClassifier.classify(BASELINE, BASELINE, failed));
        Assert.assertEquals(PlanClass.ALTERNATIVE, PlanClassifier.classify(PlanHashes.hash("H1"), BASELINE, failed));
    }
}
