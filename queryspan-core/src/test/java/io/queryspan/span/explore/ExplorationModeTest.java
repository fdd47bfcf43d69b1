package io.queryspan.span.explore;

import org.junit.Assert;
import org.junit.Test;

public class ExplorationModeTest {

    @Test
    public void parseTest() {
        Assert.assertEquals(ExplorationMode.NONE, ExplorationMode.parse("none"));
        Assert.assertEquals(ExplorationMode.ITERATIVE, ExplorationMode.parse(" Iterative "));
        Assert.assertEquals(ExplorationMode.BATCH, ExplorationMode.parse("BATCH"));
        Assert.assertTrue(ExplorationStrategy.of(ExplorationMode.BATCH) instanceof BatchExploration);
        Assert.assertTrue(ExplorationStrategy.of(ExplorationMode.NONE) instanceof DrainExploration);
    }

    @Test(expected = IllegalArgumentException.class)
    public void parseIllegalTest() {
        ExplorationMode.parse("greedy");
    }
}
