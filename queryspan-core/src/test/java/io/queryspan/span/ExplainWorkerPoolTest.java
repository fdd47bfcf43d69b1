package io.queryspan.span;

import org.junit.Assert;
import org.junit.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import io.queryspan.connector.Connector;
import io.queryspan.connector.ConnectorException;
import io.queryspan.connector.ConnectorFactory;

public class ExplainWorkerPoolTest {

    @Test
    public void fetchAllTest() {
        ScriptedConnectorFactory factory = new ScriptedConnectorFactory(d -> "plan-" + d.size());
        List<PlanFetcher> fetchers = new ArrayList<>();
        List<HintSet> hintSets = new ArrayList<>();
        HintSet parent = HintSet.singleton("p");
        for (int i = 0; i < 100; i++) {
            HintSet hintSet = i % 2 == 0 ? HintSet.singleton("k" + i) : new HintSet(Collections.singleton("k" + i), parent);
            hintSets.add(hintSet);
            fetchers.add(new PlanFetcher(factory, "SELECT 1", hintSet));
        }
        try (ExplainWorkerPool pool = new ExplainWorkerPool(8)) {
            List<HintSet> results = pool.fetchAll(fetchers);
            Assert.assertEquals(hintSets.size(), results.size());
            for (int i = 0; i < results.size(); i++) {
                Assert.assertSame(hintSets.get(i), results.get(i));
                Assert.assertEquals(i % 2 == 0 ? "plan-1" : "plan-2", results.get(i).plan());
            }
        }
        Assert.assertEquals(100, factory.opened.get());
        Assert.assertEquals(100, factory.closed.get());
    }

    @Test
    public void explainFailureTest() {
        ConnectorFactory factory = new ConnectorFactory() {
            @Override
            public Set<String> knobs() {
                return Collections.emptySet();
            }

            @Override
            public Connector open() {
                return new Connector() {
                    @Override
                    public void setDisabledKnobs(Set<String> knobs) {
                    }

                    @Override
                    public String explain(String sql) throws ConnectorException {
                        throw new ConnectorException("connection reset");
                    }

                    @Override
                    public void close() {
                    }
                };
            }
        };
        try (ExplainWorkerPool pool = new ExplainWorkerPool(2)) {
            pool.fetchAll(Collections.singletonList(new PlanFetcher(factory, "SELECT 1", HintSet.singleton("a"))));
            Assert.fail();
        } catch (SpanSearchException e) {
            Assert.assertTrue(e.getCause() instanceof ConnectorException);
            Assert.assertEquals("connection reset", e.getCause().getMessage());
        }
    }

    @Test
    public void closeFailureIsNotFatalTest() {
        ConnectorFactory factory = new ConnectorFactory() {
            @Override
            public Set<String> knobs() {
                return Collections.emptySet();
            }

            @Override
            public Connector open() {
                return new Connector() {
                    @Override
                    public void setDisabledKnobs(Set<String> knobs) {
                    }

                    @Override
                    public String explain(String sql) {
                        return "plan";
                    }

                    @Override
                    public void close() throws IOException {
                        throw new IOException("already closed");
                    }
                };
            }
        };
        try (ExplainWorkerPool pool = new ExplainWorkerPool(1)) {
            HintSet hintSet = HintSet.singleton("a");
            pool.fetchAll(Collections.singletonList(new PlanFetcher(factory, "SELECT 1", hintSet)));
            Assert.assertEquals("plan", hintSet.plan());
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void illegalThreadsTest() {
        new ExplainWorkerPool(0);
    }
}
