package io.queryspan.connector;

import java.io.Closeable;
import java.util.Set;

/**
 * A session against one optimizer. Each instance is configured once and used for a single
 * explain, it is never shared between threads.
 */
public interface Connector extends Closeable {
    /**
     * The plan returned by {@link #explain(String)} when the optimizer could not produce a plan
     * under the current configuration.
     */
    String FAILED = "FAILED";

    /**
     * Disable the given knobs for this session. Calling it again with the same knobs has no further effect.
     */
    void setDisabledKnobs(Set<String> knobs) throws ConnectorException;

    /**
     * Explain the query without executing it.
     *
     * @return the plan text, or {@link #FAILED} if the optimizer failed to plan the query.
     * @throws ConnectorException only on transport or connection faults.
     */
    String explain(String sql) throws ConnectorException;
}
