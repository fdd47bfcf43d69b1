package io.queryspan.connector;

import java.util.Set;

public interface ConnectorFactory {
    /**
     * All knobs of the optimizer which can be disabled.
     */
    Set<String> knobs() throws ConnectorException;

    /**
     * Open a new, independent session.
     */
    Connector open() throws ConnectorException;
}
