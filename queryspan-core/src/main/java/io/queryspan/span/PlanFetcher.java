package io.queryspan.span;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;

import io.queryspan.connector.Connector;
import io.queryspan.connector.ConnectorException;
import io.queryspan.connector.ConnectorFactory;
import io.queryspan.util.Try;

/**
 * Fetches the plan of one hint-set on a fresh connector and stores it on that hint-set.
 */
public class PlanFetcher implements Callable<HintSet> {
    private static final Logger logger = LoggerFactory.getLogger(PlanFetcher.class);

    private final ConnectorFactory connectorFactory;
    private final String sql;
    private final HintSet hintSet;

    public PlanFetcher(ConnectorFactory connectorFactory, String sql, HintSet hintSet) {
        this.connectorFactory = connectorFactory;
        this.sql = sql;
        this.hintSet = hintSet;
    }

    @Override
    public HintSet call() throws ConnectorException {
        Connector connector = connectorFactory.open();
        try {
            connector.setDisabledKnobs(hintSet.resolvedKnobs());
            hintSet.setPlan(connector.explain(sql));
        } finally {
            Try.on(connector::close, logger, "Close connector failed");
        }
        logger.trace("Fetched plan of [{}]", hintSet);
        return hintSet;
    }
}
