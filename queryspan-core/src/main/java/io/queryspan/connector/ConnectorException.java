package io.queryspan.connector;

/**
 * A connection or transport level fault. Optimizer failures are not reported by this exception,
 * see {@link Connector#FAILED}.
 */
public class ConnectorException extends Exception {
    public ConnectorException(String message) {
        super(message);
    }

    public ConnectorException(String message, Throwable cause) {
        super(message, cause);
    }
}
