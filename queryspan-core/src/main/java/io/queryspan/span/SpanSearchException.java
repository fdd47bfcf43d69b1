package io.queryspan.span;

/**
 * A fatal failure during the span search of a query, e.g. the connector can not be opened.
 * The search is aborted and nothing of it is kept.
 */
public class SpanSearchException extends RuntimeException {
    public SpanSearchException(String message) {
        super(message);
    }

    public SpanSearchException(String message, Throwable cause) {
        super(message, cause);
    }
}
