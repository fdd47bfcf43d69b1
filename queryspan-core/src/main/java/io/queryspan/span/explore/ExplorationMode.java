package io.queryspan.span.explore;

import java.util.Locale;

public enum ExplorationMode {
    /** No exploration, only the singleton round. */
    NONE,
    /** Refine each effective hint-set on its own, building a dependency tree. */
    ITERATIVE,
    /** Refine the union of all effective knobs, one round per interaction depth. */
    BATCH;

    public static ExplorationMode parse(String name) {
        if (name == null) {
            throw new IllegalArgumentException("exploration mode should not be null");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ENGLISH));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(String.format("Illegal exploration mode [%s], expected one of none, iterative, batch", name));
        }
    }
}
