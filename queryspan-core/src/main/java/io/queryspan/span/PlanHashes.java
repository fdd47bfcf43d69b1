package io.queryspan.span;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;

import io.queryspan.connector.Connector;

/**
 * Plans are only ever compared by hash. Two different plans with colliding hashes are treated
 * as the same plan, this is a known limitation and is not detected.
 */
public final class PlanHashes {
    private static final HashFunction HASH_FUNCTION = Hashing.murmur3_128();

    public static final long FAILED_HASH = hash(Connector.FAILED);

    private PlanHashes() {
    }

    public static long hash(String plan) {
        return HASH_FUNCTION.hashString(plan, StandardCharsets.UTF_8).asLong();
    }
}
