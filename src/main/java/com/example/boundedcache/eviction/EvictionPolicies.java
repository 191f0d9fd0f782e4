package com.example.boundedcache.eviction;

import com.example.boundedcache.core.CacheConfigurationException;
import java.util.Locale;

public final class EvictionPolicies {

    public static final String FIFO = "fifo";

    // kept for configurations written against the queue-based naming
    public static final String QUEUE = "queue";

    private EvictionPolicies() {
    }

    /**
     * Builds the policy selected by {@code kind}. A missing or blank kind selects FIFO.
     *
     * @throws CacheConfigurationException for an unknown kind
     */
    public static EvictionPolicy create(String kind) throws CacheConfigurationException {
        if (kind == null || kind.isBlank()) {
            return new FifoEvictionPolicy();
        }
        switch (kind.trim().toLowerCase(Locale.ROOT)) {
            case FIFO:
            case QUEUE:
                return new FifoEvictionPolicy();
            default:
                throw new CacheConfigurationException("unsupported eviction policy: " + kind);
        }
    }
}
