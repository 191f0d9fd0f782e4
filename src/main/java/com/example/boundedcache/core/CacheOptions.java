package com.example.boundedcache.core;

import com.example.boundedcache.memory.MemoryEstimator;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Settings a {@link BoundedCache} is built from. Validated when the cache is constructed.
 */
public class CacheOptions {

    private final long memoryLimit;
    private final int capacity;
    private final Duration cleanupInterval;
    private final Duration defaultExpiration;
    private final String evictionPolicy;
    private final Clock clock;
    private final MemoryEstimator memoryEstimator;

    private CacheOptions(Builder builder) {
        this.memoryLimit = builder.memoryLimit;
        this.capacity = builder.capacity;
        this.cleanupInterval = builder.cleanupInterval;
        this.defaultExpiration = builder.defaultExpiration;
        this.evictionPolicy = builder.evictionPolicy;
        this.clock = builder.clock;
        this.memoryEstimator = builder.memoryEstimator;
    }

    public static Builder builder() {
        return new Builder();
    }

    void validate() throws CacheConfigurationException {
        if (memoryLimit <= 0) {
            throw new CacheConfigurationException("memory limit is required");
        }
        if (capacity < 0) {
            throw new CacheConfigurationException("capacity must not be negative: " + capacity);
        }
        if (cleanupInterval.isNegative()) {
            throw new CacheConfigurationException("cleanup interval must not be negative: " + cleanupInterval);
        }
    }

    /** Upper bound of the estimated bytes held, required. */
    public long getMemoryLimit() {
        return memoryLimit;
    }

    /** Maximum number of entries, {@code 0} for no limit. */
    public int getCapacity() {
        return capacity;
    }

    /** Period of the expiration sweeper, zero to disable it. */
    public Duration getCleanupInterval() {
        return cleanupInterval;
    }

    /** Time-to-live of entries inserted with {@link BoundedCache#DEFAULT_EXPIRATION}. */
    public Duration getDefaultExpiration() {
        return defaultExpiration;
    }

    public String getEvictionPolicy() {
        return evictionPolicy;
    }

    public Clock getClock() {
        return clock;
    }

    public MemoryEstimator getMemoryEstimator() {
        return memoryEstimator;
    }

    @Override
    public String toString() {
        return "CacheOptions{memoryLimit=" + memoryLimit
            + ", capacity=" + capacity
            + ", cleanupInterval=" + cleanupInterval
            + ", defaultExpiration=" + defaultExpiration
            + ", evictionPolicy='" + evictionPolicy + '\''
            + '}';
    }

    public static class Builder {

        private long memoryLimit;
        private int capacity;
        private Duration cleanupInterval = Duration.ZERO;
        private Duration defaultExpiration = Duration.ZERO;
        private String evictionPolicy;
        private Clock clock = Clock.systemUTC();
        private MemoryEstimator memoryEstimator = MemoryEstimator.standard();

        private Builder() {
        }

        public Builder memoryLimit(long bytes) {
            this.memoryLimit = bytes;
            return this;
        }

        public Builder capacity(int capacity) {
            this.capacity = capacity;
            return this;
        }

        public Builder cleanupInterval(Duration cleanupInterval) {
            this.cleanupInterval = Objects.requireNonNull(cleanupInterval, "cleanupInterval");
            return this;
        }

        public Builder defaultExpiration(Duration defaultExpiration) {
            this.defaultExpiration = Objects.requireNonNull(defaultExpiration, "defaultExpiration");
            return this;
        }

        public Builder evictionPolicy(String kind) {
            this.evictionPolicy = kind;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Builder memoryEstimator(MemoryEstimator memoryEstimator) {
            this.memoryEstimator = Objects.requireNonNull(memoryEstimator, "memoryEstimator");
            return this;
        }

        public CacheOptions build() {
            return new CacheOptions(this);
        }
    }
}
