package com.example.boundedcache.config;

import com.example.boundedcache.core.CacheOptions;
import com.example.boundedcache.eviction.EvictionPolicies;
import com.example.boundedcache.memory.MemoryEstimator;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

/**
 * Externalized settings of the auto-configured cache, bound from {@code bounded-cache.*}.
 */
@ConfigurationProperties(prefix = "bounded-cache")
public class CacheProperties {

    /** Whether to register the cache bean at all. */
    private boolean enabled = true;

    /** Upper bound of the estimated memory held by entries. Required. */
    private DataSize memoryLimit;

    /** Maximum number of entries, 0 for no limit. */
    private int capacity;

    /** Period of the expired-entry sweeper, 0 to disable it. */
    private Duration cleanupInterval = Duration.ZERO;

    /** Time-to-live of entries stored with the default expiration, 0 for none. */
    private Duration defaultExpiration = Duration.ZERO;

    /** Eviction policy kind. */
    private String evictionPolicy = EvictionPolicies.FIFO;

    public CacheOptions toOptions(MemoryEstimator memoryEstimator) {
        return CacheOptions.builder()
            .memoryLimit(memoryLimit == null ? 0 : memoryLimit.toBytes())
            .capacity(capacity)
            .cleanupInterval(cleanupInterval)
            .defaultExpiration(defaultExpiration)
            .evictionPolicy(evictionPolicy)
            .memoryEstimator(memoryEstimator)
            .build();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public DataSize getMemoryLimit() {
        return memoryLimit;
    }

    public void setMemoryLimit(DataSize memoryLimit) {
        this.memoryLimit = memoryLimit;
    }

    public int getCapacity() {
        return capacity;
    }

    public void setCapacity(int capacity) {
        this.capacity = capacity;
    }

    public Duration getCleanupInterval() {
        return cleanupInterval;
    }

    public void setCleanupInterval(Duration cleanupInterval) {
        this.cleanupInterval = cleanupInterval;
    }

    public Duration getDefaultExpiration() {
        return defaultExpiration;
    }

    public void setDefaultExpiration(Duration defaultExpiration) {
        this.defaultExpiration = defaultExpiration;
    }

    public String getEvictionPolicy() {
        return evictionPolicy;
    }

    public void setEvictionPolicy(String evictionPolicy) {
        this.evictionPolicy = evictionPolicy;
    }
}
