package com.example.boundedcache.core;

public enum RemovalCause {
    /** {@link BoundedCache#remove} was called. */
    EXPLICIT,
    /** The entry's time-to-live passed and a sweep removed it. */
    EXPIRED,
    /** Evicted to stay within the item count limit. */
    CAPACITY,
    /** Evicted to stay within the memory limit. */
    MEMORY
}
