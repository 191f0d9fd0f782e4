package com.example.boundedcache.core;

public class CacheEntry<V> {

    /** {@link #expiryTime} of an entry that never expires. */
    public static final long NEVER = 0L;

    public final V value;
    public final long expiryTime; // absolute timestamp in millis, NEVER if it doesn't expire
    public final long size;       // estimated bytes: key + value + one reference

    public CacheEntry(V value, long expiryTime, long size) {
        this.value = value;
        this.expiryTime = expiryTime;
        this.size = size;
    }

    public boolean isExpired(long nowMillis) {
        return expiryTime != NEVER && nowMillis > expiryTime;
    }
}
