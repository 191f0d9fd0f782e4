package com.example.boundedcache.core;

/**
 * Notified when an entry leaves the cache for any reason other than being overwritten or
 * cleared. Always called after the cache has released its lock, so implementations may call
 * back into the cache.
 */
@FunctionalInterface
public interface EvictionListener<V> {

    void onEviction(String key, V value, RemovalCause cause);
}
