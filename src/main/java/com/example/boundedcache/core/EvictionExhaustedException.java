package com.example.boundedcache.core;

/**
 * Thrown when a limit can only be honoured by evicting, and the eviction policy has no candidate
 * left.
 */
public class EvictionExhaustedException extends CacheException {

    public EvictionExhaustedException(String message) {
        super(message);
    }
}
