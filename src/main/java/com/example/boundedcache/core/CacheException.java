package com.example.boundedcache.core;

/**
 * Base of the failures the cache reports to its callers. None of them leave the cache in a
 * partially modified state.
 */
public class CacheException extends Exception {

    public CacheException(String message) {
        super(message);
    }

    public CacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
