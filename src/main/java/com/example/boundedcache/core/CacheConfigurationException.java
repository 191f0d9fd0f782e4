package com.example.boundedcache.core;

/** Invalid options handed to the cache at construction. */
public class CacheConfigurationException extends CacheException {

    public CacheConfigurationException(String message) {
        super(message);
    }

    public CacheConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
