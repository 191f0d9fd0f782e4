package com.example.boundedcache.core;

public class KeyNotFoundException extends CacheException {

    private final String key;

    public KeyNotFoundException(String key) {
        super("Item " + key + " doesn't exist");
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
