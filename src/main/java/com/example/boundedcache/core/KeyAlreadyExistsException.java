package com.example.boundedcache.core;

public class KeyAlreadyExistsException extends CacheException {

    private final String key;

    public KeyAlreadyExistsException(String key) {
        super("Item " + key + " already exists");
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
