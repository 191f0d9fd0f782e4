package com.example.boundedcache.core;

import java.time.Instant;
import java.util.Optional;

/**
 * A cached value together with the instant it expires at.
 */
public class TimedValue<V> {

    private final V value;
    private final Instant expiration;

    TimedValue(V value, Instant expiration) {
        this.value = value;
        this.expiration = expiration;
    }

    public V value() {
        return value;
    }

    /** Empty if the entry never expires. */
    public Optional<Instant> expiration() {
        return Optional.ofNullable(expiration);
    }

    @Override
    public String toString() {
        return "TimedValue{value=" + value + ", expiration=" + expiration + '}';
    }
}
