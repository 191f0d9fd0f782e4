package com.example.boundedcache.eviction;

import com.example.boundedcache.core.EvictionExhaustedException;
import java.util.Iterator;

/**
 * Decides which key leaves the cache next when a capacity or memory limit is hit.
 *
 * <p>The cache keeps the tracked key set identical to its own key set: every stored key is
 * tracked exactly once and nothing else is. Implementations other than FIFO (LRU, LFU, ...) only
 * need to honour this contract to be plugged into the cache.
 */
public interface EvictionPolicy {

    /**
     * Registers a newly stored key as the least likely next victim.
     *
     * @return {@code false} if the policy is bounded and already full
     */
    boolean track(String key);

    /** Forgets a key. No-op if it is not tracked. */
    void untrack(String key);

    /**
     * Returns the next eviction candidate without removing it.
     *
     * @throws EvictionExhaustedException if no key is tracked
     */
    String peekVictim() throws EvictionExhaustedException;

    int count();

    /**
     * Read-only view of the tracked keys in the order they would be picked as victims. Callers
     * must not mutate the policy while iterating.
     */
    Iterator<String> evictionOrder();

    void clear();

    /** How many more keys {@link #track} accepts. */
    default int remainingCapacity() {
        return Integer.MAX_VALUE;
    }
}
