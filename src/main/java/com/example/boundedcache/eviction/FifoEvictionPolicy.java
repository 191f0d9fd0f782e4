package com.example.boundedcache.eviction;

import com.example.boundedcache.core.EvictionExhaustedException;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.concurrent.locks.ReentrantLock;

/**
 * First in, first out: the oldest tracked key is always the next victim. Reads don't change the
 * order; re-tracking a key after untracking it moves it to the tail.
 *
 * <p>Single operations are guarded by an internal lock. {@link #evictionOrder()} is a live view
 * and is not: iterating it while another thread tracks or untracks keys fails with
 * {@link java.util.ConcurrentModificationException}. {@code BoundedCache} only iterates under its
 * write lock, which also covers every mutation; standalone callers need the same exclusion.
 */
public class FifoEvictionPolicy implements EvictionPolicy {

    private final ReentrantLock lock = new ReentrantLock();

    // insertion order, oldest first
    private final LinkedHashSet<String> order = new LinkedHashSet<>();

    private final int bound;

    public FifoEvictionPolicy() {
        this(0);
    }

    /**
     * @param bound maximum number of tracked keys, {@code 0} for no bound
     */
    public FifoEvictionPolicy(int bound) {
        if (bound < 0) {
            throw new IllegalArgumentException("bound must not be negative: " + bound);
        }
        this.bound = bound;
    }

    @Override
    public boolean track(String key) {
        lock.lock();
        try {
            if (order.contains(key)) {
                return true;
            }
            if (bound != 0 && order.size() >= bound) {
                return false;
            }
            order.add(key);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void untrack(String key) {
        lock.lock();
        try {
            order.remove(key);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String peekVictim() throws EvictionExhaustedException {
        lock.lock();
        try {
            if (order.isEmpty()) {
                throw new EvictionExhaustedException("eviction queue is empty");
            }
            return order.iterator().next();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int count() {
        lock.lock();
        try {
            return order.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Live, read-only view in victim order, without copying. Not guarded by this policy's lock.
     */
    @Override
    public Iterator<String> evictionOrder() {
        return Collections.unmodifiableSet(order).iterator();
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            order.clear();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int remainingCapacity() {
        if (bound == 0) {
            return Integer.MAX_VALUE;
        }
        lock.lock();
        try {
            return Math.max(0, bound - order.size());
        } finally {
            lock.unlock();
        }
    }

    public int bound() {
        return bound;
    }
}
