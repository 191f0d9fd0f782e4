package com.example.boundedcache.core;

import com.example.boundedcache.eviction.EvictionPolicies;
import com.example.boundedcache.eviction.EvictionPolicy;
import com.example.boundedcache.memory.MemoryEstimator;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Key/value cache bounded by entry count and by the estimated memory its entries hold.
 *
 * <p>The entry map, the memory counter and the eviction policy change together under one write
 * lock; lookups share a read lock. An insert that cannot be satisfied leaves the cache untouched.
 * Expired entries read as absent and stay in memory until {@link #expireAll()} (run periodically
 * when a cleanup interval is configured) or an explicit {@link #remove} drops them.
 *
 * <p>Listener callbacks always run after the lock has been released. Call {@link #close()} to
 * stop the background sweeper.
 *
 * @param <V> the value type
 */
public class BoundedCache<V> implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BoundedCache.class);

    /** TTL argument selecting the configured default expiration. */
    public static final Duration DEFAULT_EXPIRATION = Duration.ZERO;

    /** TTL argument for entries that never expire. Any negative duration does the same. */
    public static final Duration NO_EXPIRATION = Duration.ofMillis(-1);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, CacheEntry<V>> store = new HashMap<>();
    private final EvictionPolicy evictionPolicy;
    private final MemoryEstimator memoryEstimator;
    private final Clock clock;
    private final long memoryLimit;
    private final int capacity;
    private final Duration defaultExpiration;
    private final ExpirationSweeper sweeper;

    private long memoryUsed;
    private EvictionListener<? super V> evictionListener;

    public BoundedCache(CacheOptions options) throws CacheConfigurationException {
        this(options, null);
    }

    /**
     * @param evictionPolicy policy to use instead of the one named by the options, must be empty
     */
    public BoundedCache(CacheOptions options, EvictionPolicy evictionPolicy) throws CacheConfigurationException {
        this(options, evictionPolicy, Collections.emptyMap());
    }

    /**
     * Builds the cache and stores {@code initialEntries} with the default expiration, in the map's
     * iteration order. Seeding goes through {@link #put}, so the limits apply to it: entries that
     * do not fit evict the earlier ones.
     *
     * @param evictionPolicy policy to use instead of the one named by the options, may be
     *     {@code null}; must be empty
     * @throws CacheConfigurationException if the options are invalid or an initial entry is larger
     *     than the memory limit
     */
    public BoundedCache(CacheOptions options, EvictionPolicy evictionPolicy, Map<String, ? extends V> initialEntries)
        throws CacheConfigurationException {
        Objects.requireNonNull(options, "options");
        Objects.requireNonNull(initialEntries, "initialEntries");
        options.validate();

        this.evictionPolicy = evictionPolicy != null
            ? evictionPolicy
            : EvictionPolicies.create(options.getEvictionPolicy());
        if (this.evictionPolicy.count() != 0) {
            throw new CacheConfigurationException("eviction policy must not track any key yet");
        }
        this.memoryEstimator = options.getMemoryEstimator();
        this.clock = options.getClock();
        this.memoryLimit = options.getMemoryLimit();
        this.capacity = options.getCapacity();
        this.defaultExpiration = options.getDefaultExpiration();

        for (Map.Entry<String, ? extends V> entry : initialEntries.entrySet()) {
            try {
                put(entry.getKey(), entry.getValue(), DEFAULT_EXPIRATION);
            } catch (EvictionExhaustedException e) {
                throw new CacheConfigurationException("initial entry " + entry.getKey() + " does not fit", e);
            }
        }

        if (options.getCleanupInterval().isZero()) {
            this.sweeper = null;
        } else {
            this.sweeper = new ExpirationSweeper(this, options.getCleanupInterval());
            this.sweeper.start();
        }
        log.info("Created cache with {} and {}, {} initial entries", options,
            this.evictionPolicy.getClass().getSimpleName(), store.size());
    }

    /**
     * Stores {@code value} under {@code key}, replacing any existing entry without notifying the
     * listener. Evicts in policy order first if the entry would break the capacity or memory
     * limit.
     *
     * @param ttl {@link #DEFAULT_EXPIRATION}, {@link #NO_EXPIRATION} or a positive time-to-live
     * @throws EvictionExhaustedException if the limits cannot be met; nothing is changed
     */
    public void put(String key, V value, Duration ttl) throws EvictionExhaustedException {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        long expiryTime = expiryTime(Objects.requireNonNull(ttl, "ttl"));
        long size = entrySize(key, value);

        List<Removal<V>> evicted;
        EvictionListener<? super V> listener;
        lock.writeLock().lock();
        try {
            evicted = insert(key, value, expiryTime, size);
            listener = evictionListener;
        } finally {
            lock.writeLock().unlock();
        }
        notifyListener(listener, evicted);
    }

    /** Stores with the configured default expiration. */
    public void setDefault(String key, V value) throws EvictionExhaustedException {
        put(key, value, DEFAULT_EXPIRATION);
    }

    /**
     * Like {@link #put}, but only if no live entry exists for {@code key}. An expired entry is
     * replaced.
     *
     * @throws KeyAlreadyExistsException if a live entry exists; it is left as it was
     */
    public void putIfAbsent(String key, V value, Duration ttl) throws KeyAlreadyExistsException, EvictionExhaustedException {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        long expiryTime = expiryTime(Objects.requireNonNull(ttl, "ttl"));
        long size = entrySize(key, value);

        List<Removal<V>> evicted;
        EvictionListener<? super V> listener;
        lock.writeLock().lock();
        try {
            if (liveEntry(key) != null) {
                throw new KeyAlreadyExistsException(key);
            }
            evicted = insert(key, value, expiryTime, size);
            listener = evictionListener;
        } finally {
            lock.writeLock().unlock();
        }
        notifyListener(listener, evicted);
    }

    /**
     * Replaces the value of a live entry. The key becomes the last eviction candidate, as if it
     * had just been inserted.
     *
     * @throws KeyNotFoundException if there is no live entry for {@code key}
     */
    public void replace(String key, V value, Duration ttl) throws KeyNotFoundException, EvictionExhaustedException {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        long expiryTime = expiryTime(Objects.requireNonNull(ttl, "ttl"));
        long size = entrySize(key, value);

        List<Removal<V>> evicted;
        EvictionListener<? super V> listener;
        lock.writeLock().lock();
        try {
            if (liveEntry(key) == null) {
                throw new KeyNotFoundException(key);
            }
            evicted = insert(key, value, expiryTime, size);
            listener = evictionListener;
        } finally {
            lock.writeLock().unlock();
        }
        notifyListener(listener, evicted);
    }

    /**
     * Removes the entry for {@code key}, expired or not, and notifies the listener.
     *
     * @return {@code false} if there was nothing to remove
     */
    public boolean remove(String key) {
        Objects.requireNonNull(key, "key");

        CacheEntry<V> removed;
        EvictionListener<? super V> listener;
        lock.writeLock().lock();
        try {
            removed = discard(key);
            listener = evictionListener;
        } finally {
            lock.writeLock().unlock();
        }
        if (removed == null) {
            return false;
        }
        notifyListener(listener, Collections.singletonList(new Removal<>(key, removed.value, RemovalCause.EXPLICIT)));
        return true;
    }

    /**
     * Removes every expired entry, then notifies the listener for each of them.
     *
     * @return the number of entries removed
     */
    public int expireAll() {
        List<Removal<V>> expired = new ArrayList<>();
        EvictionListener<? super V> listener;
        lock.writeLock().lock();
        try {
            long now = clock.millis();
            Iterator<Map.Entry<String, CacheEntry<V>>> it = store.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<String, CacheEntry<V>> e = it.next();
                CacheEntry<V> entry = e.getValue();
                if (entry.isExpired(now)) {
                    it.remove();
                    memoryUsed -= entry.size;
                    evictionPolicy.untrack(e.getKey());
                    expired.add(new Removal<>(e.getKey(), entry.value, RemovalCause.EXPIRED));
                }
            }
            listener = evictionListener;
        } finally {
            lock.writeLock().unlock();
        }
        notifyListener(listener, expired);
        return expired.size();
    }

    /** Returns the value of a live entry. Expired entries read as absent but are kept. */
    public Optional<V> get(String key) {
        Objects.requireNonNull(key, "key");
        lock.readLock().lock();
        try {
            CacheEntry<V> entry = liveEntry(key);
            return entry == null ? Optional.empty() : Optional.of(entry.value);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Like {@link #get}, with the instant the entry expires at. */
    public Optional<TimedValue<V>> getWithExpiration(String key) {
        Objects.requireNonNull(key, "key");
        lock.readLock().lock();
        try {
            CacheEntry<V> entry = liveEntry(key);
            if (entry == null) {
                return Optional.empty();
            }
            Instant expiration = entry.expiryTime == CacheEntry.NEVER ? null : Instant.ofEpochMilli(entry.expiryTime);
            return Optional.of(new TimedValue<>(entry.value, expiration));
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Drops every entry, the memory count and the eviction order at once. No notifications. */
    public void clear() {
        lock.writeLock().lock();
        try {
            store.clear();
            memoryUsed = 0;
            evictionPolicy.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Number of stored entries, expired ones not yet removed included. */
    public int size() {
        lock.readLock().lock();
        try {
            return store.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Estimated bytes held by the stored entries. */
    public long memoryUsed() {
        lock.readLock().lock();
        try {
            return memoryUsed;
        } finally {
            lock.readLock().unlock();
        }
    }

    public long memoryLimit() {
        return memoryLimit;
    }

    public int capacity() {
        return capacity;
    }

    public Duration defaultExpiration() {
        return defaultExpiration;
    }

    /** Sets the removal listener, {@code null} to stop notifications. */
    public void setEvictionListener(EvictionListener<? super V> listener) {
        lock.writeLock().lock();
        try {
            this.evictionListener = listener;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Stops the expiration sweeper, if any. The cache stays usable. */
    @Override
    public void close() {
        if (sweeper != null) {
            sweeper.close();
        }
    }

    /** Whether a background sweeper is configured and not yet closed. */
    public boolean isSweeperRunning() {
        return sweeper != null && sweeper.isRunning();
    }

    private long expiryTime(Duration ttl) {
        Duration effective = ttl.isZero() ? defaultExpiration : ttl;
        if (effective.isZero() || effective.isNegative()) {
            return CacheEntry.NEVER;
        }
        try {
            return Math.addExact(clock.millis(), effective.toMillis());
        } catch (ArithmeticException e) {
            // beyond the representable instant: saturate
            return Long.MAX_VALUE;
        }
    }

    private long entrySize(String key, V value) {
        return memoryEstimator.estimate(key) + memoryEstimator.estimate(value) + MemoryEstimator.REFERENCE_SIZE;
    }

    // Lock must be held.
    private CacheEntry<V> liveEntry(String key) {
        CacheEntry<V> entry = store.get(key);
        if (entry == null || entry.isExpired(clock.millis())) {
            return null;
        }
        return entry;
    }

    // Write lock must be held.
    private List<Removal<V>> insert(String key, V value, long expiryTime, long size) throws EvictionExhaustedException {
        CacheEntry<V> previous = store.get(key);
        Map<String, RemovalCause> victims = planEviction(key, previous, size);

        // overwritten entries are not reported
        discard(key);

        List<Removal<V>> evicted = new ArrayList<>(victims.size());
        for (Map.Entry<String, RemovalCause> victim : victims.entrySet()) {
            CacheEntry<V> entry = discard(victim.getKey());
            evicted.add(new Removal<>(victim.getKey(), entry.value, victim.getValue()));
            log.debug("Evicted {} ({}) to make room for {}", victim.getKey(), victim.getValue(), key);
        }

        store.put(key, new CacheEntry<>(value, expiryTime, size));
        memoryUsed += size;
        if (!evictionPolicy.track(key)) {
            throw new IllegalStateException("Eviction policy refused key " + key + " after room was made");
        }
        return evicted;
    }

    /**
     * Picks the victims an insert needs without touching any state, so a failure leaves the cache
     * exactly as it was. The key being overwritten is never picked.
     */
    private Map<String, RemovalCause> planEviction(String key, CacheEntry<V> previous, long size) throws EvictionExhaustedException {
        Map<String, RemovalCause> victims = new LinkedHashMap<>();
        int entries = store.size();
        long freeSlots = evictionPolicy.remainingCapacity();
        long projected = memoryUsed + size;
        if (previous != null) {
            entries--;
            freeSlots++;
            projected -= previous.size;
        }

        if ((capacity > 0 && entries >= capacity) || freeSlots <= 0) {
            String victim = evictionPolicy.peekVictim();
            if (victim.equals(key)) {
                victim = nextCandidate(evictionPolicy.evictionOrder(), key, victims);
                if (victim == null) {
                    throw new EvictionExhaustedException("no eviction candidate left to make room for " + key);
                }
            }
            victims.put(victim, RemovalCause.CAPACITY);
            projected -= trackedEntry(victim).size;
        }

        Iterator<String> candidates = null;
        while (projected > memoryLimit) {
            if (candidates == null) {
                candidates = evictionPolicy.evictionOrder();
            }
            String victim = nextCandidate(candidates, key, victims);
            if (victim == null) {
                throw new EvictionExhaustedException("cannot free " + (projected - memoryLimit)
                    + " bytes for " + key + " (" + size + " bytes): no eviction candidate left");
            }
            victims.put(victim, RemovalCause.MEMORY);
            projected -= trackedEntry(victim).size;
        }
        return victims;
    }

    private static String nextCandidate(Iterator<String> candidates, String key, Map<String, RemovalCause> planned) {
        while (candidates.hasNext()) {
            String candidate = candidates.next();
            if (!candidate.equals(key) && !planned.containsKey(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    private CacheEntry<V> trackedEntry(String key) {
        CacheEntry<V> entry = store.get(key);
        if (entry == null) {
            throw new IllegalStateException("Eviction policy tracks " + key + " which is not stored");
        }
        return entry;
    }

    // Write lock must be held.
    private CacheEntry<V> discard(String key) {
        CacheEntry<V> entry = store.remove(key);
        if (entry != null) {
            memoryUsed -= entry.size;
            evictionPolicy.untrack(key);
        }
        return entry;
    }

    // Lock must not be held.
    private void notifyListener(EvictionListener<? super V> listener, List<Removal<V>> removals) {
        if (listener == null || removals.isEmpty()) {
            return;
        }
        for (Removal<V> removal : removals) {
            try {
                listener.onEviction(removal.key, removal.value, removal.cause);
            } catch (RuntimeException e) {
                log.warn("Eviction listener failed for {} ({})", removal.key, removal.cause, e);
            }
        }
    }

    private static class Removal<V> {
        final String key;
        final V value;
        final RemovalCause cause;

        Removal(String key, V value, RemovalCause cause) {
            this.key = key;
            this.value = value;
            this.cause = cause;
        }
    }
}
