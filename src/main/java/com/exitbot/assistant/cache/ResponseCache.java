package com.exitbot.assistant.cache;

import com.exitbot.assistant.exception.ErrorKind;
import com.exitbot.assistant.exception.LlmException;
import com.exitbot.assistant.model.LlmResponse;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-process response cache with per-key single-flight computation.
 *
 * Lookup flow:
 * 1. live entry present        -> return it, no locking
 * 2. miss                      -> take (or create) the per-key lock
 * 3. re-check under the lock   -> another caller may have filled it while we waited
 * 4. still missing             -> compute, store, release, return
 *
 * At most one computation per key runs at a time and every waiter sees the value it produced.
 * Failures are not cached; the lock is released so the next waiter computes on its own.
 *
 * Per-key locks are reference counted and dropped from the lock table as soon as nobody
 * holds or waits on them, so the table only grows with the number of keys currently in flight.
 */
@Slf4j
public class ResponseCache {

    private final String name;
    private final boolean enabled;
    private final Duration ttl;
    private final int maxEntries;
    private final Clock clock;

    private final ConcurrentHashMap<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, KeyLock> locks = new ConcurrentHashMap<>();
    private final Object evictionMonitor = new Object();

    private final AtomicLong sequence = new AtomicLong();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();
    private final AtomicLong expirations = new AtomicLong();

    public ResponseCache(String name, boolean enabled, Duration ttl, int maxEntries, Clock clock) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be >= 1");
        }
        this.name = name;
        this.enabled = enabled;
        this.ttl = ttl;
        this.maxEntries = maxEntries;
        this.clock = clock;
    }

    public LlmResponse getOrCompute(String key, Supplier<LlmResponse> compute) {
        if (!enabled) {
            return compute.get();
        }

        CacheEntry hit = liveEntry(key);
        if (hit != null) {
            hits.incrementAndGet();
            log.debug("[{}] Cache hit (key: {}...)", name, shortKey(key));
            return hit.response();
        }

        KeyLock keyLock = retainLock(key);
        try {
            lockInterruptibly(key, keyLock);
            try {
                CacheEntry filled = liveEntry(key);
                if (filled != null) {
                    hits.incrementAndGet();
                    log.debug("[{}] Cache hit after acquiring lock (key: {}...)", name, shortKey(key));
                    return filled.response();
                }

                misses.incrementAndGet();
                log.debug("[{}] Cache miss, computing (key: {}...)", name, shortKey(key));
                LlmResponse value = compute.get();
                if (value != null) {
                    store(key, value);
                }
                return value;
            } finally {
                keyLock.lock.unlock();
            }
        } finally {
            releaseLock(key, keyLock);
        }
    }

    private void lockInterruptibly(String key, KeyLock keyLock) {
        try {
            keyLock.lock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmException(ErrorKind.UNKNOWN, name,
                    "Interrupted while waiting for in-flight computation (key: " + shortKey(key) + "...)", e);
        }
    }

    private CacheEntry liveEntry(String key) {
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            return null;
        }
        if (entry.isExpired(clock.instant())) {
            if (entries.remove(key, entry)) {
                expirations.incrementAndGet();
                log.debug("[{}] Cache entry expired (key: {}...)", name, shortKey(key));
            }
            return null;
        }
        return entry;
    }

    private void store(String key, LlmResponse value) {
        entries.put(key, new CacheEntry(key, value, clock.instant(), ttl, sequence.incrementAndGet()));
        evictIfNeeded();
    }

    private void evictIfNeeded() {
        if (entries.size() <= maxEntries) {
            return;
        }
        synchronized (evictionMonitor) {
            while (entries.size() > maxEntries) {
                CacheEntry oldest = entries.values().stream()
                        .min(Comparator.comparingLong(CacheEntry::sequence))
                        .orElse(null);
                if (oldest == null) {
                    return;
                }
                if (entries.remove(oldest.key(), oldest)) {
                    evictions.incrementAndGet();
                    log.debug("[{}] Cache limit ({}) exceeded, evicted key {}...",
                            name, maxEntries, shortKey(oldest.key()));
                }
            }
        }
    }

    private KeyLock retainLock(String key) {
        return locks.compute(key, (k, existing) -> {
            KeyLock lock = existing != null ? existing : new KeyLock();
            lock.references++;
            return lock;
        });
    }

    private void releaseLock(String key, KeyLock keyLock) {
        locks.computeIfPresent(key, (k, existing) -> {
            if (existing != keyLock) {
                return existing;
            }
            return --existing.references == 0 ? null : existing;
        });
    }

    public void clear() {
        int size = entries.size();
        entries.clear();
        log.info("[{}] Cache cleared ({} entries)", name, size);
    }

    public int size() {
        return entries.size();
    }

    /** Number of keys that currently have a caller computing or waiting. */
    public int lockTableSize() {
        return locks.size();
    }

    public CacheStats stats() {
        return new CacheStats(name, hits.get(), misses.get(), evictions.get(), expirations.get(), entries.size());
    }

    public boolean isEnabled() {
        return enabled;
    }

    boolean containsKey(String key) {
        return entries.containsKey(key);
    }

    private static String shortKey(String key) {
        return key.length() > 8 ? key.substring(0, 8) : key;
    }

    /** Guarded by the lock table's per-key compute; never touched outside it. */
    private static final class KeyLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int references;
    }
}
