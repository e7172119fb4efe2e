package com.exitbot.assistant.cache;

/**
 * @param hits         lookups served from a live entry, including callers that waited on an in-flight computation
 * @param misses       lookups that ran the computation
 * @param evictions    entries dropped to stay within capacity
 * @param expirations  entries dropped because their TTL had passed
 */
public record CacheStats(String provider, long hits, long misses, long evictions, long expirations, int size) {

    public double hitRate() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }
}
