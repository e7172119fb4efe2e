package com.exitbot.assistant.cache;

import com.exitbot.assistant.model.LlmResponse;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable cached value. Replacing a key always installs a new entry.
 *
 * @param sequence insertion order, used for oldest-first eviction
 */
record CacheEntry(String key, LlmResponse response, Instant createdAt, Duration ttl, long sequence) {

    boolean isExpired(Instant now) {
        return !now.isBefore(createdAt.plus(ttl));
    }
}
