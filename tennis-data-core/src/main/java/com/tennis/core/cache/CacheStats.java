package com.tennis.core.cache;

public record CacheStats(int size, long hits, long misses, long ttlSeconds) {
}
