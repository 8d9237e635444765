package me.golemcore.orchestrator.cache;

/**
 * Point-in-time statistics of a {@link BoundedResponseCache}.
 */
public record CacheStats(String name, int size, int maxSize, double usage, long hits, long misses, long evictions) {
}
