package me.golemcore.orchestrator.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * Provider response stored in a response cache together with the time it was
 * produced, so readers can apply their own TTL.
 */
public record CachedResponse(String text, String model, Instant cachedAt) {

    public boolean isFresh(Instant now, Duration ttl) {
        return cachedAt != null && cachedAt.plus(ttl).isAfter(now);
    }
}
