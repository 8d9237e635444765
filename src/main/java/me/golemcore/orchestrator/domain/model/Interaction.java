package me.golemcore.orchestrator.domain.model;

import java.time.Instant;

/**
 * Immutable record of one invocation chain: the provider initially chosen, the
 * provider that actually produced the returned text, timing and confidence.
 *
 * @since 1.0
 */
public record Interaction(
        String id,
        Instant timestamp,
        String input,
        String output,
        CommandCategory category,
        AiProvider primaryProvider,
        AiProvider actualProvider,
        long latencyMs,
        double confidence,
        boolean success) {
}
