package me.golemcore.orchestrator.domain.model;

/**
 * Result of a fallback-executor invocation. Always populated: on total failure
 * {@code provider} is {@link AiProvider#FALLBACK} and {@code text} carries an
 * apology message.
 *
 * @since 1.0
 */
public record InvocationResult(
        String text,
        AiProvider provider,
        CommandCategory category,
        double confidence,
        long latencyMs,
        boolean success) {

    public boolean isFallback() {
        return provider == AiProvider.FALLBACK;
    }
}
