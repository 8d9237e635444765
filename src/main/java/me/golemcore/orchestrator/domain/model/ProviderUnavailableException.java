package me.golemcore.orchestrator.domain.model;

/**
 * The requested provider has no usable configuration or credentials. Only used
 * internally to prune routing candidates.
 */
public class ProviderUnavailableException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final AiProvider provider;

    public ProviderUnavailableException(AiProvider provider) {
        super("Provider not available: " + provider.getId());
        this.provider = provider;
    }

    public AiProvider getProvider() {
        return provider;
    }
}
