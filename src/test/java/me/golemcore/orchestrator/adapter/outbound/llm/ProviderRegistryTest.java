package me.golemcore.orchestrator.adapter.outbound.llm;

import me.golemcore.orchestrator.domain.model.AiProvider;
import me.golemcore.orchestrator.domain.model.GenerationRequest;
import me.golemcore.orchestrator.domain.model.ProviderUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ProviderRegistryTest {

    private GenerationProviderAdapter openAi;
    private GenerationProviderAdapter anthropic;
    private GenerationProviderAdapter perplexity;
    private ProviderRegistry registry;

    @BeforeEach
    void setUp() {
        openAi = adapter(AiProvider.OPENAI, true);
        anthropic = adapter(AiProvider.ANTHROPIC, false);
        perplexity = adapter(AiProvider.PERPLEXITY, true);
        registry = new ProviderRegistry(List.of(openAi, anthropic, perplexity));
        registry.init();
    }

    @Test
    void shouldExposeOnlyConfiguredProvidersAsReachable() {
        assertEquals(Set.of(AiProvider.OPENAI, AiProvider.PERPLEXITY), registry.getReachableProviders());
        assertTrue(registry.isReachable(AiProvider.OPENAI));
        assertFalse(registry.isReachable(AiProvider.ANTHROPIC));
        assertFalse(registry.isReachable(AiProvider.ELEVENLABS));
        assertFalse(registry.isReachable(null));
    }

    @Test
    void shouldPickUpConfigurationChangesOnRefresh() {
        when(anthropic.isAvailable()).thenReturn(true);
        when(openAi.isAvailable()).thenThrow(new IllegalStateException("probe failed"));

        Set<AiProvider> reachable = registry.refreshAvailability();

        assertEquals(Set.of(AiProvider.ANTHROPIC, AiProvider.PERPLEXITY), reachable);
    }

    @Test
    void shouldDelegateGenerationToAdapter() throws Exception {
        GenerationRequest request = GenerationRequest.of("Oi", null);
        when(openAi.generate(request)).thenReturn(CompletableFuture.completedFuture("Olá"));

        assertEquals("Olá", registry.generate(AiProvider.OPENAI, request).get());
    }

    @Test
    void shouldFailForUnreachableProvider() {
        CompletableFuture<String> future = registry.generate(AiProvider.ANTHROPIC, GenerationRequest.of("Oi", null));

        ExecutionException ex = assertThrows(ExecutionException.class, future::get);
        assertInstanceOf(ProviderUnavailableException.class, ex.getCause());
        verify(anthropic, never()).generate(any());
    }

    @Test
    void shouldFailForProviderWithoutAdapter() {
        CompletableFuture<String> future = registry.generate(AiProvider.ELEVENLABS, GenerationRequest.of("Oi", null));

        ExecutionException ex = assertThrows(ExecutionException.class, future::get);
        assertInstanceOf(ProviderUnavailableException.class, ex.getCause());
    }

    private static GenerationProviderAdapter adapter(AiProvider provider, boolean available) {
        GenerationProviderAdapter adapter = mock(GenerationProviderAdapter.class);
        when(adapter.getProvider()).thenReturn(provider);
        when(adapter.isAvailable()).thenReturn(available);
        return adapter;
    }
}
