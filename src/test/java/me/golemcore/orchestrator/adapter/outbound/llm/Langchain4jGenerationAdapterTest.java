package me.golemcore.orchestrator.adapter.outbound.llm;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.exception.AuthenticationException;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import me.golemcore.orchestrator.cache.ResponseCacheRegistry;
import me.golemcore.orchestrator.domain.model.AiProvider;
import me.golemcore.orchestrator.domain.model.GenerationRequest;
import me.golemcore.orchestrator.domain.model.ProviderCallException;
import me.golemcore.orchestrator.domain.system.ProviderErrorClassifier;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class Langchain4jGenerationAdapterTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private OrchestratorProperties properties;
    private ResponseCacheRegistry cacheRegistry;
    private ChatModel chatModel;

    @BeforeEach
    void setUp() {
        properties = new OrchestratorProperties();
        properties.getProviders().getOpenai().setApiKey("sk-test");
        properties.getLlm().setInitialBackoff(Duration.ZERO);
        cacheRegistry = new ResponseCacheRegistry();
        chatModel = mock(ChatModel.class);
    }

    @Test
    void shouldReturnModelText() {
        when(chatModel.chat(anyList())).thenReturn(response("Olá!"));

        String text = adapter(NOW).generateBlocking(GenerationRequest.of("Oi", null));

        assertEquals("Olá!", text);
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldSendSystemPromptBeforeUserMessage() {
        when(chatModel.chat(anyList())).thenReturn(response("ok"));

        adapter(NOW).generateBlocking(GenerationRequest.of("Pergunta", "Você é um analista"));

        ArgumentCaptor<List<ChatMessage>> captor = ArgumentCaptor.forClass(List.class);
        verify(chatModel).chat(captor.capture());
        assertEquals(2, captor.getValue().size());
        assertInstanceOf(SystemMessage.class, captor.getValue().get(0));
    }

    @Test
    void shouldFailAsUnavailableWithoutApiKey() {
        properties.getProviders().getOpenai().setApiKey("");
        TestAdapter adapter = adapter(NOW);

        assertFalse(adapter.isAvailable());
        ProviderCallException ex = assertThrows(ProviderCallException.class,
                () -> adapter.generateBlocking(GenerationRequest.of("Oi", null)));
        assertEquals(ProviderErrorClassifier.UNAVAILABLE, ex.getCode());
        verify(chatModel, never()).chat(anyList());
    }

    @Test
    void shouldServeRepeatedPromptFromCache() {
        when(chatModel.chat(anyList())).thenReturn(response("cached answer"));
        TestAdapter adapter = adapter(NOW);

        adapter.generateBlocking(GenerationRequest.of("Mesma pergunta", null));
        String second = adapter.generateBlocking(GenerationRequest.of("Mesma pergunta", null));

        assertEquals("cached answer", second);
        verify(chatModel, times(1)).chat(anyList());
    }

    @Test
    void shouldBypassCacheForNonCacheableRequests() {
        when(chatModel.chat(anyList())).thenReturn(response("fresh"));
        TestAdapter adapter = adapter(NOW);
        GenerationRequest request = GenerationRequest.builder().prompt("Agora").cacheable(false).build();

        adapter.generateBlocking(request);
        adapter.generateBlocking(request);

        verify(chatModel, times(2)).chat(anyList());
    }

    @Test
    void shouldIgnoreExpiredCacheEntries() {
        when(chatModel.chat(anyList())).thenReturn(response("first"), response("second"));

        adapter(NOW).generateBlocking(GenerationRequest.of("Pergunta", null));
        String later = adapter(NOW.plus(Duration.ofMinutes(61))).generateBlocking(GenerationRequest.of("Pergunta", null));

        assertEquals("second", later);
        verify(chatModel, times(2)).chat(anyList());
    }

    @Test
    void shouldRetryRateLimitsWithBackoff() {
        when(chatModel.chat(anyList()))
                .thenThrow(new RateLimitException("slow down"))
                .thenThrow(new RateLimitException("slow down"))
                .thenReturn(response("finally"));

        String text = adapter(NOW).generateBlocking(GenerationRequest.of("Oi", null));

        assertEquals("finally", text);
        verify(chatModel, times(3)).chat(anyList());
    }

    @Test
    void shouldGiveUpAfterMaxRetries() {
        properties.getLlm().setMaxRetries(2);
        when(chatModel.chat(anyList())).thenThrow(new RateLimitException("slow down"));

        ProviderCallException ex = assertThrows(ProviderCallException.class,
                () -> adapter(NOW).generateBlocking(GenerationRequest.of("Oi", null)));

        assertEquals(ProviderErrorClassifier.RATE_LIMIT, ex.getCode());
        assertEquals(AiProvider.OPENAI, ex.getProvider());
        verify(chatModel, times(3)).chat(anyList());
    }

    @Test
    void shouldNotRetryOtherFailures() {
        when(chatModel.chat(anyList())).thenThrow(new AuthenticationException("bad key"));

        ProviderCallException ex = assertThrows(ProviderCallException.class,
                () -> adapter(NOW).generateBlocking(GenerationRequest.of("Oi", null)));

        assertEquals(ProviderErrorClassifier.AUTHENTICATION, ex.getCode());
        verify(chatModel, times(1)).chat(anyList());
    }

    @Test
    void shouldTreatBlankResponseAsEmpty() {
        when(chatModel.chat(anyList())).thenReturn(response("  "));

        ProviderCallException ex = assertThrows(ProviderCallException.class,
                () -> adapter(NOW).generateBlocking(GenerationRequest.of("Oi", null)));

        assertEquals(ProviderErrorClassifier.EMPTY_RESPONSE, ex.getCode());
    }

    @Test
    void generateShouldCompleteAsynchronously() throws Exception {
        when(chatModel.chat(anyList())).thenReturn(response("async"));

        assertEquals("async", adapter(NOW).generate(GenerationRequest.of("Oi", null)).get());
    }

    @Test
    void cacheKeyShouldDependOnSystemPrompt() {
        String plain = Langchain4jGenerationAdapter.cacheKey(GenerationRequest.of("Oi", null));
        String withSystem = Langchain4jGenerationAdapter.cacheKey(GenerationRequest.of("Oi", "sys"));

        assertEquals(64, plain.length());
        assertNotEquals(plain, withSystem);
    }

    @Test
    void concreteAdaptersShouldBuildTheirChatModels() {
        properties.getProviders().getAnthropic().setApiKey("sk-ant-test");
        properties.getProviders().getPerplexity().setApiKey("pplx-test");
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

        OpenAiGenerationAdapter openAi = new OpenAiGenerationAdapter(properties, cacheRegistry, clock);
        AnthropicGenerationAdapter anthropic = new AnthropicGenerationAdapter(properties, cacheRegistry, clock);
        PerplexityGenerationAdapter perplexity = new PerplexityGenerationAdapter(properties, cacheRegistry, clock);

        assertInstanceOf(OpenAiChatModel.class, openAi.createChatModel(properties.getProviders().getOpenai()));
        assertInstanceOf(AnthropicChatModel.class,
                anthropic.createChatModel(properties.getProviders().getAnthropic()));
        assertInstanceOf(OpenAiChatModel.class,
                perplexity.createChatModel(properties.getProviders().getPerplexity()));
        assertEquals(AiProvider.PERPLEXITY, perplexity.getProvider());
        assertTrue(anthropic.isAvailable());
    }

    private TestAdapter adapter(Instant now) {
        return new TestAdapter(properties, cacheRegistry, Clock.fixed(now, ZoneOffset.UTC), chatModel);
    }

    private static ChatResponse response(String text) {
        return ChatResponse.builder().aiMessage(AiMessage.from(text)).build();
    }

    private static final class TestAdapter extends Langchain4jGenerationAdapter {

        private final ChatModel model;

        TestAdapter(OrchestratorProperties properties, ResponseCacheRegistry cacheRegistry, Clock clock,
                ChatModel model) {
            super(properties, cacheRegistry, clock);
            this.model = model;
        }

        @Override
        public AiProvider getProvider() {
            return AiProvider.OPENAI;
        }

        @Override
        protected OrchestratorProperties.ProviderProperties providerConfig() {
            return properties.getProviders().getOpenai();
        }

        @Override
        protected ChatModel createChatModel(OrchestratorProperties.ProviderProperties config) {
            return model;
        }
    }
}
