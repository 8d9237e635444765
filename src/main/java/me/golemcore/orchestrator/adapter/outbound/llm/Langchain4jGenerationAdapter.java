package me.golemcore.orchestrator.adapter.outbound.llm;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.cache.BoundedResponseCache;
import me.golemcore.orchestrator.cache.CachedResponse;
import me.golemcore.orchestrator.cache.ResponseCacheRegistry;
import me.golemcore.orchestrator.domain.model.GenerationRequest;
import me.golemcore.orchestrator.domain.model.ProviderCallException;
import me.golemcore.orchestrator.domain.system.ProviderErrorClassifier;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Base class for providers reached through langchain4j chat models.
 *
 * <p>
 * Features:
 * <ul>
 * <li>Lazy creation of the chat model on first use
 * <li>Per-provider response cache with TTL, keyed by prompt and system prompt
 * <li>Automatic retry with exponential backoff for rate limits
 * <li>Failures surfaced as {@link ProviderCallException} with a reason code
 * </ul>
 */
@Slf4j
public abstract class Langchain4jGenerationAdapter implements GenerationProviderAdapter {

    private static final double BACKOFF_MULTIPLIER = 2.0;

    protected final OrchestratorProperties properties;
    private final ResponseCacheRegistry cacheRegistry;
    private final Clock clock;

    private volatile ChatModel chatModel;

    protected Langchain4jGenerationAdapter(OrchestratorProperties properties, ResponseCacheRegistry cacheRegistry,
            Clock clock) {
        this.properties = properties;
        this.cacheRegistry = cacheRegistry;
        this.clock = clock;
    }

    /**
     * Provider settings bound from {@code orchestrator.providers.<id>}.
     */
    protected abstract OrchestratorProperties.ProviderProperties providerConfig();

    /**
     * Build the underlying chat model. Retries must be disabled at the SDK level;
     * rate limits are retried here.
     */
    protected abstract ChatModel createChatModel(OrchestratorProperties.ProviderProperties config);

    @Override
    public boolean isAvailable() {
        return providerConfig().hasApiKey();
    }

    @Override
    public synchronized void initialize() {
        if (chatModel != null) {
            return;
        }
        OrchestratorProperties.ProviderProperties config = providerConfig();
        chatModel = createChatModel(config);
        log.info("[LLM] {} adapter initialized (model: {})", getProvider().getId(), config.getModel());
    }

    @Override
    public CompletableFuture<String> generate(GenerationRequest request) {
        return CompletableFuture.supplyAsync(() -> generateBlocking(request));
    }

    String generateBlocking(GenerationRequest request) {
        if (!isAvailable()) {
            throw new ProviderCallException(getProvider(), ProviderErrorClassifier.UNAVAILABLE,
                    "No API key configured for " + getProvider().getId());
        }
        String cacheKey = cacheKey(request);
        Optional<String> cached = lookupCache(request, cacheKey);
        if (cached.isPresent()) {
            log.debug("[LLM] {} cache hit", getProvider().getId());
            return cached.get();
        }

        initialize();
        List<ChatMessage> messages = buildMessages(request);
        int maxRetries = properties.getLlm().getMaxRetries();
        long initialBackoffMs = properties.getLlm().getInitialBackoff().toMillis();

        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            try {
                ChatResponse response = chatModel.chat(messages);
                String text = response != null && response.aiMessage() != null
                        ? response.aiMessage().text()
                        : null;
                if (text == null || text.isBlank()) {
                    throw new ProviderCallException(getProvider(), ProviderErrorClassifier.EMPTY_RESPONSE,
                            "Empty response from " + getProvider().getId());
                }
                storeCache(request, cacheKey, text);
                return text;
            } catch (ProviderCallException e) {
                throw e;
            } catch (RuntimeException e) {
                String code = ProviderErrorClassifier.classify(e);
                if (ProviderErrorClassifier.RATE_LIMIT.equals(code) && attempt < maxRetries) {
                    long backoffMs = (long) (initialBackoffMs * Math.pow(BACKOFF_MULTIPLIER, attempt));
                    log.warn("[LLM] {} rate limit hit (attempt {}/{}), retrying in {}ms...",
                            getProvider().getId(), attempt + 1, maxRetries, backoffMs);
                    sleep(backoffMs);
                } else {
                    log.warn("[LLM] {} call failed [{}]: {}", getProvider().getId(), code, e.getMessage());
                    throw new ProviderCallException(getProvider(), code,
                            getProvider().getId() + " call failed: " + e.getMessage(), e);
                }
            }
        }
        throw new ProviderCallException(getProvider(), ProviderErrorClassifier.RATE_LIMIT,
                getProvider().getId() + " call failed: max retries exhausted");
    }

    private List<ChatMessage> buildMessages(GenerationRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }
        messages.add(UserMessage.from(request.getPrompt()));
        return messages;
    }

    private void sleep(long backoffMs) {
        try {
            Thread.sleep(backoffMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new ProviderCallException(getProvider(), ProviderErrorClassifier.REQUEST_ABORTED,
                    "Interrupted during retry backoff", ie);
        }
    }

    // ==================== CACHE ====================

    private boolean cacheEnabled(GenerationRequest request) {
        return request.isCacheable() && properties.getCache().isEnabled();
    }

    private BoundedResponseCache<CachedResponse> cache() {
        return cacheRegistry.getCache(getProvider().getId(), properties.getCache().getMaxSize());
    }

    private Optional<String> lookupCache(GenerationRequest request, String key) {
        if (!cacheEnabled(request)) {
            return Optional.empty();
        }
        BoundedResponseCache<CachedResponse> cache = cache();
        Optional<CachedResponse> entry = cache.get(key);
        if (entry.isEmpty()) {
            return Optional.empty();
        }
        if (!entry.get().isFresh(clock.instant(), properties.getCache().getTtl())) {
            cache.delete(key);
            return Optional.empty();
        }
        return Optional.of(entry.get().text());
    }

    private void storeCache(GenerationRequest request, String key, String text) {
        if (cacheEnabled(request)) {
            cache().set(key, new CachedResponse(text, providerConfig().getModel(), clock.instant()));
        }
    }

    static String cacheKey(GenerationRequest request) {
        String material = (request.getSystemPrompt() != null ? request.getSystemPrompt() : "")
                + "\u0000" + (request.getPrompt() != null ? request.getPrompt() : "");
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(material.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
