package me.golemcore.orchestrator.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.AiProvider;
import me.golemcore.orchestrator.domain.model.CommandCategory;
import me.golemcore.orchestrator.domain.model.GenerationRequest;
import me.golemcore.orchestrator.domain.model.Interaction;
import me.golemcore.orchestrator.domain.model.InvocationOptions;
import me.golemcore.orchestrator.domain.model.InvocationResult;
import me.golemcore.orchestrator.domain.model.ProviderCallException;
import me.golemcore.orchestrator.domain.model.ProviderUnavailableException;
import me.golemcore.orchestrator.domain.system.ProviderErrorClassifier;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.ProviderGatewayPort;
import me.golemcore.orchestrator.routing.RoutingTable;
import me.golemcore.orchestrator.usage.PerformanceTracker;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Calls the provider mapped for a category and walks the category's alternates
 * when the primary fails or returns a suspiciously short answer.
 *
 * <p>
 * {@link #invoke} never throws: when every provider fails, the result carries
 * the {@link AiProvider#FALLBACK} sentinel, an apology text and confidence
 * 0.1. Every invocation records exactly one {@link Interaction}.
 */
@Service
@Slf4j
public class FallbackExecutionService {

    static final double DEFAULT_CONFIDENCE = 0.9;
    static final double LOW_CONFIDENCE = 0.5;
    static final double UPGRADED_CONFIDENCE = 0.85;
    static final double ALTERNATE_CONFIDENCE = 0.7;
    static final double FALLBACK_CONFIDENCE = 0.1;
    static final double UPGRADE_LENGTH_FACTOR = 1.5;

    private static final String APOLOGY_PREFIX = "Desculpe, não consegui processar sua solicitação no momento. Erro: ";
    private static final String UNKNOWN_ERROR = "Desconhecido";

    private final ProviderGatewayPort providerGateway;
    private final RoutingTable routingTable;
    private final PerformanceTracker performanceTracker;
    private final RoutingStateService routingStateService;
    private final OrchestratorProperties properties;
    private final Clock clock;

    private final Map<String, InFlightInvocation> inFlight = new ConcurrentHashMap<>();

    public FallbackExecutionService(ProviderGatewayPort providerGateway, RoutingTable routingTable,
            PerformanceTracker performanceTracker, RoutingStateService routingStateService,
            OrchestratorProperties properties, Clock clock) {
        this.providerGateway = providerGateway;
        this.routingTable = routingTable;
        this.performanceTracker = performanceTracker;
        this.routingStateService = routingStateService;
        this.properties = properties;
        this.clock = clock;
    }

    public InvocationResult invoke(String text, CommandCategory category, InvocationOptions options) {
        InvocationOptions opts = options != null ? options : InvocationOptions.defaults();
        String invocationId = UUID.randomUUID().toString();
        long startMillis = clock.millis();

        AiProvider primary = opts.getForceProvider() != null && providerGateway.isReachable(opts.getForceProvider())
                ? opts.getForceProvider()
                : routingTable.select(category);
        inFlight.put(invocationId, new InFlightInvocation(invocationId, category, primary, clock.instant()));

        GenerationRequest request = GenerationRequest.of(text, opts.getSystemPrompt());
        Duration timeout = opts.getTimeout() != null ? opts.getTimeout() : properties.getLlm().getTimeout();

        AiProvider actual = primary;
        String response;
        boolean success = true;
        double confidence = DEFAULT_CONFIDENCE;

        try {
            response = call(primary, request, timeout);

            if (opts.getConfidenceThreshold() != null
                    && category != CommandCategory.VOICE
                    && response.length() < properties.getRouting().getLowConfidenceLength()) {
                confidence = LOW_CONFIDENCE;
                if (confidence < opts.getConfidenceThreshold()) {
                    log.info("[Fallback] Low-confidence answer from {}, trying alternates", primary);
                    for (AiProvider alternate : RoutingTable.getAlternates(category)) {
                        if (alternate == primary || !providerGateway.isReachable(alternate)) {
                            continue;
                        }
                        try {
                            String alternateResponse = call(alternate, request, timeout);
                            if (alternateResponse.length() > response.length() * UPGRADE_LENGTH_FACTOR) {
                                response = alternateResponse;
                                actual = alternate;
                                confidence = UPGRADED_CONFIDENCE;
                                break;
                            }
                        } catch (ProviderCallException e) {
                            log.warn("[Fallback] Alternate {} failed: {}", alternate, e.getMessage());
                        }
                    }
                }
            }
        } catch (ProviderCallException primaryError) {
            log.warn("[Fallback] Primary provider {} failed for {}: {}", primary, category,
                    primaryError.getMessage());
            success = false;
            response = null;
            for (AiProvider alternate : RoutingTable.getAlternates(category)) {
                if (alternate == primary || !providerGateway.isReachable(alternate)) {
                    continue;
                }
                try {
                    response = call(alternate, request, timeout);
                    actual = alternate;
                    success = true;
                    confidence = ALTERNATE_CONFIDENCE;
                    log.info("[Fallback] {} served by alternate {}", category, alternate);
                    break;
                } catch (ProviderCallException e) {
                    log.warn("[Fallback] Alternate {} failed: {}", alternate, e.getMessage());
                }
            }
            if (response == null) {
                String reason = primaryError.getMessage() != null ? primaryError.getMessage() : UNKNOWN_ERROR;
                response = APOLOGY_PREFIX + reason;
                actual = AiProvider.FALLBACK;
                confidence = FALLBACK_CONFIDENCE;
                log.warn("[Fallback] No provider could serve {}", category);
            }
        } finally {
            inFlight.remove(invocationId);
        }

        long latencyMs = Math.max(0, clock.millis() - startMillis);
        InvocationResult result = new InvocationResult(response, actual, category, confidence, latencyMs, success);
        record(invocationId, text, primary, result);
        return result;
    }

    /**
     * Forget all in-flight invocations. Running calls are not interrupted; their
     * callers decide whether the result is still wanted.
     *
     * @return number of invocations that were in flight
     */
    public int resetSession() {
        int count = inFlight.size();
        inFlight.clear();
        log.info("[Fallback] Session reset, {} in-flight invocations detached", count);
        return count;
    }

    public int getInFlightCount() {
        return inFlight.size();
    }

    private String call(AiProvider provider, GenerationRequest request, Duration timeout) {
        CompletableFuture<String> future = providerGateway.generate(provider, request);
        try {
            String text = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (text == null) {
                throw new ProviderCallException(provider, ProviderErrorClassifier.EMPTY_RESPONSE,
                        "Empty response from " + provider.getId());
            }
            log.debug("[Fallback] {} answered ({} chars)", provider, text.length());
            return text;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ProviderCallException(provider, ProviderErrorClassifier.REQUEST_TIMEOUT,
                    provider.getId() + " timed out after " + timeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderCallException(provider, ProviderErrorClassifier.REQUEST_ABORTED,
                    provider.getId() + " call interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof ProviderCallException providerCallException) {
                throw providerCallException;
            }
            if (cause instanceof ProviderUnavailableException) {
                throw new ProviderCallException(provider, ProviderErrorClassifier.UNAVAILABLE, cause.getMessage(),
                        cause);
            }
            throw new ProviderCallException(provider, ProviderErrorClassifier.classify(cause), cause.getMessage(),
                    cause);
        } catch (ProviderCallException e) {
            throw e;
        } catch (RuntimeException e) { // NOSONAR - any adapter failure is a provider failure
            throw new ProviderCallException(provider, ProviderErrorClassifier.classify(e), e.getMessage(), e);
        }
    }

    private void record(String id, String input, AiProvider primary, InvocationResult result) {
        Interaction interaction = new Interaction(id, clock.instant(), input, result.text(), result.category(),
                primary, result.provider(), result.latencyMs(), result.confidence(), result.success());
        try {
            performanceTracker.recordInteraction(interaction);
            routingStateService.onInteractionRecorded();
        } catch (RuntimeException e) { // NOSONAR - bookkeeping must not fail the invocation
            log.warn("[Fallback] Failed to record interaction {}: {}", id, e.getMessage());
        }
    }

    private record InFlightInvocation(String id, CommandCategory category, AiProvider provider, Instant startedAt) {
    }
}
