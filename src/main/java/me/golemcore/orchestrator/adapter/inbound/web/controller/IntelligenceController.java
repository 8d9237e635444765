package me.golemcore.orchestrator.adapter.inbound.web.controller;

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

import lombok.RequiredArgsConstructor;
import me.golemcore.orchestrator.cache.CacheStats;
import me.golemcore.orchestrator.cache.ResponseCacheRegistry;
import me.golemcore.orchestrator.domain.model.AiProvider;
import me.golemcore.orchestrator.domain.model.CommandCategory;
import me.golemcore.orchestrator.domain.model.Interaction;
import me.golemcore.orchestrator.domain.model.InvocationOptions;
import me.golemcore.orchestrator.domain.model.InvocationResult;
import me.golemcore.orchestrator.domain.model.OrchestratorState;
import me.golemcore.orchestrator.domain.model.PerformanceMetrics;
import me.golemcore.orchestrator.domain.service.IntelligenceOrchestratorService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Routing inspection and direct invocation endpoints.
 */
@RestController
@RequestMapping("/api/intelligence")
@RequiredArgsConstructor
public class IntelligenceController {

    private static final double TEST_PROVIDER_THRESHOLD = 0.7;
    private static final int MAX_INTERACTIONS_LIMIT = 1000;

    private final IntelligenceOrchestratorService orchestratorService;
    private final ResponseCacheRegistry cacheRegistry;

    @GetMapping("/interactions")
    public Mono<ResponseEntity<List<Interaction>>> getInteractions(
            @RequestParam(defaultValue = "20") int limit) {
        if (limit < 1) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "limit must be positive");
        }
        int effective = Math.min(limit, MAX_INTERACTIONS_LIMIT);
        return Mono.just(ResponseEntity.ok(orchestratorService.getRecentInteractions(effective)));
    }

    @GetMapping("/metrics")
    public Mono<ResponseEntity<Map<CommandCategory, Map<AiProvider, PerformanceMetrics>>>> getMetrics() {
        return Mono.just(ResponseEntity.ok(orchestratorService.getMetrics()));
    }

    @GetMapping("/mappings")
    public Mono<ResponseEntity<Map<CommandCategory, AiProvider>>> getMappings() {
        return Mono.just(ResponseEntity.ok(orchestratorService.getMappings()));
    }

    @PostMapping("/optimize")
    public Mono<ResponseEntity<OptimizationResponse>> optimize() {
        boolean changed = orchestratorService.forceOptimization();
        OrchestratorState state = orchestratorService.getState();
        return Mono.just(ResponseEntity.ok(new OptimizationResponse(
                changed, state.getMappings(), state.getLastOptimization())));
    }

    @GetMapping("/state")
    public Mono<ResponseEntity<OrchestratorState>> getState() {
        return Mono.just(ResponseEntity.ok(orchestratorService.getState()));
    }

    @PostMapping("/process")
    public Mono<ResponseEntity<InvocationResponse>> process(@RequestBody(required = false) ProcessRequest request) {
        if (request == null || isBlank(request.query())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "query is required");
        }
        InvocationOptions options = InvocationOptions.builder()
                .systemPrompt(request.systemPrompt())
                .build();
        InvocationResult result = orchestratorService.process(request.query(), options);
        return Mono.just(ResponseEntity.ok(toResponse(result)));
    }

    @PostMapping("/test-provider")
    public Mono<ResponseEntity<InvocationResponse>> testProvider(
            @RequestBody(required = false) TestProviderRequest request) {
        if (request == null || isBlank(request.query()) || isBlank(request.provider())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "query and provider are required");
        }
        InvocationOptions options = InvocationOptions.builder()
                .forceProvider(parseProvider(request.provider()))
                .confidenceThreshold(TEST_PROVIDER_THRESHOLD)
                .build();
        InvocationResult result = orchestratorService.process(request.query(), options);
        return Mono.just(ResponseEntity.ok(toResponse(result)));
    }

    @GetMapping("/cache")
    public Mono<ResponseEntity<List<CacheStats>>> getCacheStats() {
        return Mono.just(ResponseEntity.ok(cacheRegistry.getStats()));
    }

    @PostMapping("/availability/refresh")
    public Mono<ResponseEntity<AvailabilityResponse>> refreshAvailability() {
        Set<AiProvider> reachable = orchestratorService.refreshAvailability();
        return Mono.just(ResponseEntity.ok(new AvailabilityResponse(
                reachable, orchestratorService.getMappings())));
    }

    private static AiProvider parseProvider(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (AiProvider provider : AiProvider.values()) {
            if (!provider.isSentinel() && provider.getId().equals(normalized)) {
                return provider;
            }
        }
        throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown provider: " + value);
    }

    private static InvocationResponse toResponse(InvocationResult result) {
        return new InvocationResponse(
                result.text(),
                result.provider().getId(),
                result.category().name(),
                result.confidence(),
                result.latencyMs(),
                result.success(),
                result.isFallback());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public record ProcessRequest(String query, String systemPrompt) {
    }

    public record TestProviderRequest(String query, String provider) {
    }

    public record InvocationResponse(
            String response,
            String provider,
            String category,
            double confidence,
            long latencyMs,
            boolean success,
            boolean fallback) {
    }

    public record OptimizationResponse(
            boolean changed,
            Map<CommandCategory, AiProvider> mappings,
            Instant lastOptimization) {
    }

    public record AvailabilityResponse(Set<AiProvider> availableProviders, Map<CommandCategory, AiProvider> mappings) {
    }
}
