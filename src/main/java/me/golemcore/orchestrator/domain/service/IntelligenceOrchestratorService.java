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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.AiProvider;
import me.golemcore.orchestrator.domain.model.CommandCategory;
import me.golemcore.orchestrator.domain.model.Interaction;
import me.golemcore.orchestrator.domain.model.InvocationOptions;
import me.golemcore.orchestrator.domain.model.InvocationResult;
import me.golemcore.orchestrator.domain.model.OrchestratorState;
import me.golemcore.orchestrator.domain.model.PerformanceMetrics;
import me.golemcore.orchestrator.port.outbound.ProviderGatewayPort;
import me.golemcore.orchestrator.routing.CommandClassifier;
import me.golemcore.orchestrator.routing.RoutingTable;
import me.golemcore.orchestrator.usage.PerformanceTracker;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Entry point for single-shot requests: classify, route through the fallback
 * executor, and expose the routing state for inspection.
 *
 * <p>
 * On startup the persisted state is loaded, provider reachability is probed,
 * unreachable primaries are repaired and the table is re-ranked if the
 * optimization cooldown has elapsed.
 */
@Service
@Slf4j
public class IntelligenceOrchestratorService {

    private final CommandClassifier commandClassifier;
    private final FallbackExecutionService fallbackExecutionService;
    private final RoutingTable routingTable;
    private final PerformanceTracker performanceTracker;
    private final ProviderGatewayPort providerGateway;
    private final RoutingStateService routingStateService;

    public IntelligenceOrchestratorService(CommandClassifier commandClassifier,
            FallbackExecutionService fallbackExecutionService, RoutingTable routingTable,
            PerformanceTracker performanceTracker, ProviderGatewayPort providerGateway,
            RoutingStateService routingStateService) {
        this.commandClassifier = commandClassifier;
        this.fallbackExecutionService = fallbackExecutionService;
        this.routingTable = routingTable;
        this.performanceTracker = performanceTracker;
        this.providerGateway = providerGateway;
        this.routingStateService = routingStateService;
    }

    @PostConstruct
    public void init() {
        routingStateService.load();
        Set<AiProvider> reachable = providerGateway.refreshAvailability();
        routingTable.repair(reachable);
        if (routingTable.getLastOptimization() != null && routingTable.isOptimizationDue()) {
            routingStateService.optimize(false);
        }
        routingStateService.save();
        log.info("[Routing] Initialized. Reachable providers: {}", reachable);
        log.info("[Routing] Current mappings: {}", routingTable.snapshot());
    }

    @PreDestroy
    public void shutdown() {
        routingStateService.save();
        log.info("[Routing] State saved on shutdown");
    }

    /**
     * Classify the query and invoke the provider mapped for its category.
     */
    public InvocationResult process(String query, InvocationOptions options) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Query is required");
        }
        CommandCategory category = commandClassifier.classify(query);
        return fallbackExecutionService.invoke(query, category, options);
    }

    public CommandCategory classify(String query) {
        return commandClassifier.classify(query);
    }

    public OrchestratorState getState() {
        return routingStateService.snapshot();
    }

    public List<Interaction> getRecentInteractions(int limit) {
        return performanceTracker.getRecentInteractions(limit);
    }

    public Map<CommandCategory, Map<AiProvider, PerformanceMetrics>> getMetrics() {
        return performanceTracker.getMetrics();
    }

    public Map<CommandCategory, AiProvider> getMappings() {
        return routingTable.snapshot();
    }

    /**
     * Re-rank now, ignoring the cooldown. Still a no-op below the minimum number
     * of recorded interactions.
     *
     * @return {@code true} when the optimization ran
     */
    public boolean forceOptimization() {
        boolean ran = routingStateService.optimize(true);
        if (ran) {
            routingStateService.save();
        }
        log.info("[Routing] Forced optimization {}", ran ? "completed" : "skipped (not enough interactions)");
        return ran;
    }

    /**
     * Probe providers again and repair the routing table.
     */
    public Set<AiProvider> refreshAvailability() {
        Set<AiProvider> reachable = providerGateway.refreshAvailability();
        routingTable.repair(reachable);
        routingStateService.save();
        return reachable;
    }
}
