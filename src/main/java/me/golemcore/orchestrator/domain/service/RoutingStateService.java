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

import com.fasterxml.jackson.core.type.TypeReference;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.AiProvider;
import me.golemcore.orchestrator.domain.model.OrchestratorState;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.ProviderGatewayPort;
import me.golemcore.orchestrator.port.outbound.RecordStorePort;
import me.golemcore.orchestrator.routing.RoutingTable;
import me.golemcore.orchestrator.usage.PerformanceTracker;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns the persisted orchestrator state: routing table, interaction history,
 * performance aggregates and the last optimization time.
 *
 * <p>
 * State is saved every {@code orchestrator.routing.save-every} recorded
 * interactions; the periodic save also gives the routing table a chance to
 * re-rank once its cooldown has elapsed.
 */
@Service
@Slf4j
public class RoutingStateService {

    static final String STATE_KEY = "state/intelligence-orchestrator";

    private static final TypeReference<OrchestratorState> STATE_TYPE = new TypeReference<>() {
    };

    private final RoutingTable routingTable;
    private final PerformanceTracker performanceTracker;
    private final ProviderGatewayPort providerGateway;
    private final RecordStorePort recordStore;
    private final OrchestratorProperties properties;

    private final AtomicInteger unsavedInteractions = new AtomicInteger();

    public RoutingStateService(RoutingTable routingTable, PerformanceTracker performanceTracker,
            ProviderGatewayPort providerGateway, RecordStorePort recordStore, OrchestratorProperties properties) {
        this.routingTable = routingTable;
        this.performanceTracker = performanceTracker;
        this.providerGateway = providerGateway;
        this.recordStore = recordStore;
        this.properties = properties;
    }

    /**
     * Restore persisted state. Missing or unreadable state leaves the defaults in
     * place.
     */
    public void load() {
        OrchestratorState state = recordStore.load(STATE_KEY, STATE_TYPE, null);
        if (state == null) {
            log.info("[Routing] No saved state, starting from default mappings");
            return;
        }
        routingTable.restore(state.getMappings(), state.getLastOptimization());
        performanceTracker.restore(state.getInteractions(), state.getPerformanceMetrics());
        log.info("[Routing] State loaded (last optimization: {})", state.getLastOptimization());
    }

    public OrchestratorState snapshot() {
        return OrchestratorState.builder()
                .mappings(routingTable.snapshot())
                .availableProviders(providerGateway.getReachableProviders().isEmpty()
                        ? EnumSet.noneOf(AiProvider.class)
                        : EnumSet.copyOf(providerGateway.getReachableProviders()))
                .interactions(performanceTracker.getAllInteractions())
                .performanceMetrics(performanceTracker.getMetrics())
                .lastOptimization(routingTable.getLastOptimization())
                .build();
    }

    public synchronized void save() {
        unsavedInteractions.set(0);
        recordStore.save(STATE_KEY, snapshot());
    }

    /**
     * Called once per recorded interaction.
     */
    public void onInteractionRecorded() {
        if (unsavedInteractions.incrementAndGet() < properties.getRouting().getSaveEvery()) {
            return;
        }
        optimize(false);
        save();
    }

    /**
     * Re-rank the routing table from recorded performance.
     *
     * @param force
     *            ignore the optimization cooldown
     * @return {@code true} when the optimization ran
     */
    public boolean optimize(boolean force) {
        return routingTable.optimize(performanceTracker.getMetrics(), performanceTracker.getInteractionCount(),
                providerGateway.getReachableProviders(), force);
    }
}
