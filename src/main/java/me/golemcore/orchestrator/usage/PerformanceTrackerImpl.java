package me.golemcore.orchestrator.usage;

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
import me.golemcore.orchestrator.domain.model.Interaction;
import me.golemcore.orchestrator.domain.model.PerformanceMetrics;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.RecordStorePort;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Default implementation of {@link PerformanceTracker}.
 *
 * <p>
 * History and aggregates live in memory and are persisted as part of the
 * orchestrator state. Every interaction is additionally appended to the JSONL
 * log {@code records/interactions}, which is never truncated.
 */
@Component
@Slf4j
public class PerformanceTrackerImpl implements PerformanceTracker {

    static final String INTERACTION_LOG_KEY = "records/interactions";

    private final OrchestratorProperties properties;
    private final RecordStorePort recordStore;

    private final Deque<Interaction> history = new ArrayDeque<>();
    private final Map<CommandCategory, Map<AiProvider, PerformanceMetrics>> metrics = new EnumMap<>(
            CommandCategory.class);

    public PerformanceTrackerImpl(OrchestratorProperties properties, RecordStorePort recordStore) {
        this.properties = properties;
        this.recordStore = recordStore;
    }

    @Override
    public void recordInteraction(Interaction interaction) {
        synchronized (this) {
            history.addLast(interaction);
            trimHistory();
            metrics.computeIfAbsent(interaction.category(), c -> new EnumMap<>(AiProvider.class))
                    .computeIfAbsent(interaction.actualProvider(), p -> PerformanceMetrics.empty())
                    .record(interaction.latencyMs(), interaction.confidence(), interaction.success(),
                            interaction.timestamp());
        }
        log.debug("[Routing] Recorded interaction {} ({} via {}, success={})", interaction.id(),
                interaction.category(), interaction.actualProvider(), interaction.success());
        recordStore.append(INTERACTION_LOG_KEY, interaction);
    }

    @Override
    public synchronized List<Interaction> getRecentInteractions(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<Interaction> all = new ArrayList<>(history);
        int from = Math.max(0, all.size() - limit);
        return List.copyOf(all.subList(from, all.size()));
    }

    @Override
    public synchronized List<Interaction> getAllInteractions() {
        return List.copyOf(history);
    }

    @Override
    public synchronized Map<CommandCategory, Map<AiProvider, PerformanceMetrics>> getMetrics() {
        Map<CommandCategory, Map<AiProvider, PerformanceMetrics>> copy = new EnumMap<>(CommandCategory.class);
        metrics.forEach((category, byProvider) -> {
            Map<AiProvider, PerformanceMetrics> providerCopy = new EnumMap<>(AiProvider.class);
            byProvider.forEach((provider, pm) -> providerCopy.put(provider, pm.copy()));
            copy.put(category, providerCopy);
        });
        return copy;
    }

    @Override
    public synchronized int getInteractionCount() {
        return history.size();
    }

    @Override
    public synchronized void restore(List<Interaction> interactions,
            Map<CommandCategory, Map<AiProvider, PerformanceMetrics>> savedMetrics) {
        history.clear();
        metrics.clear();
        if (interactions != null) {
            history.addAll(interactions);
            trimHistory();
        }
        if (savedMetrics != null) {
            savedMetrics.forEach((category, byProvider) -> {
                if (category == null || byProvider == null) {
                    return;
                }
                Map<AiProvider, PerformanceMetrics> providerCopy = new EnumMap<>(AiProvider.class);
                byProvider.forEach((provider, pm) -> {
                    if (provider != null && pm != null) {
                        providerCopy.put(provider, pm.copy());
                    }
                });
                metrics.put(category, providerCopy);
            });
        }
        log.info("[Routing] Restored {} interactions", history.size());
    }

    private void trimHistory() {
        int capacity = properties.getRouting().getHistorySize();
        while (history.size() > capacity) {
            history.removeFirst();
        }
    }
}
