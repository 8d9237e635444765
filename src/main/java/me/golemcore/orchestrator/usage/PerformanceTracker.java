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

import me.golemcore.orchestrator.domain.model.AiProvider;
import me.golemcore.orchestrator.domain.model.CommandCategory;
import me.golemcore.orchestrator.domain.model.Interaction;
import me.golemcore.orchestrator.domain.model.PerformanceMetrics;

import java.util.List;
import java.util.Map;

/**
 * Bounded interaction history and per (category, provider) performance
 * aggregates.
 */
public interface PerformanceTracker {

    /**
     * Append an interaction to the history (evicting the oldest beyond capacity)
     * and fold it into the metrics of its category and actual provider.
     */
    void recordInteraction(Interaction interaction);

    /**
     * The last {@code limit} interactions, oldest first.
     */
    List<Interaction> getRecentInteractions(int limit);

    List<Interaction> getAllInteractions();

    /**
     * Deep copy of all aggregates.
     */
    Map<CommandCategory, Map<AiProvider, PerformanceMetrics>> getMetrics();

    int getInteractionCount();

    /**
     * Replace history and aggregates with persisted values.
     */
    void restore(List<Interaction> interactions, Map<CommandCategory, Map<AiProvider, PerformanceMetrics>> metrics);
}
