package me.golemcore.orchestrator.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Persisted snapshot of the routing engine: current mappings, reachable
 * providers, interaction history and per-category metrics.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrchestratorState {

    @Builder.Default
    private Map<CommandCategory, AiProvider> mappings = new EnumMap<>(CommandCategory.class);

    @Builder.Default
    private Set<AiProvider> availableProviders = EnumSet.noneOf(AiProvider.class);

    @Builder.Default
    private List<Interaction> interactions = new ArrayList<>();

    @Builder.Default
    private Map<CommandCategory, Map<AiProvider, PerformanceMetrics>> performanceMetrics = new EnumMap<>(
            CommandCategory.class);

    private Instant lastOptimization;
}
