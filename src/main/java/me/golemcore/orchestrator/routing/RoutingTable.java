package me.golemcore.orchestrator.routing;

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
import me.golemcore.orchestrator.domain.model.PerformanceMetrics;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mapping from command category to its primary provider.
 *
 * <p>
 * The table starts from fixed defaults, is repaired whenever provider
 * reachability changes (unreachable primaries are replaced by the first
 * reachable alternate) and is periodically re-ranked from recorded
 * performance. All mutations are serialized on this instance.
 */
@Component
@Slf4j
public class RoutingTable {

    private static final double WEIGHT_SUCCESS = 0.5;
    private static final double WEIGHT_CONFIDENCE = 0.3;
    private static final double WEIGHT_LATENCY = 0.2;

    private static final Map<CommandCategory, AiProvider> DEFAULT_MAPPINGS = new EnumMap<>(CommandCategory.class);
    private static final Map<CommandCategory, List<AiProvider>> ALTERNATES = new EnumMap<>(CommandCategory.class);

    static {
        DEFAULT_MAPPINGS.put(CommandCategory.CREATIVE, AiProvider.OPENAI);
        DEFAULT_MAPPINGS.put(CommandCategory.STRATEGIC, AiProvider.ANTHROPIC);
        DEFAULT_MAPPINGS.put(CommandCategory.INFORMATIONAL, AiProvider.PERPLEXITY);
        DEFAULT_MAPPINGS.put(CommandCategory.EMOTIONAL, AiProvider.ANTHROPIC);
        DEFAULT_MAPPINGS.put(CommandCategory.TECHNICAL, AiProvider.OPENAI);
        DEFAULT_MAPPINGS.put(CommandCategory.VOICE, AiProvider.ELEVENLABS);

        ALTERNATES.put(CommandCategory.CREATIVE,
                List.of(AiProvider.ANTHROPIC, AiProvider.PERPLEXITY, AiProvider.OPENAI));
        ALTERNATES.put(CommandCategory.STRATEGIC,
                List.of(AiProvider.OPENAI, AiProvider.PERPLEXITY, AiProvider.ANTHROPIC));
        ALTERNATES.put(CommandCategory.INFORMATIONAL,
                List.of(AiProvider.OPENAI, AiProvider.ANTHROPIC, AiProvider.PERPLEXITY));
        ALTERNATES.put(CommandCategory.EMOTIONAL,
                List.of(AiProvider.OPENAI, AiProvider.PERPLEXITY, AiProvider.ANTHROPIC));
        ALTERNATES.put(CommandCategory.TECHNICAL,
                List.of(AiProvider.ANTHROPIC, AiProvider.PERPLEXITY, AiProvider.OPENAI));
        ALTERNATES.put(CommandCategory.VOICE,
                List.of(AiProvider.OPENAI, AiProvider.ELEVENLABS));
    }

    private final OrchestratorProperties properties;
    private final Clock clock;

    private final Map<CommandCategory, AiProvider> mappings = new EnumMap<>(DEFAULT_MAPPINGS);
    private Instant lastOptimization;

    public RoutingTable(OrchestratorProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public static Map<CommandCategory, AiProvider> defaultMappings() {
        return Collections.unmodifiableMap(DEFAULT_MAPPINGS);
    }

    /**
     * Ordered fallback candidates for a category. May include the category's
     * default primary; callers skip the provider they already tried.
     */
    public static List<AiProvider> getAlternates(CommandCategory category) {
        return ALTERNATES.getOrDefault(category, List.of(AiProvider.OPENAI, AiProvider.ANTHROPIC,
                AiProvider.PERPLEXITY));
    }

    public synchronized AiProvider select(CommandCategory category) {
        return mappings.getOrDefault(category, DEFAULT_MAPPINGS.get(category));
    }

    /**
     * Replace every unreachable primary by the first reachable alternate.
     * Categories without any reachable alternate are left unchanged.
     *
     * @return the categories that changed, with their new provider
     */
    public synchronized Map<CommandCategory, AiProvider> repair(Set<AiProvider> reachable) {
        Map<CommandCategory, AiProvider> changes = new EnumMap<>(CommandCategory.class);
        for (CommandCategory category : CommandCategory.values()) {
            AiProvider current = select(category);
            if (reachable.contains(current)) {
                continue;
            }
            for (AiProvider alternate : getAlternates(category)) {
                if (reachable.contains(alternate)) {
                    mappings.put(category, alternate);
                    changes.put(category, alternate);
                    log.info("[Routing] {} remapped {} -> {} (primary unreachable)", category, current, alternate);
                    break;
                }
            }
        }
        return changes;
    }

    /**
     * Whether the cooldown since the last optimization has elapsed. A table that
     * was never optimized is always due.
     */
    public synchronized boolean isOptimizationDue() {
        if (lastOptimization == null) {
            return true;
        }
        Duration elapsed = Duration.between(lastOptimization, clock.instant());
        return elapsed.compareTo(properties.getRouting().getOptimizationCooldown()) >= 0;
    }

    /**
     * Re-rank the primary provider of every category from recorded performance.
     *
     * @param metrics
     *            per category, per provider aggregates
     * @param totalInteractions
     *            number of interactions currently in history
     * @param reachable
     *            providers that may be selected
     * @param force
     *            ignore the cooldown
     * @return {@code true} when the optimization ran (even if nothing changed)
     */
    public synchronized boolean optimize(Map<CommandCategory, Map<AiProvider, PerformanceMetrics>> metrics,
            long totalInteractions, Set<AiProvider> reachable, boolean force) {
        OrchestratorProperties.RoutingProperties routing = properties.getRouting();
        if (totalInteractions < routing.getMinInteractions()) {
            log.debug("[Routing] Not enough interactions to optimize: {} < {}", totalInteractions,
                    routing.getMinInteractions());
            return false;
        }
        if (!force && !isOptimizationDue()) {
            log.debug("[Routing] Optimization skipped, last run at {}", lastOptimization);
            return false;
        }

        double latencyNorm = routing.getLatencyNormalization().toMillis();
        for (CommandCategory category : CommandCategory.values()) {
            Map<AiProvider, PerformanceMetrics> categoryMetrics = metrics.get(category);
            if (categoryMetrics == null) {
                continue;
            }
            AiProvider current = select(category);
            AiProvider best = current;
            double bestScore = 0;
            for (AiProvider provider : AiProvider.values()) {
                if (!reachable.contains(provider)) {
                    continue;
                }
                PerformanceMetrics pm = categoryMetrics.get(provider);
                if (pm == null || pm.getUsageCount() < routing.getMinUsage()) {
                    continue;
                }
                double score = score(pm, latencyNorm);
                if (score > bestScore) {
                    bestScore = score;
                    best = provider;
                }
            }
            if (best != current) {
                log.info("[Routing] Optimized {}: {} -> {} (score {})", category, current, best,
                        String.format("%.3f", bestScore));
                mappings.put(category, best);
            }
        }
        lastOptimization = clock.instant();
        return true;
    }

    static double score(PerformanceMetrics metrics, double latencyNormalizationMs) {
        return metrics.getSuccessRate() * WEIGHT_SUCCESS
                + metrics.getAverageConfidence() * WEIGHT_CONFIDENCE
                + (1 - metrics.getAverageLatencyMs() / latencyNormalizationMs) * WEIGHT_LATENCY;
    }

    public synchronized Map<CommandCategory, AiProvider> snapshot() {
        return new EnumMap<>(mappings);
    }

    public synchronized Instant getLastOptimization() {
        return lastOptimization;
    }

    /**
     * Restore persisted mappings. Categories missing from the snapshot keep their
     * defaults.
     */
    public synchronized void restore(Map<CommandCategory, AiProvider> saved, Instant savedLastOptimization) {
        mappings.clear();
        mappings.putAll(DEFAULT_MAPPINGS);
        if (saved != null) {
            saved.forEach((category, provider) -> {
                if (category != null && provider != null && !provider.isSentinel()) {
                    mappings.put(category, provider);
                }
            });
        }
        lastOptimization = savedLastOptimization;
    }
}
