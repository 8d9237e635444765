package me.golemcore.orchestrator.routing;

import me.golemcore.orchestrator.domain.model.AiProvider;
import me.golemcore.orchestrator.domain.model.CommandCategory;
import me.golemcore.orchestrator.domain.model.PerformanceMetrics;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RoutingTableTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final Set<AiProvider> ALL_LLMS = EnumSet.of(AiProvider.OPENAI, AiProvider.ANTHROPIC,
            AiProvider.PERPLEXITY);

    private OrchestratorProperties properties;
    private RoutingTable routingTable;

    @BeforeEach
    void setUp() {
        properties = new OrchestratorProperties();
        routingTable = new RoutingTable(properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldStartFromDefaultMappings() {
        assertEquals(AiProvider.OPENAI, routingTable.select(CommandCategory.CREATIVE));
        assertEquals(AiProvider.ANTHROPIC, routingTable.select(CommandCategory.STRATEGIC));
        assertEquals(AiProvider.PERPLEXITY, routingTable.select(CommandCategory.INFORMATIONAL));
        assertEquals(AiProvider.ANTHROPIC, routingTable.select(CommandCategory.EMOTIONAL));
        assertEquals(AiProvider.OPENAI, routingTable.select(CommandCategory.TECHNICAL));
        assertEquals(AiProvider.ELEVENLABS, routingTable.select(CommandCategory.VOICE));
        assertNull(routingTable.getLastOptimization());
    }

    @Test
    void shouldRepairUnreachablePrimariesWithFirstReachableAlternate() {
        Map<CommandCategory, AiProvider> changes = routingTable
                .repair(EnumSet.of(AiProvider.OPENAI, AiProvider.ANTHROPIC));

        assertEquals(2, changes.size());
        assertEquals(AiProvider.OPENAI, routingTable.select(CommandCategory.INFORMATIONAL));
        assertEquals(AiProvider.OPENAI, routingTable.select(CommandCategory.VOICE));
        assertEquals(AiProvider.ANTHROPIC, routingTable.select(CommandCategory.STRATEGIC));
    }

    @Test
    void shouldSkipUnreachableAlternatesDuringRepair() {
        routingTable.repair(EnumSet.of(AiProvider.PERPLEXITY));

        assertEquals(AiProvider.PERPLEXITY, routingTable.select(CommandCategory.CREATIVE));
        assertEquals(AiProvider.PERPLEXITY, routingTable.select(CommandCategory.STRATEGIC));
        assertEquals(AiProvider.ELEVENLABS, routingTable.select(CommandCategory.VOICE));
    }

    @Test
    void shouldLeaveMappingsUnchangedWhenNothingIsReachable() {
        Map<CommandCategory, AiProvider> changes = routingTable.repair(EnumSet.noneOf(AiProvider.class));

        assertTrue(changes.isEmpty());
        assertEquals(RoutingTable.defaultMappings(), routingTable.snapshot());
    }

    @Test
    void shouldNotOptimizeBelowMinimumInteractions() {
        boolean ran = routingTable.optimize(creativeMetrics(), 49, ALL_LLMS, true);

        assertFalse(ran);
        assertEquals(AiProvider.OPENAI, routingTable.select(CommandCategory.CREATIVE));
        assertNull(routingTable.getLastOptimization());
    }

    @Test
    void shouldPromoteBestScoringProviderWithEnoughUsage() {
        boolean ran = routingTable.optimize(creativeMetrics(), 50, ALL_LLMS, false);

        assertTrue(ran);
        assertEquals(AiProvider.ANTHROPIC, routingTable.select(CommandCategory.CREATIVE));
        assertEquals(NOW, routingTable.getLastOptimization());
    }

    @Test
    void shouldIgnoreUnreachableProvidersWhenOptimizing() {
        routingTable.optimize(creativeMetrics(), 50, EnumSet.of(AiProvider.OPENAI, AiProvider.PERPLEXITY), true);

        assertEquals(AiProvider.OPENAI, routingTable.select(CommandCategory.CREATIVE));
    }

    @Test
    void shouldHonourCooldownUnlessForced() {
        routingTable.optimize(creativeMetrics(), 50, ALL_LLMS, false);
        assertFalse(routingTable.isOptimizationDue());

        assertFalse(routingTable.optimize(creativeMetrics(), 50, ALL_LLMS, false));
        assertTrue(routingTable.optimize(creativeMetrics(), 50, ALL_LLMS, true));
    }

    @Test
    void shouldBeDueOnceCooldownElapsed() {
        routingTable.restore(Map.of(), NOW.minus(Duration.ofDays(7)));
        assertTrue(routingTable.isOptimizationDue());

        routingTable.restore(Map.of(), NOW.minus(Duration.ofDays(6)));
        assertFalse(routingTable.isOptimizationDue());
    }

    @Test
    void shouldRestoreSavedMappingsAndSkipSentinel() {
        Map<CommandCategory, AiProvider> saved = new EnumMap<>(CommandCategory.class);
        saved.put(CommandCategory.CREATIVE, AiProvider.PERPLEXITY);
        saved.put(CommandCategory.TECHNICAL, AiProvider.FALLBACK);

        routingTable.restore(saved, NOW);

        assertEquals(AiProvider.PERPLEXITY, routingTable.select(CommandCategory.CREATIVE));
        assertEquals(AiProvider.OPENAI, routingTable.select(CommandCategory.TECHNICAL));
        assertEquals(NOW, routingTable.getLastOptimization());
    }

    @Test
    void shouldWeightSuccessConfidenceAndLatency() {
        PerformanceMetrics metrics = PerformanceMetrics.builder()
                .usageCount(10)
                .successRate(1.0)
                .averageConfidence(0.9)
                .averageLatencyMs(1000)
                .build();

        assertEquals(0.5 + 0.27 + 0.18, RoutingTable.score(metrics, 10_000), 0.0001);
    }

    @Test
    void shouldExposeAlternatesPerCategory() {
        assertEquals(AiProvider.ANTHROPIC, RoutingTable.getAlternates(CommandCategory.CREATIVE).get(0));
        assertTrue(RoutingTable.getAlternates(CommandCategory.VOICE).contains(AiProvider.OPENAI));
    }

    private static Map<CommandCategory, Map<AiProvider, PerformanceMetrics>> creativeMetrics() {
        Map<AiProvider, PerformanceMetrics> creative = new EnumMap<>(AiProvider.class);
        creative.put(AiProvider.OPENAI, PerformanceMetrics.builder()
                .usageCount(10).successRate(0.5).averageConfidence(0.5).averageLatencyMs(5000).build());
        creative.put(AiProvider.ANTHROPIC, PerformanceMetrics.builder()
                .usageCount(10).successRate(1.0).averageConfidence(0.9).averageLatencyMs(1000).build());
        creative.put(AiProvider.PERPLEXITY, PerformanceMetrics.builder()
                .usageCount(2).successRate(1.0).averageConfidence(1.0).averageLatencyMs(10).build());

        Map<CommandCategory, Map<AiProvider, PerformanceMetrics>> metrics = new EnumMap<>(CommandCategory.class);
        metrics.put(CommandCategory.CREATIVE, creative);
        return metrics;
    }
}
