package me.golemcore.orchestrator.usage;

import me.golemcore.orchestrator.domain.model.AiProvider;
import me.golemcore.orchestrator.domain.model.CommandCategory;
import me.golemcore.orchestrator.domain.model.Interaction;
import me.golemcore.orchestrator.domain.model.PerformanceMetrics;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.RecordStorePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class PerformanceTrackerImplTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private OrchestratorProperties properties;
    private RecordStorePort recordStore;
    private PerformanceTrackerImpl tracker;

    @BeforeEach
    void setUp() {
        properties = new OrchestratorProperties();
        properties.getRouting().setHistorySize(3);
        recordStore = mock(RecordStorePort.class);
        tracker = new PerformanceTrackerImpl(properties, recordStore);
    }

    @Test
    void shouldAggregateMetricsPerCategoryAndActualProvider() {
        tracker.recordInteraction(interaction("1", CommandCategory.CREATIVE, AiProvider.OPENAI, 1000, true));
        tracker.recordInteraction(interaction("2", CommandCategory.CREATIVE, AiProvider.OPENAI, 3000, false));
        tracker.recordInteraction(interaction("3", CommandCategory.TECHNICAL, AiProvider.ANTHROPIC, 500, true));

        Map<CommandCategory, Map<AiProvider, PerformanceMetrics>> metrics = tracker.getMetrics();
        PerformanceMetrics creative = metrics.get(CommandCategory.CREATIVE).get(AiProvider.OPENAI);
        assertEquals(2, creative.getUsageCount());
        assertEquals(2000, creative.getAverageLatencyMs(), 0.0001);
        assertEquals(0.5, creative.getSuccessRate(), 0.0001);
        assertEquals(1, metrics.get(CommandCategory.TECHNICAL).get(AiProvider.ANTHROPIC).getUsageCount());
    }

    @Test
    void shouldAppendEveryInteractionToLog() {
        tracker.recordInteraction(interaction("1", CommandCategory.CREATIVE, AiProvider.OPENAI, 1000, true));
        tracker.recordInteraction(interaction("2", CommandCategory.CREATIVE, AiProvider.OPENAI, 1000, true));

        verify(recordStore, times(2)).append(eq(PerformanceTrackerImpl.INTERACTION_LOG_KEY), any(Interaction.class));
    }

    @Test
    void shouldEvictOldestInteractionsBeyondCapacity() {
        for (int i = 1; i <= 5; i++) {
            tracker.recordInteraction(interaction(String.valueOf(i), CommandCategory.CREATIVE, AiProvider.OPENAI,
                    100, true));
        }

        assertEquals(3, tracker.getInteractionCount());
        assertEquals(List.of("3", "4", "5"), tracker.getAllInteractions().stream().map(Interaction::id).toList());
        assertEquals(5, tracker.getMetrics().get(CommandCategory.CREATIVE).get(AiProvider.OPENAI).getUsageCount());
    }

    @Test
    void shouldReturnMostRecentInteractionsOldestFirst() {
        for (int i = 1; i <= 3; i++) {
            tracker.recordInteraction(interaction(String.valueOf(i), CommandCategory.CREATIVE, AiProvider.OPENAI,
                    100, true));
        }

        assertEquals(List.of("2", "3"), tracker.getRecentInteractions(2).stream().map(Interaction::id).toList());
        assertEquals(3, tracker.getRecentInteractions(20).size());
        assertTrue(tracker.getRecentInteractions(0).isEmpty());
    }

    @Test
    void shouldHandOutMetricCopies() {
        tracker.recordInteraction(interaction("1", CommandCategory.CREATIVE, AiProvider.OPENAI, 100, true));

        tracker.getMetrics().get(CommandCategory.CREATIVE).get(AiProvider.OPENAI).setUsageCount(99);

        assertEquals(1, tracker.getMetrics().get(CommandCategory.CREATIVE).get(AiProvider.OPENAI).getUsageCount());
    }

    @Test
    void shouldRestoreHistoryAndMetrics() {
        Map<AiProvider, PerformanceMetrics> byProvider = new EnumMap<>(AiProvider.class);
        byProvider.put(AiProvider.PERPLEXITY, PerformanceMetrics.builder().usageCount(7).successRate(1.0).build());
        Map<CommandCategory, Map<AiProvider, PerformanceMetrics>> saved = new EnumMap<>(CommandCategory.class);
        saved.put(CommandCategory.INFORMATIONAL, byProvider);

        tracker.restore(List.of(
                interaction("a", CommandCategory.INFORMATIONAL, AiProvider.PERPLEXITY, 100, true),
                interaction("b", CommandCategory.INFORMATIONAL, AiProvider.PERPLEXITY, 100, true),
                interaction("c", CommandCategory.INFORMATIONAL, AiProvider.PERPLEXITY, 100, true),
                interaction("d", CommandCategory.INFORMATIONAL, AiProvider.PERPLEXITY, 100, true)), saved);

        assertEquals(3, tracker.getInteractionCount());
        assertEquals(7, tracker.getMetrics().get(CommandCategory.INFORMATIONAL).get(AiProvider.PERPLEXITY)
                .getUsageCount());
    }

    private static Interaction interaction(String id, CommandCategory category, AiProvider provider, long latencyMs,
            boolean success) {
        return new Interaction(id, NOW, "input", "output", category, provider, provider, latencyMs,
                success ? 0.9 : 0.1, success);
    }
}
