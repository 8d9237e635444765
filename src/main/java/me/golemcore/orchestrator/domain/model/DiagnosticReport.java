package me.golemcore.orchestrator.domain.model;

import java.time.Instant;
import java.util.List;

/**
 * Snapshot of the task engine produced for operators.
 *
 * @since 1.0
 */
public record DiagnosticReport(
        Instant timestamp,
        int taskCount,
        long pendingTasks,
        long activeTasks,
        long awaitingInputTasks,
        long completedTasks,
        long failedTasks,
        int inFlightInvocations,
        List<PendingTaskSummary> pendingTaskList,
        List<String> errors) {

    public record PendingTaskSummary(String id, String title, Instant createdAt) {
    }
}
