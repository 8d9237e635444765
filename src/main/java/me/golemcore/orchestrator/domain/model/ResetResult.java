package me.golemcore.orchestrator.domain.model;

/**
 * Outcome of an operator execution-loop reset.
 */
public record ResetResult(boolean success, int releasedTasks, String message) {
}
