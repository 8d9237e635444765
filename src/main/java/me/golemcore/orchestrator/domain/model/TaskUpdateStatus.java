package me.golemcore.orchestrator.domain.model;

/**
 * Kind of task update delivered to the notification sink.
 */
public enum TaskUpdateStatus {
    CREATED, UPDATED, AWAITING_INPUT, COMPLETED, FAILED
}
