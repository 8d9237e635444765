package me.golemcore.orchestrator.domain.model;

/**
 * Event published when a task reaches {@link Task.TaskState#COMPLETED}.
 */
public record TaskCompletedEvent(Task task){}
