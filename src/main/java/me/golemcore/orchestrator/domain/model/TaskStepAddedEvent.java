package me.golemcore.orchestrator.domain.model;

/**
 * Event published when a step is appended to a task.
 */
public record TaskStepAddedEvent(String taskId,TaskStep step){}
