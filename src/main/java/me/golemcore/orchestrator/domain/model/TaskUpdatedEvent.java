package me.golemcore.orchestrator.domain.model;

/**
 * Event published on task-level state changes not covered by a more specific
 * event (processing started, operator reset).
 */
public record TaskUpdatedEvent(Task task,Task.TaskState previousState){}
