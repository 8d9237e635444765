package me.golemcore.orchestrator.domain.model;

/**
 * Event published when a task has been created, before processing starts.
 */
public record TaskCreatedEvent(Task task){}
