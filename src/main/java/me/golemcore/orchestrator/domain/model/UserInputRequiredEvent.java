package me.golemcore.orchestrator.domain.model;

/**
 * Event published when a step paused the task to ask the user a question.
 * Consumed by channel adapters to present the prompt.
 */
public record UserInputRequiredEvent(String taskId,String stepId,String prompt){}
