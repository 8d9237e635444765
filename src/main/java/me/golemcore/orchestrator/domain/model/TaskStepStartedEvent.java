package me.golemcore.orchestrator.domain.model;

public record TaskStepStartedEvent(String taskId,String stepId,AgentRole role){}
