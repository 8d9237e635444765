package me.golemcore.orchestrator.domain.model;

public record TaskStepFailedEvent(String taskId,String stepId,String error){}
