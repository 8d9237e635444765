package me.golemcore.orchestrator.domain.model;

public record TaskStepCompletedEvent(String taskId,String stepId,String result){}
