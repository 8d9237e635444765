package me.golemcore.orchestrator.domain.model;

public record UserInputReceivedEvent(String taskId,String stepId,String input){}
