package me.golemcore.orchestrator.domain.model;

public record TaskFailedEvent(Task task){}
