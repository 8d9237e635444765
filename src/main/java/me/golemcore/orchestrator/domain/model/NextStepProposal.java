package me.golemcore.orchestrator.domain.model;

/**
 * Follow-up step recognised in free-text output: the role to run it and an
 * optional description ({@code null} when the output gave none).
 */
public record NextStepProposal(AgentRole role, String description) {
}
