package me.golemcore.orchestrator.domain.model;

/**
 * Business domain a task belongs to. Rendered into the agent context with its
 * display label.
 */
public enum BusinessType {

    TRANSPORT("Empresa de Transporte"),
    FARM("Fazenda / Agronegócio"),
    BOTH("Transporte e Agronegócio"),
    PERSONAL("Desenvolvimento Pessoal");

    private final String label;

    BusinessType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
