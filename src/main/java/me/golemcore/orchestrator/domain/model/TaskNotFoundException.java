package me.golemcore.orchestrator.domain.model;

/**
 * Raised when a task or step id does not exist.
 */
public class TaskNotFoundException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public TaskNotFoundException(String message) {
        super(message);
    }
}
