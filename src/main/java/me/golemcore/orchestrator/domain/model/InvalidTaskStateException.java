package me.golemcore.orchestrator.domain.model;

/**
 * Raised when an operation does not apply to the current state of a task or
 * step, for example answering a step that is not awaiting user input.
 */
public class InvalidTaskStateException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public InvalidTaskStateException(String message) {
        super(message);
    }
}
