package me.golemcore.orchestrator.domain.model;

/**
 * A step that has just been moved to IN_PROGRESS, together with the task
 * snapshot it was started from and the execution epoch it belongs to. Results
 * are only applied while the task is still in the same epoch.
 */
public record StepLaunch(Task task, TaskStep step, long epoch) {

    public String taskId() {
        return task.getId();
    }

    public String stepId() {
        return step.getId();
    }
}
