package me.golemcore.orchestrator.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.AgentMessage;
import me.golemcore.orchestrator.domain.model.AgentRole;
import me.golemcore.orchestrator.domain.model.InvalidTaskStateException;
import me.golemcore.orchestrator.domain.model.NextStepProposal;
import me.golemcore.orchestrator.domain.model.StepLaunch;
import me.golemcore.orchestrator.domain.model.StepPurpose;
import me.golemcore.orchestrator.domain.model.Task;
import me.golemcore.orchestrator.domain.model.TaskCompletedEvent;
import me.golemcore.orchestrator.domain.model.TaskContext;
import me.golemcore.orchestrator.domain.model.TaskCreatedEvent;
import me.golemcore.orchestrator.domain.model.TaskFailedEvent;
import me.golemcore.orchestrator.domain.model.TaskNotFoundException;
import me.golemcore.orchestrator.domain.model.TaskStep;
import me.golemcore.orchestrator.domain.model.TaskStepAddedEvent;
import me.golemcore.orchestrator.domain.model.TaskStepCompletedEvent;
import me.golemcore.orchestrator.domain.model.TaskStepFailedEvent;
import me.golemcore.orchestrator.domain.model.TaskStepStartedEvent;
import me.golemcore.orchestrator.domain.model.TaskUpdatedEvent;
import me.golemcore.orchestrator.domain.model.UserInputReceivedEvent;
import me.golemcore.orchestrator.domain.model.UserInputRequiredEvent;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.infrastructure.event.SpringEventBus;
import me.golemcore.orchestrator.port.outbound.RecordStorePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Owner of all task state. Every mutation runs under this service's monitor,
 * is persisted immediately and publishes its lifecycle events after the
 * monitor is released. Callers only ever see deep copies.
 *
 * <p>
 * Step derivation rules live here so that deciding what comes next and
 * appending it is a single atomic transition.
 */
@Service
@Slf4j
public class TaskService {

    static final String TASKS_KEY = "state/tasks";

    static final String INITIAL_STEP_DESCRIPTION = "Analisar tarefa e planejar abordagem";
    static final String PLAN_STEP_DESCRIPTION = "Desenvolver plano detalhado";
    static final String REVIEW_STEP_DESCRIPTION = "Revisar plano e determinar próximos passos";
    static final String EVALUATE_STEP_DESCRIPTION = "Avaliar resultado e determinar próximos passos";
    static final String SYNTHESIZE_STEP_DESCRIPTION = "Finalizar e sintetizar resultados";
    static final String RECOVER_STEP_DESCRIPTION = "Lidar com falha e determinar abordagem alternativa";
    static final String RESET_MESSAGE = "Sistema reiniciado após travamento. Retomando execução...";

    private static final TypeReference<List<Task>> TASK_LIST_TYPE = new TypeReference<>() {
    };

    private final RecordStorePort recordStore;
    private final SpringEventBus eventBus;
    private final OrchestratorProperties properties;
    private final Clock clock;

    private final Map<String, Task> tasks = new LinkedHashMap<>();

    public TaskService(RecordStorePort recordStore, SpringEventBus eventBus, OrchestratorProperties properties,
            Clock clock) {
        this.recordStore = recordStore;
        this.eventBus = eventBus;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        List<Task> loaded = recordStore.load(TASKS_KEY, TASK_LIST_TYPE, List.of());
        synchronized (this) {
            tasks.clear();
            for (Task task : loaded) {
                tasks.put(task.getId(), task);
            }
            recoverRuntimeState();
        }
        log.info("[Tasks] Loaded {} tasks", loaded.size());
    }

    // ==================== Queries ====================

    public synchronized Optional<Task> getTask(String taskId) {
        Task task = tasks.get(taskId);
        return task != null ? Optional.of(task.copy()) : Optional.empty();
    }

    public synchronized List<Task> getAllTasks() {
        List<Task> copies = new ArrayList<>(tasks.size());
        for (Task task : tasks.values()) {
            copies.add(task.copy());
        }
        return copies;
    }

    // ==================== Creation ====================

    public Task createTask(String title, String description, TaskContext context) {
        Events events = new Events();
        Task snapshot;
        synchronized (this) {
            Instant now = Instant.now(clock);
            Task task = Task.builder()
                    .id(UUID.randomUUID().toString())
                    .title(title)
                    .description(description)
                    .context(context != null ? context : TaskContext.empty())
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            tasks.put(task.getId(), task);
            appendStep(task, AgentRole.COORDINATOR, StepPurpose.ANALYZE, INITIAL_STEP_DESCRIPTION, events);
            save();
            snapshot = task.copy();
            events.addFirst(new TaskCreatedEvent(task.copy()));
            log.info("[Tasks] Created task '{}' ({})", task.getId(), title);
        }
        events.publish();
        return snapshot;
    }

    // ==================== Step transitions ====================

    /**
     * Move the first PENDING step of the task to IN_PROGRESS.
     *
     * @return empty when the task is terminal, waiting for the user, already
     *         running a step, or has nothing left to run
     */
    public Optional<StepLaunch> startNextStep(String taskId) {
        Events events = new Events();
        StepLaunch launch;
        synchronized (this) {
            Task task = requireTask(taskId);
            if (task.isTerminal() || task.getState() == Task.TaskState.AWAITING_USER_INPUT) {
                return Optional.empty();
            }
            boolean running = task.getSteps().stream()
                    .anyMatch(s -> s.getState() == TaskStep.StepState.IN_PROGRESS);
            if (running) {
                log.debug("[Tasks] Task '{}' already has a running step", taskId);
                return Optional.empty();
            }
            Optional<TaskStep> next = task.getNextPendingStep();
            if (next.isEmpty()) {
                log.warn("[Tasks] Task '{}' has no pending step in state {}", taskId, task.getState());
                return Optional.empty();
            }
            TaskStep step = next.get();
            step.setState(TaskStep.StepState.IN_PROGRESS);
            step.setStartedAt(Instant.now(clock));
            changeState(task, step.getPurpose() == StepPurpose.PLAN
                    ? Task.TaskState.PLANNING
                    : Task.TaskState.IN_PROGRESS, events);
            touch(task);
            save();
            events.add(new TaskStepStartedEvent(taskId, step.getId(), step.getRole()));
            launch = new StepLaunch(task.copy(), step.copy(), task.getExecutionEpoch());
            log.info("[Tasks] Task '{}' step started: {} ({})", taskId, step.getDescription(),
                    step.getRole().getId());
        }
        events.publish();
        return Optional.of(launch);
    }

    /**
     * Record the user's answer for a step that is waiting for it and move the
     * step back to IN_PROGRESS.
     *
     * @throws TaskNotFoundException
     *             unknown task or step
     * @throws InvalidTaskStateException
     *             the step is not waiting for user input
     */
    public StepLaunch acceptUserInput(String taskId, String stepId, String answer) {
        Events events = new Events();
        StepLaunch launch;
        synchronized (this) {
            Task task = requireTask(taskId);
            TaskStep step = task.findStep(stepId)
                    .orElseThrow(() -> new TaskNotFoundException("Step not found: " + stepId));
            if (step.getState() != TaskStep.StepState.AWAITING_USER_INPUT) {
                throw new InvalidTaskStateException(
                        "Step " + stepId + " is not awaiting user input (state: " + step.getState() + ")");
            }
            Instant now = Instant.now(clock);
            step.setUserInput(answer);
            step.getMessages().add(message(AgentMessage.USER, step.getRole().getId(), answer, now));
            step.setState(TaskStep.StepState.IN_PROGRESS);
            changeState(task, Task.TaskState.IN_PROGRESS, events);
            touch(task);
            save();
            events.addFirst(new UserInputReceivedEvent(taskId, stepId, answer));
            launch = new StepLaunch(task.copy(), step.copy(), task.getExecutionEpoch());
            log.info("[Tasks] Task '{}' received user input for step '{}'", taskId, stepId);
        }
        events.publish();
        return launch;
    }

    /**
     * Park the step until the user answers.
     *
     * @return {@code false} when the result was discarded as stale
     */
    public boolean awaitUserInput(StepLaunch launch, String response, String prompt) {
        Events events = new Events();
        synchronized (this) {
            Optional<TaskStep> current = currentStep(launch);
            if (current.isEmpty()) {
                return false;
            }
            Task task = tasks.get(launch.taskId());
            TaskStep step = current.get();
            step.getMessages().add(message(step.getRole().getId(), AgentMessage.USER, response, Instant.now(clock)));
            step.setUserInputPrompt(prompt);
            step.setState(TaskStep.StepState.AWAITING_USER_INPUT);
            changeState(task, Task.TaskState.AWAITING_USER_INPUT, events);
            touch(task);
            save();
            events.addFirst(new UserInputRequiredEvent(task.getId(), step.getId(), prompt));
            log.info("[Tasks] Task '{}' awaiting user input on step '{}'", task.getId(), step.getId());
        }
        events.publish();
        return true;
    }

    /**
     * Complete the running step and derive what follows from its purpose.
     *
     * @param proposals
     *            roles or planned steps parsed from the result
     * @return {@code true} when the task can continue with another step
     */
    public boolean completeStep(StepLaunch launch, String result, List<NextStepProposal> proposals) {
        Events events = new Events();
        boolean continueProcessing;
        synchronized (this) {
            Optional<TaskStep> current = currentStep(launch);
            if (current.isEmpty()) {
                return false;
            }
            Task task = tasks.get(launch.taskId());
            TaskStep step = current.get();
            step.setState(TaskStep.StepState.COMPLETED);
            step.setResult(result);
            step.setEndedAt(Instant.now(clock));
            events.add(new TaskStepCompletedEvent(task.getId(), step.getId(), result));
            log.info("[Tasks] Task '{}' step completed: {}", task.getId(), step.getDescription());

            deriveNextSteps(task, step, proposals != null ? proposals : List.of(), events);
            touch(task);
            save();
            continueProcessing = !task.isTerminal();
        }
        events.publish();
        return continueProcessing;
    }

    /**
     * Fail the running step. A later pending step runs next; otherwise a recovery
     * step is appended, unless the failed step was the recovery itself.
     *
     * @return {@code true} when the task can continue with another step
     */
    public boolean failStep(StepLaunch launch, String error) {
        Events events = new Events();
        boolean continueProcessing;
        synchronized (this) {
            Optional<TaskStep> current = currentStep(launch);
            if (current.isEmpty()) {
                return false;
            }
            Task task = tasks.get(launch.taskId());
            TaskStep step = current.get();
            step.setState(TaskStep.StepState.FAILED);
            step.setError(error);
            step.setEndedAt(Instant.now(clock));
            events.add(new TaskStepFailedEvent(task.getId(), step.getId(), error));
            log.warn("[Tasks] Task '{}' step failed: {} ({})", task.getId(), step.getDescription(), error);

            if (hasLaterPendingStep(task, step)) {
                log.debug("[Tasks] Task '{}' continues with the next pending step", task.getId());
            } else if (step.getPurpose() == StepPurpose.RECOVER) {
                failTask(task, "Falha na etapa: " + step.getDescription(), events);
            } else {
                appendSteps(task, List.of(new NewStep(AgentRole.COORDINATOR, StepPurpose.RECOVER,
                        RECOVER_STEP_DESCRIPTION)), events);
            }
            touch(task);
            save();
            continueProcessing = !task.isTerminal();
        }
        events.publish();
        return continueProcessing;
    }

    // ==================== Operator actions ====================

    /**
     * Validate that a task can be resumed.
     *
     * @throws TaskNotFoundException
     *             unknown task
     * @throws InvalidTaskStateException
     *             the task is not PENDING
     */
    public synchronized Task requireResumable(String taskId) {
        Task task = requireTask(taskId);
        if (task.getState() != Task.TaskState.PENDING) {
            throw new InvalidTaskStateException(
                    "Task " + taskId + " cannot be resumed from state " + task.getState());
        }
        return task.copy();
    }

    /**
     * Return every running task to PENDING and detach in-flight processing by
     * advancing its execution epoch.
     *
     * @return number of tasks released
     */
    public int releaseRunningTasks() {
        Events events = new Events();
        int released = 0;
        synchronized (this) {
            Instant now = Instant.now(clock);
            for (Task task : tasks.values()) {
                if (task.getState() != Task.TaskState.IN_PROGRESS && task.getState() != Task.TaskState.PLANNING) {
                    continue;
                }
                task.setExecutionEpoch(task.getExecutionEpoch() + 1);
                TaskStep noticeStep = null;
                for (TaskStep step : task.getSteps()) {
                    if (step.getState() == TaskStep.StepState.IN_PROGRESS) {
                        step.setState(TaskStep.StepState.PENDING);
                        step.setStartedAt(null);
                        noticeStep = step;
                    }
                }
                if (noticeStep == null) {
                    noticeStep = task.getNextPendingStep().orElse(null);
                }
                if (noticeStep != null) {
                    noticeStep.getMessages().add(message(AgentMessage.SYSTEM, AgentMessage.USER, RESET_MESSAGE, now));
                }
                changeState(task, Task.TaskState.PENDING, events);
                touch(task);
                released++;
                log.warn("[Tasks] Released running task '{}' back to PENDING", task.getId());
            }
            if (released > 0) {
                save();
            }
        }
        events.publish();
        return released;
    }

    public synchronized List<String> getPendingTaskIds() {
        return tasks.values().stream()
                .filter(t -> t.getState() == Task.TaskState.PENDING)
                .map(Task::getId)
                .toList();
    }

    // ==================== Derivation ====================

    private void deriveNextSteps(Task task, TaskStep step, List<NextStepProposal> proposals, Events events) {
        switch (step.getPurpose()) {
        case WORK -> {
            if (!hasLaterPendingStep(task, step)) {
                String description = workBatchSize(task, step) > 1
                        ? SYNTHESIZE_STEP_DESCRIPTION
                        : EVALUATE_STEP_DESCRIPTION;
                appendSteps(task, List.of(new NewStep(AgentRole.COORDINATOR, StepPurpose.EVALUATE, description)),
                        events);
            }
        }
        case ANALYZE, RECOVER -> {
            if (proposals.isEmpty()) {
                appendSteps(task, List.of(new NewStep(AgentRole.PLANNER, StepPurpose.PLAN, PLAN_STEP_DESCRIPTION)),
                        events);
            } else {
                appendSteps(task, toNewSteps(proposals), events);
            }
        }
        case PLAN -> {
            if (proposals.isEmpty()) {
                appendSteps(task, List.of(new NewStep(AgentRole.COORDINATOR, StepPurpose.REVIEW,
                        REVIEW_STEP_DESCRIPTION)), events);
            } else {
                appendSteps(task, toNewSteps(proposals), events);
            }
        }
        case REVIEW, EVALUATE -> {
            if (!proposals.isEmpty()) {
                appendSteps(task, toNewSteps(proposals), events);
            } else if (!hasLaterPendingStep(task, step)) {
                completeTask(task, step.getResult(), events);
            }
        }
        default -> throw new IllegalStateException("Unknown step purpose: " + step.getPurpose());
        }
    }

    private List<NewStep> toNewSteps(List<NextStepProposal> proposals) {
        List<NewStep> newSteps = new ArrayList<>(proposals.size());
        for (NextStepProposal proposal : proposals) {
            AgentRole role = proposal.role();
            String description = proposal.description() != null && !proposal.description().isBlank()
                    ? proposal.description()
                    : "Executar tarefa como " + role.getDisplayName();
            newSteps.add(new NewStep(role, purposeFor(role), description));
        }
        return newSteps;
    }

    static StepPurpose purposeFor(AgentRole role) {
        if (role.isPlanning()) {
            return StepPurpose.PLAN;
        }
        if (role.isClosing()) {
            return StepPurpose.EVALUATE;
        }
        return StepPurpose.WORK;
    }

    private boolean hasLaterPendingStep(Task task, TaskStep step) {
        List<TaskStep> steps = task.getSteps();
        int index = steps.indexOf(step);
        for (int i = index + 1; i < steps.size(); i++) {
            if (steps.get(i).getState() == TaskStep.StepState.PENDING) {
                return true;
            }
        }
        return false;
    }

    private int workBatchSize(Task task, TaskStep step) {
        List<TaskStep> steps = task.getSteps();
        int count = 0;
        for (int i = steps.indexOf(step); i >= 0; i--) {
            if (steps.get(i).getPurpose() != StepPurpose.WORK) {
                break;
            }
            count++;
        }
        return count;
    }

    private void appendSteps(Task task, List<NewStep> newSteps, Events events) {
        int limit = properties.getTasks().getMaxStepsPerTask();
        if (task.getSteps().size() + newSteps.size() > limit) {
            log.warn("[Tasks] Task '{}' reached the step limit ({})", task.getId(), limit);
            failTask(task, "Limite de etapas atingido (" + limit + ")", events);
            return;
        }
        for (NewStep newStep : newSteps) {
            appendStep(task, newStep.role(), newStep.purpose(), newStep.description(), events);
        }
    }

    private void appendStep(Task task, AgentRole role, StepPurpose purpose, String description, Events events) {
        TaskStep step = TaskStep.builder()
                .id(UUID.randomUUID().toString())
                .description(description)
                .role(role)
                .purpose(purpose)
                .build();
        task.getSteps().add(step);
        events.add(new TaskStepAddedEvent(task.getId(), step.copy()));
        log.debug("[Tasks] Task '{}' step added: {} ({}, {})", task.getId(), description, role.getId(), purpose);
    }

    private void completeTask(Task task, String result, Events events) {
        task.setResult(result);
        task.setCompletedAt(Instant.now(clock));
        changeState(task, Task.TaskState.COMPLETED, events);
        events.add(new TaskCompletedEvent(task.copy()));
        log.info("[Tasks] Task '{}' completed ({} steps)", task.getId(), task.getSteps().size());
    }

    private void failTask(Task task, String error, Events events) {
        task.setError(error);
        changeState(task, Task.TaskState.FAILED, events);
        events.add(new TaskFailedEvent(task.copy()));
        log.warn("[Tasks] Task '{}' failed: {}", task.getId(), error);
    }

    // ==================== Helpers ====================

    private Task requireTask(String taskId) {
        Task task = tasks.get(taskId);
        if (task == null) {
            throw new TaskNotFoundException("Task not found: " + taskId);
        }
        return task;
    }

    /**
     * The launched step, if its result may still be applied: the task is in the
     * same epoch and the step is still running.
     */
    private Optional<TaskStep> currentStep(StepLaunch launch) {
        Task task = tasks.get(launch.taskId());
        if (task == null || task.getExecutionEpoch() != launch.epoch()) {
            log.info("[Tasks] Discarding stale result for task '{}' step '{}'", launch.taskId(), launch.stepId());
            return Optional.empty();
        }
        Optional<TaskStep> step = task.findStep(launch.stepId());
        if (step.isEmpty() || step.get().getState() != TaskStep.StepState.IN_PROGRESS) {
            log.info("[Tasks] Step '{}' of task '{}' is no longer running, result discarded", launch.stepId(),
                    launch.taskId());
            return Optional.empty();
        }
        return step;
    }

    private void changeState(Task task, Task.TaskState newState, Events events) {
        Task.TaskState previous = task.getState();
        if (previous == newState) {
            return;
        }
        task.setState(newState);
        events.add(new TaskUpdatedEvent(task.copy(), previous));
    }

    private void touch(Task task) {
        task.setUpdatedAt(Instant.now(clock));
    }

    private AgentMessage message(String from, String to, String content, Instant timestamp) {
        return AgentMessage.builder()
                .id(UUID.randomUUID().toString())
                .from(from)
                .to(to)
                .content(content)
                .timestamp(timestamp)
                .build();
    }

    private void recoverRuntimeState() {
        boolean changed = false;
        Instant now = Instant.now(clock);
        for (Task task : tasks.values()) {
            if (task.getState() != Task.TaskState.IN_PROGRESS && task.getState() != Task.TaskState.PLANNING) {
                continue;
            }
            for (TaskStep step : task.getSteps()) {
                if (step.getState() == TaskStep.StepState.IN_PROGRESS) {
                    step.setState(TaskStep.StepState.PENDING);
                    step.setStartedAt(null);
                    step.getMessages().add(message(AgentMessage.SYSTEM, AgentMessage.USER, RESET_MESSAGE, now));
                }
            }
            task.setState(Task.TaskState.PENDING);
            task.setUpdatedAt(now);
            changed = true;
            log.warn("[Tasks] Recovered stale running task '{}' as PENDING", task.getId());
        }
        if (changed) {
            save();
        }
    }

    private void save() {
        recordStore.save(TASKS_KEY, new ArrayList<>(tasks.values()));
    }

    private record NewStep(AgentRole role, StepPurpose purpose, String description) {
    }

    /**
     * Events collected inside the monitor and published after it is released.
     */
    private final class Events {

        private final List<Object> pending = new ArrayList<>();

        void add(Object event) {
            pending.add(event);
        }

        void addFirst(Object event) {
            pending.add(0, event);
        }

        void publish() {
            for (Object event : pending) {
                eventBus.publish(event);
            }
        }
    }
}
