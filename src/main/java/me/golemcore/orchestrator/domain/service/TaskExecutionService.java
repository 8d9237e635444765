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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.interpret.ResponseInterpreter;
import me.golemcore.orchestrator.domain.model.AgentRole;
import me.golemcore.orchestrator.domain.model.DiagnosticReport;
import me.golemcore.orchestrator.domain.model.InvocationOptions;
import me.golemcore.orchestrator.domain.model.InvocationResult;
import me.golemcore.orchestrator.domain.model.NextStepProposal;
import me.golemcore.orchestrator.domain.model.ResetResult;
import me.golemcore.orchestrator.domain.model.ResponseInterpretation;
import me.golemcore.orchestrator.domain.model.StepLaunch;
import me.golemcore.orchestrator.domain.model.StepPurpose;
import me.golemcore.orchestrator.domain.model.Task;
import me.golemcore.orchestrator.domain.model.TaskContext;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Drives tasks through their steps. Each task is processed by at most one
 * worker at a time; the worker runs the first pending step, interprets the
 * agent's answer, lets {@link TaskService} derive the next steps and keeps
 * going until the task completes, fails or waits for the user.
 */
@Service
@Slf4j
public class TaskExecutionService {

    private final TaskService taskService;
    private final FallbackExecutionService fallbackExecutionService;
    private final ResponseInterpreter responseInterpreter;
    private final AgentContextBuilder contextBuilder;
    private final OrchestratorProperties properties;
    private final Executor taskExecutor;
    private final Clock clock;

    public TaskExecutionService(TaskService taskService, FallbackExecutionService fallbackExecutionService,
            ResponseInterpreter responseInterpreter, AgentContextBuilder contextBuilder,
            OrchestratorProperties properties, @Qualifier("taskExecutor") Executor taskExecutor, Clock clock) {
        this.taskService = taskService;
        this.fallbackExecutionService = fallbackExecutionService;
        this.responseInterpreter = responseInterpreter;
        this.contextBuilder = contextBuilder;
        this.properties = properties;
        this.taskExecutor = taskExecutor;
        this.clock = clock;
    }

    // ==================== Public operations ====================

    /**
     * Create a task and start processing it in the background.
     *
     * @return the task as created (PENDING)
     */
    public Task createTask(String title, String description, TaskContext context) {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Task title is required");
        }
        Task task = taskService.createTask(title, description != null ? description : "", context);
        submit(task.getId(), null);
        return task;
    }

    /**
     * Answer a step that is waiting for the user and re-run it in the background.
     *
     * @return the task after the answer was recorded
     */
    public Task submitUserInput(String taskId, String stepId, String answer) {
        if (answer == null) {
            throw new IllegalArgumentException("User input is required");
        }
        StepLaunch launch = taskService.acceptUserInput(taskId, stepId, answer);
        submit(taskId, launch);
        return launch.task();
    }

    public Optional<Task> getTask(String taskId) {
        return taskService.getTask(taskId);
    }

    public List<Task> getAllTasks() {
        return taskService.getAllTasks();
    }

    /**
     * Restart processing of a PENDING task, typically after a reset or restart.
     */
    public Task resumeTask(String taskId) {
        Task task = taskService.requireResumable(taskId);
        log.info("[TaskExec] Resuming task '{}'", taskId);
        submit(taskId, null);
        return task;
    }

    /**
     * Release every running task back to PENDING and detach provider calls still
     * in flight. Released tasks are not restarted; use {@link #resumeTask}.
     */
    public ResetResult resetExecutionLoop() {
        log.warn("[TaskExec] Resetting execution loop");
        try {
            int released = taskService.releaseRunningTasks();
            fallbackExecutionService.resetSession();
            return new ResetResult(true, released, "Loop de execução reiniciado com sucesso. " + released
                    + " tarefas foram liberadas e retornadas ao estado pendente.");
        } catch (RuntimeException e) { // NOSONAR - reported to the operator instead of thrown
            log.error("[TaskExec] Reset failed", e);
            return new ResetResult(false, 0, "Erro ao reiniciar loop de execução: " + e.getMessage());
        }
    }

    public DiagnosticReport diagnose() {
        List<Task> tasks = taskService.getAllTasks();
        List<DiagnosticReport.PendingTaskSummary> pending = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        for (Task task : tasks) {
            if (task.getState() == Task.TaskState.PENDING) {
                pending.add(new DiagnosticReport.PendingTaskSummary(task.getId(), task.getTitle(),
                        task.getCreatedAt()));
            }
            if (task.getState() == Task.TaskState.FAILED && task.getError() != null) {
                errors.add("Erro na tarefa " + task.getId() + " (" + task.getTitle() + "): " + task.getError());
            }
        }
        return new DiagnosticReport(
                Instant.now(clock),
                tasks.size(),
                count(tasks, Task.TaskState.PENDING),
                count(tasks, Task.TaskState.IN_PROGRESS) + count(tasks, Task.TaskState.PLANNING),
                count(tasks, Task.TaskState.AWAITING_USER_INPUT),
                count(tasks, Task.TaskState.COMPLETED),
                count(tasks, Task.TaskState.FAILED),
                fallbackExecutionService.getInFlightCount(),
                pending,
                errors);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void resumePendingOnStartup() {
        if (!properties.getTasks().isResumeOnStartup()) {
            return;
        }
        List<String> pending = taskService.getPendingTaskIds();
        log.info("[TaskExec] Resuming {} pending tasks on startup", pending.size());
        for (String taskId : pending) {
            submit(taskId, null);
        }
    }

    // ==================== Processing loop ====================

    private void submit(String taskId, StepLaunch firstLaunch) {
        try {
            taskExecutor.execute(() -> process(taskId, firstLaunch));
        } catch (RejectedExecutionException e) {
            log.error("[TaskExec] Executor rejected task '{}', it stays in its current state until resumed",
                    taskId);
        }
    }

    void process(String taskId, StepLaunch firstLaunch) {
        try {
            StepLaunch launch = firstLaunch;
            while (true) {
                if (launch == null) {
                    Optional<StepLaunch> next = taskService.startNextStep(taskId);
                    if (next.isEmpty()) {
                        return;
                    }
                    launch = next.get();
                }
                if (!runStep(launch)) {
                    return;
                }
                launch = null;
            }
        } catch (RuntimeException e) { // NOSONAR - keep the worker alive, task left for operator reset
            log.error("[TaskExec] Processing of task '{}' aborted", taskId, e);
        }
    }

    /**
     * Run one launched step to its outcome.
     *
     * @return {@code true} when processing should continue with the next step
     */
    private boolean runStep(StepLaunch launch) {
        AgentRole role = launch.step().getRole();
        String prompt = contextBuilder.build(launch.task(), launch.step());
        log.debug("[TaskExec] Task '{}' running {} ({})", launch.taskId(), role.getId(), launch.step().getPurpose());

        InvocationOptions options = InvocationOptions.builder()
                .systemPrompt(role.getSystemPrompt())
                .build();
        InvocationResult result = fallbackExecutionService.invoke(prompt, role.getCategory(), options);

        if (result.isFallback()) {
            return taskService.failStep(launch, result.text());
        }

        ResponseInterpretation interpretation = responseInterpreter.interpret(result.text());
        if (interpretation.needsInput()) {
            taskService.awaitUserInput(launch, result.text(), interpretation.inputPrompt());
            return false;
        }

        List<NextStepProposal> proposals = proposalsFor(launch.step().getPurpose(), result.text(), interpretation);
        return taskService.completeStep(launch, result.text(), proposals);
    }

    private List<NextStepProposal> proposalsFor(StepPurpose purpose, String text,
            ResponseInterpretation interpretation) {
        return switch (purpose) {
        case PLAN -> responseInterpreter.parsePlannedSteps(text);
        case ANALYZE, RECOVER, REVIEW, EVALUATE -> interpretation.nextSteps();
        case WORK -> List.of();
        };
    }

    private static long count(List<Task> tasks, Task.TaskState state) {
        return tasks.stream().filter(t -> t.getState() == state).count();
    }
}
