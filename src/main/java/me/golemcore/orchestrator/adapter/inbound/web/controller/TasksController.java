package me.golemcore.orchestrator.adapter.inbound.web.controller;

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

import lombok.RequiredArgsConstructor;
import me.golemcore.orchestrator.domain.model.BusinessType;
import me.golemcore.orchestrator.domain.model.DiagnosticReport;
import me.golemcore.orchestrator.domain.model.ResetResult;
import me.golemcore.orchestrator.domain.model.Task;
import me.golemcore.orchestrator.domain.model.TaskContext;
import me.golemcore.orchestrator.domain.service.TaskExecutionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Multi-agent task endpoints: creation, user input, resume and operator
 * recovery.
 */
@RestController
@RequestMapping("/api/tasks")
@RequiredArgsConstructor
public class TasksController {

    private final TaskExecutionService taskExecutionService;

    @PostMapping
    public Mono<ResponseEntity<Task>> createTask(@RequestBody(required = false) CreateTaskRequest request) {
        if (request == null || request.title() == null || request.title().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "title is required");
        }
        Task task = taskExecutionService.createTask(request.title(), request.description(),
                toContext(request.context()));
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(task));
    }

    @GetMapping
    public Mono<ResponseEntity<List<Task>>> listTasks() {
        List<Task> tasks = taskExecutionService.getAllTasks().stream()
                .sorted(Comparator.comparing(Task::getCreatedAt,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .toList();
        return Mono.just(ResponseEntity.ok(tasks));
    }

    @GetMapping("/{taskId}")
    public Mono<ResponseEntity<Task>> getTask(@PathVariable String taskId) {
        return taskExecutionService.getTask(taskId)
                .map(task -> Mono.just(ResponseEntity.ok(task)))
                .orElseGet(() -> Mono.just(ResponseEntity.notFound().build()));
    }

    @PostMapping("/{taskId}/steps/{stepId}/input")
    public Mono<ResponseEntity<Task>> submitInput(@PathVariable String taskId, @PathVariable String stepId,
            @RequestBody(required = false) UserInputRequest request) {
        if (request == null || request.input() == null || request.input().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "input is required");
        }
        return Mono.just(ResponseEntity.ok(taskExecutionService.submitUserInput(taskId, stepId, request.input())));
    }

    @PostMapping("/{taskId}/resume")
    public Mono<ResponseEntity<Task>> resumeTask(@PathVariable String taskId) {
        return Mono.just(ResponseEntity.ok(taskExecutionService.resumeTask(taskId)));
    }

    @PostMapping("/reset")
    public Mono<ResponseEntity<ResetResult>> resetExecutionLoop() {
        ResetResult result = taskExecutionService.resetExecutionLoop();
        HttpStatus status = result.success() ? HttpStatus.OK : HttpStatus.INTERNAL_SERVER_ERROR;
        return Mono.just(ResponseEntity.status(status).body(result));
    }

    @GetMapping("/diagnostics")
    public Mono<ResponseEntity<DiagnosticReport>> diagnostics() {
        return Mono.just(ResponseEntity.ok(taskExecutionService.diagnose()));
    }

    private static TaskContext toContext(TaskContextDto dto) {
        if (dto == null) {
            return TaskContext.empty();
        }
        Map<String, String> preferences = dto.userPreferences() != null
                ? new LinkedHashMap<>(dto.userPreferences())
                : new LinkedHashMap<>();
        return TaskContext.builder()
                .businessType(parseBusinessType(dto.businessType()))
                .userMemory(dto.userMemory())
                .userPreferences(preferences)
                .additionalContext(dto.additionalContext())
                .build();
    }

    private static BusinessType parseBusinessType(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return BusinessType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown business type: " + value, e);
        }
    }

    public record CreateTaskRequest(String title, String description, TaskContextDto context) {
    }

    public record TaskContextDto(
            String businessType,
            String userMemory,
            Map<String, String> userPreferences,
            String additionalContext) {
    }

    public record UserInputRequest(String input) {
    }
}
