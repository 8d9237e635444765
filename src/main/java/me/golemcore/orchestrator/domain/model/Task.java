package me.golemcore.orchestrator.domain.model;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;

/**
 * Unit of user-visible work executed by a sequence of role-bound steps. Tasks
 * move through {@link TaskState} and are retained after reaching a terminal
 * state.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Task {

    private String id;
    private String title;
    private String description;

    @Builder.Default
    private TaskState state = TaskState.PENDING;

    @Builder.Default
    private List<TaskStep> steps = new ArrayList<>();

    @Builder.Default
    private TaskContext context = new TaskContext();

    private String result;
    private String error;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant completedAt;

    /**
     * Incremented whenever an operator reset detaches in-flight processing, so
     * results of provider calls started before the reset can be recognised and
     * discarded.
     */
    private long executionEpoch;

    @JsonIgnore
    public boolean isTerminal() {
        return state == TaskState.COMPLETED || state == TaskState.FAILED;
    }

    @JsonIgnore
    public Optional<TaskStep> findStep(String stepId) {
        return steps.stream()
                .filter(s -> s.getId().equals(stepId))
                .findFirst();
    }

    @JsonIgnore
    public Optional<TaskStep> getNextPendingStep() {
        return steps.stream()
                .filter(s -> s.getState() == TaskStep.StepState.PENDING)
                .findFirst();
    }

    @JsonIgnore
    public long getCompletedStepCount() {
        return steps.stream()
                .filter(s -> s.getState() == TaskStep.StepState.COMPLETED)
                .count();
    }

    /**
     * Deep copy handed out to callers so that background processing never
     * mutates a snapshot they hold.
     */
    public Task copy() {
        List<TaskStep> stepCopies = new ArrayList<>();
        for (TaskStep step : steps) {
            stepCopies.add(step.copy());
        }
        TaskContext contextCopy = context != null
                ? context.toBuilder().userPreferences(new LinkedHashMap<>(context.getUserPreferences())).build()
                : new TaskContext();
        return toBuilder().steps(stepCopies).context(contextCopy).build();
    }

    /**
     * Task lifecycle states.
     */
    public enum TaskState {
        PENDING, PLANNING, IN_PROGRESS, AWAITING_USER_INPUT, COMPLETED, FAILED
    }
}
