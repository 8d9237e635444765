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

/**
 * Why a step was appended to its task. The state machine derives follow-up
 * steps from the purpose of the step that just finished.
 */
public enum StepPurpose {

    /** Initial coordinator pass over a new task. */
    ANALYZE,

    /** Planner breaking the task into role-bound steps. */
    PLAN,

    /** Specialist work. */
    WORK,

    /** Coordinator reviewing a plan that could not be parsed. */
    REVIEW,

    /** Coordinator judging worker output and deciding whether to finish. */
    EVALUATE,

    /** Coordinator handling a failed step. */
    RECOVER;

    /**
     * A closing pass that finishes the task when it recommends no further roles.
     */
    public boolean isFinalPass() {
        return this == REVIEW || this == EVALUATE;
    }
}
