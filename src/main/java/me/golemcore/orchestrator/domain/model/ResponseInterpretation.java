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

import java.util.List;

/**
 * Outcome of interpreting a step's free-text output.
 */
public record ResponseInterpretation(Kind kind, String inputPrompt, List<NextStepProposal> nextSteps) {

    public enum Kind {
        NEEDS_INPUT, NEXT_STEPS, PLAIN
    }

    public static ResponseInterpretation needsInput(String prompt) {
        return new ResponseInterpretation(Kind.NEEDS_INPUT, prompt, List.of());
    }

    public static ResponseInterpretation nextSteps(List<NextStepProposal> steps) {
        return new ResponseInterpretation(Kind.NEXT_STEPS, null, List.copyOf(steps));
    }

    public static ResponseInterpretation plain() {
        return new ResponseInterpretation(Kind.PLAIN, null, List.of());
    }

    public boolean needsInput() {
        return kind == Kind.NEEDS_INPUT;
    }
}
