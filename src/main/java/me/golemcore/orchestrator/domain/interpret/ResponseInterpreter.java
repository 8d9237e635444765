package me.golemcore.orchestrator.domain.interpret;

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

import me.golemcore.orchestrator.domain.model.NextStepProposal;
import me.golemcore.orchestrator.domain.model.ResponseInterpretation;

import java.util.List;

/**
 * Reads free-text agent output and recovers the structure the state machine
 * acts on: a question for the user, delegation to other agents, or a numbered
 * plan.
 */
public interface ResponseInterpreter {

    /**
     * Classify an agent response. Questions for the user take precedence over
     * delegations.
     */
    ResponseInterpretation interpret(String text);

    /**
     * Agents a coordinator delegates to, in order of appearance.
     */
    List<NextStepProposal> parseNextRoles(String text);

    /**
     * Steps of a numbered plan, in order of appearance.
     */
    List<NextStepProposal> parsePlannedSteps(String text);
}
