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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A single step of a {@link Task}, bound to one {@link AgentRole}. Steps are
 * appended to their task and never reordered or removed.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TaskStep {

    private String id;
    private String description;
    private AgentRole role;
    private StepPurpose purpose;

    @Builder.Default
    private StepState state = StepState.PENDING;

    @Builder.Default
    private List<AgentMessage> messages = new ArrayList<>();

    private String result;
    private String error;
    private String userInputPrompt;
    private String userInput;
    private Instant startedAt;
    private Instant endedAt;

    /**
     * Step execution states.
     */
    public enum StepState {
        PENDING, IN_PROGRESS, AWAITING_USER_INPUT, COMPLETED, FAILED
    }

    public TaskStep copy() {
        List<AgentMessage> messageCopies = new ArrayList<>();
        for (AgentMessage message : messages) {
            messageCopies.add(AgentMessage.builder()
                    .id(message.getId())
                    .from(message.getFrom())
                    .to(message.getTo())
                    .content(message.getContent())
                    .timestamp(message.getTimestamp())
                    .build());
        }
        return toBuilder().messages(messageCopies).build();
    }
}
