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

import me.golemcore.orchestrator.domain.model.AgentMessage;
import me.golemcore.orchestrator.domain.model.Task;
import me.golemcore.orchestrator.domain.model.TaskContext;
import me.golemcore.orchestrator.domain.model.TaskStep;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Builds the prompt handed to an agent for one step: the task, the user's
 * business context, a digest of completed steps and the conversation of the
 * current step.
 */
@Component
public class AgentContextBuilder {

    private static final String NO_RESULT = "Sem resultado";
    private static final String ELLIPSIS = "...";

    private final OrchestratorProperties properties;

    public AgentContextBuilder(OrchestratorProperties properties) {
        this.properties = properties;
    }

    public String build(Task task, TaskStep step) {
        StringBuilder sb = new StringBuilder();
        sb.append("TAREFA: ").append(task.getTitle()).append('\n');
        sb.append("DESCRIÇÃO: ").append(task.getDescription()).append("\n\n");

        TaskContext context = task.getContext() != null ? task.getContext() : TaskContext.empty();
        if (context.getBusinessType() != null) {
            sb.append("TIPO DE NEGÓCIO: ").append(context.getBusinessType().getLabel()).append("\n\n");
        }
        if (hasText(context.getUserMemory())) {
            sb.append("CONTEXTO DO USUÁRIO:\n").append(context.getUserMemory()).append("\n\n");
        }
        if (context.getUserPreferences() != null && !context.getUserPreferences().isEmpty()) {
            sb.append("PREFERÊNCIAS DO USUÁRIO:\n");
            for (Map.Entry<String, String> entry : context.getUserPreferences().entrySet()) {
                sb.append("- ").append(entry.getKey()).append(": ").append(entry.getValue()).append('\n');
            }
            sb.append('\n');
        }
        if (hasText(context.getAdditionalContext())) {
            sb.append("CONTEXTO ADICIONAL:\n").append(context.getAdditionalContext()).append("\n\n");
        }

        if (task.getSteps().size() > 1) {
            sb.append("HISTÓRICO DE ETAPAS:\n");
            for (TaskStep previous : task.getSteps()) {
                if (previous.getId().equals(step.getId())
                        || previous.getState() != TaskStep.StepState.COMPLETED) {
                    continue;
                }
                sb.append("- ").append(previous.getDescription())
                        .append(" (").append(previous.getRole().getId()).append("): ")
                        .append(preview(previous.getResult()))
                        .append('\n');
            }
            sb.append('\n');
        }

        if (!step.getMessages().isEmpty()) {
            sb.append("MENSAGENS ANTERIORES NESTA ETAPA:\n");
            for (AgentMessage message : step.getMessages()) {
                sb.append('[').append(message.getFrom()).append(" -> ").append(message.getTo()).append("]: ")
                        .append(message.getContent()).append('\n');
            }
            sb.append('\n');
        }

        if (hasText(step.getUserInput())) {
            sb.append("INPUT DO USUÁRIO: ").append(step.getUserInput()).append("\n\n");
        }

        sb.append("ETAPA ATUAL: ").append(step.getDescription()).append('\n');
        return sb.toString();
    }

    private String preview(String result) {
        if (result == null || result.isEmpty()) {
            return NO_RESULT;
        }
        int limit = properties.getTasks().getResultPreviewLength();
        if (result.length() <= limit) {
            return result;
        }
        return result.substring(0, limit) + ELLIPSIS;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
