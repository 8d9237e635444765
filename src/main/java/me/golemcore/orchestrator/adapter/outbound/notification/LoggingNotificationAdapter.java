package me.golemcore.orchestrator.adapter.outbound.notification;

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
import me.golemcore.orchestrator.domain.model.Task;
import me.golemcore.orchestrator.domain.model.TaskStep;
import me.golemcore.orchestrator.domain.model.TaskUpdateStatus;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.NotificationPort;
import org.springframework.stereotype.Component;

/**
 * Notification sink that writes a formatted task summary to the application
 * log. Chat integrations replace this bean with their own
 * {@link NotificationPort}.
 */
@Component
@Slf4j
public class LoggingNotificationAdapter implements NotificationPort {

    private final OrchestratorProperties properties;

    public LoggingNotificationAdapter(OrchestratorProperties properties) {
        this.properties = properties;
    }

    @Override
    public boolean isEnabled() {
        return properties.getNotifications().isEnabled();
    }

    @Override
    public void sendUpdate(Task task, TaskUpdateStatus status) {
        log.info("[Notify] {}", format(task, status));
    }

    String format(Task task, TaskUpdateStatus status) {
        StringBuilder sb = new StringBuilder();
        sb.append(headline(status)).append(": ").append(task.getTitle())
                .append(" [").append(stateLabel(task.getState())).append("]");
        if (task.getDescription() != null && !task.getDescription().isBlank()) {
            sb.append("\n").append(task.getDescription());
        }
        if (!task.getSteps().isEmpty()) {
            sb.append("\nEtapas:");
            for (TaskStep step : task.getSteps()) {
                sb.append("\n- ").append(step.getDescription()).append(" (").append(step.getState()).append(")");
            }
        }
        if (status == TaskUpdateStatus.FAILED && task.getError() != null) {
            sb.append("\nErro: ").append(task.getError());
        }
        return sb.toString();
    }

    private static String headline(TaskUpdateStatus status) {
        return switch (status) {
        case CREATED -> "Nova tarefa criada";
        case UPDATED -> "Tarefa atualizada";
        case AWAITING_INPUT -> "Tarefa aguardando input";
        case COMPLETED -> "Tarefa concluída";
        case FAILED -> "Tarefa falhou";
        };
    }

    static String stateLabel(Task.TaskState state) {
        return switch (state) {
        case PENDING -> "Pendente";
        case PLANNING -> "Em Planejamento";
        case IN_PROGRESS -> "Em Andamento";
        case AWAITING_USER_INPUT -> "Aguardando Input do Usuário";
        case COMPLETED -> "Concluída";
        case FAILED -> "Falhou";
        };
    }
}
