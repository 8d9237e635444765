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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.Task;
import me.golemcore.orchestrator.domain.model.TaskCompletedEvent;
import me.golemcore.orchestrator.domain.model.TaskCreatedEvent;
import me.golemcore.orchestrator.domain.model.TaskFailedEvent;
import me.golemcore.orchestrator.domain.model.TaskUpdateStatus;
import me.golemcore.orchestrator.domain.model.TaskUpdatedEvent;
import me.golemcore.orchestrator.port.outbound.NotificationPort;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Forwards task lifecycle events to the {@link NotificationPort}. Delivery
 * failures are logged and never reach the task state machine.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TaskNotificationListener {

    private final NotificationPort notificationPort;

    @EventListener
    public void onTaskCreated(TaskCreatedEvent event) {
        send(event.task(), TaskUpdateStatus.CREATED);
    }

    @EventListener
    public void onTaskUpdated(TaskUpdatedEvent event) {
        // terminal states are reported by their own events
        Task.TaskState state = event.task().getState();
        if (state == Task.TaskState.COMPLETED || state == Task.TaskState.FAILED) {
            return;
        }
        TaskUpdateStatus status = state == Task.TaskState.AWAITING_USER_INPUT
                ? TaskUpdateStatus.AWAITING_INPUT
                : TaskUpdateStatus.UPDATED;
        send(event.task(), status);
    }

    @EventListener
    public void onTaskCompleted(TaskCompletedEvent event) {
        send(event.task(), TaskUpdateStatus.COMPLETED);
    }

    @EventListener
    public void onTaskFailed(TaskFailedEvent event) {
        send(event.task(), TaskUpdateStatus.FAILED);
    }

    private void send(Task task, TaskUpdateStatus status) {
        if (!notificationPort.isEnabled()) {
            return;
        }
        try {
            notificationPort.sendUpdate(task, status);
        } catch (RuntimeException e) { // NOSONAR - notifications are best effort
            log.warn("[Notify] Failed to send {} update for task '{}': {}", status, task.getId(), e.getMessage());
        }
    }
}
