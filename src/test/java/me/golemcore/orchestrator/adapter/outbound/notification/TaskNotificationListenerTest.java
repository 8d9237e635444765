package me.golemcore.orchestrator.adapter.outbound.notification;

import me.golemcore.orchestrator.domain.model.Task;
import me.golemcore.orchestrator.domain.model.TaskCompletedEvent;
import me.golemcore.orchestrator.domain.model.TaskCreatedEvent;
import me.golemcore.orchestrator.domain.model.TaskFailedEvent;
import me.golemcore.orchestrator.domain.model.TaskUpdateStatus;
import me.golemcore.orchestrator.domain.model.TaskUpdatedEvent;
import me.golemcore.orchestrator.port.outbound.NotificationPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TaskNotificationListenerTest {

    private NotificationPort notificationPort;
    private TaskNotificationListener listener;

    @BeforeEach
    void setUp() {
        notificationPort = mock(NotificationPort.class);
        when(notificationPort.isEnabled()).thenReturn(true);
        listener = new TaskNotificationListener(notificationPort);
    }

    private static Task task(Task.TaskState state) {
        return Task.builder().id("t1").title("Título").state(state).build();
    }

    @Test
    void shouldForwardLifecycleEvents() {
        Task created = task(Task.TaskState.PENDING);
        Task completed = task(Task.TaskState.COMPLETED);
        Task failed = task(Task.TaskState.FAILED);

        listener.onTaskCreated(new TaskCreatedEvent(created));
        listener.onTaskCompleted(new TaskCompletedEvent(completed));
        listener.onTaskFailed(new TaskFailedEvent(failed));

        verify(notificationPort).sendUpdate(created, TaskUpdateStatus.CREATED);
        verify(notificationPort).sendUpdate(completed, TaskUpdateStatus.COMPLETED);
        verify(notificationPort).sendUpdate(failed, TaskUpdateStatus.FAILED);
    }

    @Test
    void shouldReportAwaitingInputAsItsOwnStatus() {
        Task waiting = task(Task.TaskState.AWAITING_USER_INPUT);
        Task running = task(Task.TaskState.IN_PROGRESS);

        listener.onTaskUpdated(new TaskUpdatedEvent(waiting, Task.TaskState.IN_PROGRESS));
        listener.onTaskUpdated(new TaskUpdatedEvent(running, Task.TaskState.PENDING));

        verify(notificationPort).sendUpdate(waiting, TaskUpdateStatus.AWAITING_INPUT);
        verify(notificationPort).sendUpdate(running, TaskUpdateStatus.UPDATED);
    }

    @Test
    void shouldSkipTerminalUpdatesCoveredBySpecificEvents() {
        listener.onTaskUpdated(new TaskUpdatedEvent(task(Task.TaskState.COMPLETED), Task.TaskState.IN_PROGRESS));

        verify(notificationPort, never()).sendUpdate(any(), any());
    }

    @Test
    void shouldNotSendWhenDisabled() {
        when(notificationPort.isEnabled()).thenReturn(false);

        listener.onTaskCreated(new TaskCreatedEvent(task(Task.TaskState.PENDING)));

        verify(notificationPort, never()).sendUpdate(any(), any());
    }

    @Test
    void shouldSwallowDeliveryFailures() {
        doThrow(new IllegalStateException("channel down")).when(notificationPort).sendUpdate(any(), any());

        assertDoesNotThrow(() -> listener.onTaskCreated(new TaskCreatedEvent(task(Task.TaskState.PENDING))));
    }
}
