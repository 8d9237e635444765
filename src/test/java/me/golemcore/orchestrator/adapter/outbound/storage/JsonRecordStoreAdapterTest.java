package me.golemcore.orchestrator.adapter.outbound.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.orchestrator.domain.model.AiProvider;
import me.golemcore.orchestrator.domain.model.CommandCategory;
import me.golemcore.orchestrator.domain.model.Interaction;
import me.golemcore.orchestrator.domain.model.Task;
import me.golemcore.orchestrator.infrastructure.config.AutoConfiguration;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.StoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class JsonRecordStoreAdapterTest {

    private static final TypeReference<List<Task>> TASK_LIST = new TypeReference<>() {
    };

    @TempDir
    Path tempDir;

    private JsonRecordStoreAdapter recordStore;

    @BeforeEach
    void setUp() {
        OrchestratorProperties properties = new OrchestratorProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        ObjectMapper objectMapper = AutoConfiguration.objectMapper();
        recordStore = new JsonRecordStoreAdapter(storage, objectMapper);
    }

    @Test
    void shouldSaveAndLoadSnapshot() {
        Task task = Task.builder()
                .id("task-1")
                .title("Plano de expansão")
                .createdAt(Instant.parse("2026-03-01T10:00:00Z"))
                .build();

        recordStore.save("state/tasks", List.of(task));
        List<Task> loaded = recordStore.load("state/tasks", TASK_LIST, List.of());

        assertEquals(1, loaded.size());
        assertEquals("task-1", loaded.get(0).getId());
        assertEquals(Task.TaskState.PENDING, loaded.get(0).getState());
        assertEquals(Instant.parse("2026-03-01T10:00:00Z"), loaded.get(0).getCreatedAt());
        assertEquals(true, Files.exists(tempDir.resolve("state/tasks.json")));
    }

    @Test
    void shouldReturnDefaultWhenSnapshotMissing() {
        List<Task> fallback = new ArrayList<>();

        assertSame(fallback, recordStore.load("state/tasks", TASK_LIST, fallback));
    }

    @Test
    void shouldReturnDefaultWhenSnapshotIsCorrupt() throws Exception {
        Files.writeString(tempDir.resolve("state/tasks.json"), "{not json");
        List<Task> fallback = new ArrayList<>();

        assertSame(fallback, recordStore.load("state/tasks", TASK_LIST, fallback));
    }

    @Test
    void shouldAppendJsonLines() throws Exception {
        Instant now = Instant.parse("2026-03-01T10:00:00Z");
        recordStore.append("records/interactions", new Interaction("1", now, "in", "out",
                CommandCategory.CREATIVE, AiProvider.OPENAI, AiProvider.OPENAI, 10, 0.9, true));
        recordStore.append("records/interactions", new Interaction("2", now, "in", "out",
                CommandCategory.CREATIVE, AiProvider.OPENAI, AiProvider.ANTHROPIC, 10, 0.7, true));

        List<String> lines = Files.readAllLines(tempDir.resolve("records/interactions.jsonl"));
        assertEquals(2, lines.size());
        assertEquals(true, lines.get(1).contains("\"actualProvider\":\"ANTHROPIC\""));
    }

    @Test
    void shouldSwallowStorageFailures() {
        StoragePort failing = mock(StoragePort.class);
        when(failing.putTextAtomic(anyString(), anyString(), anyString(), anyBoolean()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("disk full")));
        when(failing.appendText(anyString(), anyString(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("disk full")));
        when(failing.getText(anyString(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("disk gone")));
        JsonRecordStoreAdapter store = new JsonRecordStoreAdapter(failing, AutoConfiguration.objectMapper());

        assertDoesNotThrow(() -> store.save("state/tasks", List.of()));
        assertDoesNotThrow(() -> store.append("records/interactions", "line"));
        assertEquals(List.of(), store.load("state/tasks", TASK_LIST, List.of()));
    }

    @Test
    void shouldRejectMalformedKeys() {
        assertThrows(IllegalArgumentException.class, () -> JsonRecordStoreAdapter.RecordKey.parse("tasks"));
        assertThrows(IllegalArgumentException.class, () -> JsonRecordStoreAdapter.RecordKey.parse("state/"));
        assertEquals(new JsonRecordStoreAdapter.RecordKey("state", "tasks"),
                JsonRecordStoreAdapter.RecordKey.parse("state/tasks"));
    }
}
