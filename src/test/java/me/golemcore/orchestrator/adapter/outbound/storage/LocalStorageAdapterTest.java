package me.golemcore.orchestrator.adapter.outbound.storage;

import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class LocalStorageAdapterTest {

    private static final String STATE_DIR = "state";

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storageAdapter;

    @BeforeEach
    void setUp() {
        OrchestratorProperties properties = new OrchestratorProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());

        storageAdapter = new LocalStorageAdapter(properties);
        storageAdapter.init();
    }

    @Test
    void initCreatesKnownDirectories() {
        assertTrue(Files.isDirectory(tempDir.resolve("state")));
        assertTrue(Files.isDirectory(tempDir.resolve("records")));
    }

    @Test
    void putTextAtomicAndGetText() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(STATE_DIR, "tasks.json", "[]", false).get();

        assertEquals("[]", storageAdapter.getText(STATE_DIR, "tasks.json").get());
        assertFalse(Files.exists(tempDir.resolve("state/tasks.json.tmp")));
    }

    @Test
    void putTextAtomic_keepsBackupOfPreviousVersion() throws Exception {
        storageAdapter.putTextAtomic(STATE_DIR, "tasks.json", "v1", true).get();
        storageAdapter.putTextAtomic(STATE_DIR, "tasks.json", "v2", true).get();

        assertEquals("v2", storageAdapter.getText(STATE_DIR, "tasks.json").get());
        assertEquals("v1", Files.readString(tempDir.resolve("state/tasks.json.bak")));
    }

    @Test
    void getText_returnsNullForNonExisting() throws ExecutionException, InterruptedException {
        assertNull(storageAdapter.getText(STATE_DIR, "missing.json").get());
    }

    @Test
    void exists_reflectsWrites() throws ExecutionException, InterruptedException {
        assertFalse(storageAdapter.exists(STATE_DIR, "a.json").get());

        storageAdapter.putTextAtomic(STATE_DIR, "a.json", "{}", false).get();

        assertTrue(storageAdapter.exists(STATE_DIR, "a.json").get());
    }

    @Test
    void appendText_appendsToFile() throws ExecutionException, InterruptedException {
        storageAdapter.appendText("records", "interactions.jsonl", "{\"id\":1}\n").get();
        storageAdapter.appendText("records", "interactions.jsonl", "{\"id\":2}\n").get();

        String content = storageAdapter.getText("records", "interactions.jsonl").get();

        assertEquals("{\"id\":1}\n{\"id\":2}\n", content);
    }

    @Test
    void listObjects_returnsFilesRelativeToDirectory() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(STATE_DIR, "one.json", "1", false).get();
        storageAdapter.putTextAtomic(STATE_DIR, "nested/two.json", "2", false).get();

        List<String> files = storageAdapter.listObjects(STATE_DIR, "").get();

        assertEquals(2, files.size());
        assertTrue(files.contains("one.json"));
        assertTrue(files.contains("nested/two.json"));
        assertTrue(storageAdapter.listObjects("absent", "").get().isEmpty());
    }

    // ==================== Path traversal ====================

    @Test
    void shouldBlockPathTraversalOnWrite() {
        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> storageAdapter.putTextAtomic(STATE_DIR, "../../etc/passwd", "hack", false).get());
        assertTrue(ex.getCause() instanceof IllegalArgumentException);
    }

    @Test
    void shouldBlockPathTraversalOnRead() {
        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> storageAdapter.getText(STATE_DIR, "../../../etc/passwd").get());
        assertTrue(ex.getCause() instanceof IllegalArgumentException);
    }
}
