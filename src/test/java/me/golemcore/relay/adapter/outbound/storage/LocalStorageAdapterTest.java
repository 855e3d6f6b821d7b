package me.golemcore.relay.adapter.outbound.storage;

import me.golemcore.relay.infrastructure.config.RelayProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalStorageAdapterTest {

    private static final String STATE_DIR = "state";

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storageAdapter;

    @BeforeEach
    void setUp() {
        RelayProperties properties = new RelayProperties();
        properties.getStorage().setBasePath(tempDir.toString());

        storageAdapter = new LocalStorageAdapter(properties);
        storageAdapter.init();
    }

    @Test
    void shouldCreateStateDirectoriesOnInit() {
        assertTrue(Files.isDirectory(tempDir.resolve("state")));
        assertTrue(Files.isDirectory(tempDir.resolve("messages")));
        assertTrue(Files.isDirectory(tempDir.resolve("tasks")));
        assertTrue(Files.isDirectory(tempDir.resolve("email")));
    }

    @Test
    void shouldReturnNullForMissingFile() throws ExecutionException, InterruptedException {
        assertNull(storageAdapter.getText(STATE_DIR, "missing.json").get());
    }

    @Test
    void shouldReplaceFileWithoutLeavingTempFile() throws Exception {
        storageAdapter.putTextAtomic(STATE_DIR, "router_state.json", "{\"v\":1}").get();
        storageAdapter.putTextAtomic(STATE_DIR, "router_state.json", "{\"v\":2}").get();

        assertEquals("{\"v\":2}", storageAdapter.getText(STATE_DIR, "router_state.json").get());
        assertFalse(Files.exists(tempDir.resolve("state/router_state.json.tmp")));
    }

    @Test
    void shouldAppendHistoryLinesInNestedDirectory() throws ExecutionException, InterruptedException {
        storageAdapter.appendText("messages", "history/a.jsonl", "one\n").get();
        storageAdapter.appendText("messages", "history/a.jsonl", "two\n").get();

        assertEquals("one\ntwo\n", storageAdapter.getText("messages", "history/a.jsonl").get());
    }

    @Test
    void shouldBlockPathTraversal() {
        CompletionException error = assertThrows(CompletionException.class,
                () -> storageAdapter.putTextAtomic(STATE_DIR, "../../escape.txt", "x").join());

        assertInstanceOf(IllegalArgumentException.class, error.getCause());
        assertFalse(Files.exists(tempDir.getParent().resolve("escape.txt")));
    }
}
