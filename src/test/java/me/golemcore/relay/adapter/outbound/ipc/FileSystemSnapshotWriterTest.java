package me.golemcore.relay.adapter.outbound.ipc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.relay.infrastructure.config.AutoConfiguration;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class FileSystemSnapshotWriterTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = AutoConfiguration.objectMapper();
    private FileSystemSnapshotWriter writer;

    @BeforeEach
    void setUp() {
        RelayProperties properties = new RelayProperties();
        properties.getIpc().setDirectory(tempDir.toString());
        writer = new FileSystemSnapshotWriter(properties, objectMapper);
    }

    @Test
    void shouldReplaceTasksSnapshot() throws Exception {
        writer.writeTasksSnapshot("family", List.of(Map.of("id", "task-1")));
        writer.writeTasksSnapshot("family", List.of(Map.of("id", "task-2"), Map.of("id", "task-3")));

        Path file = tempDir.resolve("family").resolve(FileSystemSnapshotWriter.TASKS_SNAPSHOT);
        JsonNode tasks = objectMapper.readTree(Files.readString(file));
        assertEquals(2, tasks.size());
        assertEquals("task-2", tasks.get(0).get("id").asText());
        assertFalse(Files.exists(file.resolveSibling(FileSystemSnapshotWriter.TASKS_SNAPSHOT + ".tmp")));
    }

    @Test
    void shouldWrapGroupsSnapshot() throws Exception {
        writer.writeGroupsSnapshot("main", List.of(Map.of("jid", "120363@g.us")));

        JsonNode snapshot = objectMapper.readTree(
                Files.readString(tempDir.resolve("main").resolve(FileSystemSnapshotWriter.GROUPS_SNAPSHOT)));
        assertEquals("120363@g.us", snapshot.get("groups").get(0).get("jid").asText());
    }

    @Test
    void shouldRefuseFolderOutsideIpcRoot() {
        assertThrows(IllegalArgumentException.class, () -> writer.writeTasksSnapshot("../escape", List.of()));
    }
}
