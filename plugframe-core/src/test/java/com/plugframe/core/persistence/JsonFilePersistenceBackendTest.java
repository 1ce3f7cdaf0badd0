package com.plugframe.core.persistence;

import com.plugframe.api.plugin.StateBlob;
import com.plugframe.core.enums.PluginStatus;
import com.plugframe.core.exception.RegistryStorageException;
import com.plugframe.core.registry.PluginRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JsonFilePersistenceBackend 单元测试")
class JsonFilePersistenceBackendTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("重启后读回完整记录")
    void recordsSurviveRestart() {
        Path file = tempDir.resolve("data/registry.json");
        JsonFilePersistenceBackend backend = new JsonFilePersistenceBackend(file);
        backend.loadAll();
        Instant installedAt = Instant.ofEpochMilli(1_700_000_000_000L);
        backend.save(PluginRecord.builder()
                .name("b").version("1.0").status(PluginStatus.ACTIVE).build());
        backend.save(PluginRecord.builder()
                .name("a").version("2.1")
                .dependency("b>=1.0")
                .requiredCapability("b", Set.of("greet"))
                .capability("hello")
                .status(PluginStatus.ACTIVE)
                .stateBlob(StateBlob.ofUtf8(3, "{\"count\":7}"))
                .author("Alice")
                .tag("demo")
                .installedAt(installedAt)
                .build());

        List<PluginRecord> loaded = new JsonFilePersistenceBackend(file).loadAll();

        assertEquals(2, loaded.size());
        assertEquals("b", loaded.get(0).getName());
        PluginRecord a = loaded.get(1);
        assertEquals("2.1", a.getVersion());
        assertEquals(Set.of("b>=1.0"), a.getDependencies());
        assertEquals(Set.of("greet"), a.getRequiredCapabilities().get("b"));
        assertEquals(Set.of("hello"), a.getCapabilities());
        assertEquals(StateBlob.ofUtf8(3, "{\"count\":7}"), a.getStateBlob());
        assertEquals("Alice", a.getAuthor());
        assertEquals(List.of("demo"), a.getTags());
        assertEquals(installedAt, a.getInstalledAt());
        assertNull(a.getPreviousVersionHandle());
    }

    @Test
    @DisplayName("删除后不再出现，且不留下临时文件")
    void deleteRemovesRecord() throws Exception {
        Path file = tempDir.resolve("registry.json");
        JsonFilePersistenceBackend backend = new JsonFilePersistenceBackend(file);
        backend.save(PluginRecord.builder().name("a").version("1.0").status(PluginStatus.ACTIVE).build());

        backend.delete("a");
        backend.delete("missing");

        assertTrue(new JsonFilePersistenceBackend(file).loadAll().isEmpty());
        assertFalse(Files.exists(tempDir.resolve("registry.json.tmp")));
    }

    @Test
    @DisplayName("文件不存在时返回空列表")
    void missingFileIsEmpty() {
        assertTrue(new JsonFilePersistenceBackend(tempDir.resolve("none.json")).loadAll().isEmpty());
    }

    @Test
    @DisplayName("损坏的文件报告存储异常")
    void corruptFile() throws Exception {
        Path file = tempDir.resolve("registry.json");
        Files.write(file, "{not json".getBytes(StandardCharsets.UTF_8));

        assertThrows(RegistryStorageException.class, () -> new JsonFilePersistenceBackend(file).loadAll());
    }
}
