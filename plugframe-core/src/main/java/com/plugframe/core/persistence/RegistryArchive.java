package com.plugframe.core.persistence;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.plugframe.core.exception.RegistryStorageException;
import com.plugframe.core.registry.PluginRecord;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 注册表导出文件的读写，格式与 {@link JsonFilePersistenceBackend} 的注册表文件相同
 */
@Slf4j
public final class RegistryArchive {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private RegistryArchive() {
    }

    public static void write(Path file, List<PluginRecord> records) {
        List<PersistedRecord> persisted = records.stream().map(PersistedRecord::from).collect(Collectors.toList());
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            MAPPER.writeValue(file.toFile(), persisted);
        } catch (IOException e) {
            throw new RegistryStorageException("Failed to export registry to " + file, e);
        }
        log.info("Exported {} plugin records to {}", persisted.size(), file);
    }

    /**
     * @param strict true 时任何条目格式不对都抛出异常，false 时跳过该条目
     * @throws RegistryStorageException 文件不存在、不是 JSON 数组，或 strict 下有非法条目
     */
    public static List<PluginRecord> read(Path file, boolean strict) {
        if (!Files.isRegularFile(file)) {
            throw new RegistryStorageException("Registry export not found: " + file, null);
        }
        JsonNode root;
        try {
            root = MAPPER.readTree(file.toFile());
        } catch (IOException e) {
            throw new RegistryStorageException("Invalid registry export " + file + ": " + e.getMessage(), e);
        }
        if (root == null || !root.isArray()) {
            throw new RegistryStorageException("Invalid registry export " + file + ": expected a JSON array", null);
        }
        List<PluginRecord> records = new ArrayList<>();
        int index = 0;
        for (JsonNode node : root) {
            try {
                records.add(toRecord(node));
            } catch (IllegalArgumentException e) {
                if (strict) {
                    throw new RegistryStorageException(
                            "Invalid entry #" + index + " in registry export " + file + ": " + e.getMessage(), e);
                }
                log.warn("Skipping invalid entry #{} in {}: {}", index, file, e.getMessage());
            }
            index++;
        }
        return records;
    }

    private static PluginRecord toRecord(JsonNode node) {
        PersistedRecord persisted = MAPPER.convertValue(node, PersistedRecord.class);
        if (persisted.getName() == null || persisted.getVersion() == null || persisted.getStatus() == null) {
            throw new IllegalArgumentException("name, version and status are required");
        }
        return persisted.toRecord();
    }
}
