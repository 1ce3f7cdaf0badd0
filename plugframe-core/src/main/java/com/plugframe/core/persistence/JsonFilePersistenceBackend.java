package com.plugframe.core.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.plugframe.core.exception.RegistryStorageException;
import com.plugframe.core.registry.PluginRecord;
import com.plugframe.core.spi.PersistenceBackend;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON 文件持久化后端
 * <p>
 * 每次写入都先写临时文件再原子替换，崩溃时不会留下写了一半的注册表文件。
 */
@Slf4j
public class JsonFilePersistenceBackend implements PersistenceBackend {

    private static final TypeReference<List<PersistedRecord>> RECORD_LIST = new TypeReference<List<PersistedRecord>>() {
    };

    private final Path file;
    private final ObjectMapper objectMapper;
    private final Map<String, PersistedRecord> records = new LinkedHashMap<>();

    public JsonFilePersistenceBackend(Path file) {
        this.file = file;
        this.objectMapper = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public synchronized List<PluginRecord> loadAll() {
        records.clear();
        if (Files.exists(file)) {
            try {
                List<PersistedRecord> stored = objectMapper.readValue(file.toFile(), RECORD_LIST);
                for (PersistedRecord record : stored) {
                    records.put(record.getName(), record);
                }
                log.info("Loaded {} plugin records from {}", records.size(), file);
            } catch (IOException e) {
                throw new RegistryStorageException("Failed to read registry file: " + file, e);
            }
        }
        List<PluginRecord> result = new ArrayList<>();
        for (PersistedRecord record : records.values()) {
            result.add(record.toRecord());
        }
        return result;
    }

    @Override
    public synchronized void save(PluginRecord record) {
        PersistedRecord previous = records.put(record.getName(), PersistedRecord.from(record));
        try {
            flush();
        } catch (RegistryStorageException e) {
            // 内存视图与磁盘保持一致
            if (previous != null) {
                records.put(record.getName(), previous);
            } else {
                records.remove(record.getName());
            }
            throw e;
        }
    }

    @Override
    public synchronized void delete(String name) {
        PersistedRecord previous = records.remove(name);
        if (previous == null) {
            return;
        }
        try {
            flush();
        } catch (RegistryStorageException e) {
            records.put(name, previous);
            throw e;
        }
    }

    private void flush() {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writeValue(tmp.toFile(), new ArrayList<>(records.values()));
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported for {}, falling back to replace", file);
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new RegistryStorageException("Failed to write registry file: " + file, e);
        }
    }
}
