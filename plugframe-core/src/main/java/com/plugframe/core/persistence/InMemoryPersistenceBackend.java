package com.plugframe.core.persistence;

import com.plugframe.core.registry.PluginRecord;
import com.plugframe.core.spi.PersistenceBackend;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 内存持久化后端（未配置注册表文件时使用）
 */
public class InMemoryPersistenceBackend implements PersistenceBackend {

    private final Map<String, PluginRecord> records = new LinkedHashMap<>();

    @Override
    public synchronized List<PluginRecord> loadAll() {
        return new ArrayList<>(records.values());
    }

    @Override
    public synchronized void save(PluginRecord record) {
        records.put(record.getName(), record.toBuilder().previousVersionHandle(null).build());
    }

    @Override
    public synchronized void delete(String name) {
        records.remove(name);
    }
}
