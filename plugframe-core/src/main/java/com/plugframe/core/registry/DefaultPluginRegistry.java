package com.plugframe.core.registry;

import com.plugframe.api.exception.InvalidArgumentException;
import com.plugframe.api.exception.PluginNotFoundException;
import com.plugframe.core.enums.PluginStatus;
import com.plugframe.core.persistence.RegistryArchive;
import com.plugframe.core.spi.PersistenceBackend;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * 默认注册表实现
 * <p>
 * 记录按插入顺序保存在 LinkedHashMap 中，由读写锁保护；每次写入都先经过持久化后端，
 * 后端失败时内存视图不变。锁只覆盖单次读写，不会跨越完整的生命周期操作。
 */
@Slf4j
public class DefaultPluginRegistry implements PluginRegistry {

    private final PersistenceBackend backend;
    private final Map<String, PluginRecord> records = new LinkedHashMap<>();
    private final Map<String, SnapshotToken> openSnapshots = new ConcurrentHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public DefaultPluginRegistry(PersistenceBackend backend) {
        this.backend = backend;
        for (PluginRecord record : backend.loadAll()) {
            records.put(record.getName(), record);
        }
        if (!records.isEmpty()) {
            log.info("Registry restored with {} records", records.size());
        }
    }

    // ==================== 查询 ====================

    @Override
    public PluginRecord get(String name) {
        return find(name).orElseThrow(() -> new PluginNotFoundException(name));
    }

    @Override
    public Optional<PluginRecord> find(String name) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(records.get(name));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean contains(String name) {
        return find(name).isPresent();
    }

    @Override
    public List<PluginRecord> list() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(records.values()));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<PluginRecord> list(int offset, int limit) {
        if (offset < 0 || limit < 0) {
            throw new InvalidArgumentException("offset", "offset and limit must not be negative");
        }
        List<PluginRecord> all = list();
        if (offset >= all.size()) {
            return Collections.emptyList();
        }
        return all.subList(offset, (int) Math.min(all.size(), (long) offset + limit));
    }

    @Override
    public List<PluginRecord> search(String query, Collection<String> tags, String author) {
        String q = query != null ? query.toLowerCase(Locale.ROOT) : null;
        String a = author != null ? author.toLowerCase(Locale.ROOT) : null;
        return list().stream()
                .filter(r -> q == null || q.isEmpty()
                        || r.getName().toLowerCase(Locale.ROOT).contains(q)
                        || (r.getDescription() != null && r.getDescription().toLowerCase(Locale.ROOT).contains(q)))
                .filter(r -> tags == null || tags.isEmpty() || r.getTags().stream().anyMatch(tags::contains))
                .filter(r -> a == null || a.isEmpty()
                        || (r.getAuthor() != null && r.getAuthor().toLowerCase(Locale.ROOT).contains(a)))
                .collect(Collectors.toList());
    }

    @Override
    public RegistryStats stats() {
        List<PluginRecord> all = list();
        Map<PluginStatus, Integer> byStatus = new EnumMap<>(PluginStatus.class);
        Map<String, Integer> byAuthor = new LinkedHashMap<>();
        Map<String, Integer> byTag = new LinkedHashMap<>();
        for (PluginRecord record : all) {
            byStatus.merge(record.getStatus(), 1, Integer::sum);
            String author = record.getAuthor() != null && !record.getAuthor().isEmpty() ? record.getAuthor() : "Unknown";
            byAuthor.merge(author, 1, Integer::sum);
            for (String tag : record.getTags()) {
                byTag.merge(tag, 1, Integer::sum);
            }
        }
        return new RegistryStats(all.size(), byStatus, byAuthor, byTag);
    }

    // ==================== 写入 ====================

    @Override
    public void put(PluginRecord record) {
        lock.writeLock().lock();
        try {
            backend.save(record);
            records.put(record.getName(), record);
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("[{}] Registry updated: version={}, status={}", record.getName(), record.getVersion(),
                record.getStatus());
    }

    @Override
    public PluginRecord remove(String name) {
        lock.writeLock().lock();
        try {
            if (!records.containsKey(name)) {
                return null;
            }
            backend.delete(name);
            return records.remove(name);
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ==================== 导入导出 ====================

    @Override
    public void exportTo(Path file) {
        RegistryArchive.write(file, list());
    }

    @Override
    public int importFrom(Path file, ImportMode mode) {
        List<PluginRecord> imported = RegistryArchive.read(file, mode == ImportMode.REPLACE);
        lock.writeLock().lock();
        try {
            if (mode == ImportMode.REPLACE) {
                Set<String> keep = imported.stream().map(PluginRecord::getName).collect(Collectors.toSet());
                for (String name : new ArrayList<>(records.keySet())) {
                    if (!keep.contains(name)) {
                        backend.delete(name);
                        records.remove(name);
                    }
                }
            }
            for (PluginRecord record : imported) {
                backend.save(record);
                records.put(record.getName(), record);
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Imported {} plugin records from {} ({})", imported.size(), file, mode);
        return imported.size();
    }

    // ==================== 快照 ====================

    @Override
    public SnapshotToken snapshot(String name) {
        PluginRecord current = get(name);
        SnapshotToken token = new SnapshotToken(UUID.randomUUID().toString(), name, current, Instant.now());
        openSnapshots.put(token.getId(), token);
        log.debug("[{}] Snapshot taken: {} (version={})", name, token.getId(), current.getVersion());
        return token;
    }

    @Override
    public void restore(SnapshotToken token) {
        if (token == null || openSnapshots.remove(token.getId()) == null) {
            throw new IllegalStateException("Unknown or released snapshot token: "
                    + (token != null ? token.getId() : null));
        }
        put(token.getRecord());
        log.info("[{}] Registry restored to snapshot (version={})", token.getPluginName(),
                token.getRecord().getVersion());
    }

    @Override
    public void release(SnapshotToken token) {
        if (token != null) {
            openSnapshots.remove(token.getId());
        }
    }

    /**
     * 未释放的快照数量
     */
    public int openSnapshotCount() {
        return openSnapshots.size();
    }
}
