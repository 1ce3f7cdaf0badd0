package com.plugframe.core.lifecycle;

import com.plugframe.api.config.PluginDefinition;
import com.plugframe.api.event.lifecycle.PluginFailedEvent;
import com.plugframe.api.event.lifecycle.PluginInstalledEvent;
import com.plugframe.api.event.lifecycle.PluginReloadedEvent;
import com.plugframe.api.event.lifecycle.PluginReloadingEvent;
import com.plugframe.api.event.lifecycle.PluginRolledBackEvent;
import com.plugframe.api.event.lifecycle.PluginUninstalledEvent;
import com.plugframe.api.exception.CycleDetectedException;
import com.plugframe.api.exception.DependencyViolationException;
import com.plugframe.api.exception.DuplicatePluginException;
import com.plugframe.api.exception.ErrorKind;
import com.plugframe.api.exception.IllegalPluginStateException;
import com.plugframe.api.exception.InvalidArgumentException;
import com.plugframe.api.exception.PlugFrameException;
import com.plugframe.api.exception.PluginLoadException;
import com.plugframe.api.exception.RollbackFailedException;
import com.plugframe.api.plugin.StateBlob;
import com.plugframe.core.config.PluginConfig;
import com.plugframe.core.config.PluginConfigStore;
import com.plugframe.core.enums.PluginStatus;
import com.plugframe.core.enums.ReloadPhase;
import com.plugframe.core.event.EventBus;
import com.plugframe.core.loader.HandleReaper;
import com.plugframe.core.loader.HandleTable;
import com.plugframe.core.loader.PluginArtifact;
import com.plugframe.core.loader.PluginHandle;
import com.plugframe.core.loader.PluginLoader;
import com.plugframe.core.registry.PluginRecord;
import com.plugframe.core.registry.PluginRegistry;
import com.plugframe.core.registry.SnapshotToken;
import com.plugframe.core.resolver.DependencyResolver;
import com.plugframe.core.resolver.ReloadPlan;
import com.plugframe.core.resolver.Version;
import com.plugframe.core.spi.ArtifactSource;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * 生命周期协调器
 * <p>
 * 驱动 install / reload / uninstall / recover / bootstrap。
 * 重载状态机：
 *
 * <pre>
 * BACKING_UP -> UNLOADING -> LOADING_NEW -> RESTORING_STATE -> ACTIVE
 *      |             |             |               |
 *      +-------------+------ ROLLING_BACK ---------+-> ACTIVE(previous) | FAILED
 * </pre>
 * <p>
 * 同名插件的操作由 {@link PluginLockTable} 串行化；安装与卸载在最后的校验+写入阶段
 * 额外持有一把短时的图锁，保证并发的"安装依赖方"与"卸载被依赖方"不会破坏依赖图约束。
 */
@Slf4j
public class LifecycleCoordinator {

    private final PluginRegistry registry;
    private final DependencyResolver resolver;
    private final PluginLoader loader;
    private final HandleTable handles;
    private final HandleReaper reaper;
    private final EventBus eventBus;
    private final PluginLockTable locks;
    private final ArtifactSource artifactSource;
    private final PluginConfigStore configs;

    // 图锁：只覆盖最终校验 + 写入
    private final ReentrantLock graphLock = new ReentrantLock();

    public LifecycleCoordinator(PluginRegistry registry,
                                DependencyResolver resolver,
                                PluginLoader loader,
                                HandleTable handles,
                                HandleReaper reaper,
                                EventBus eventBus,
                                PluginLockTable locks,
                                ArtifactSource artifactSource,
                                PluginConfigStore configs) {
        this.registry = registry;
        this.resolver = resolver;
        this.loader = loader;
        this.handles = handles;
        this.reaper = reaper;
        this.eventBus = eventBus;
        this.locks = locks;
        this.artifactSource = artifactSource;
        this.configs = configs;
    }

    // ==================== 安装 ====================

    public PluginRecord install(PluginArtifact artifact) {
        PluginDefinition definition = artifact.getDefinition();
        String name = definition.getName();
        locks.acquire(name);
        try {
            // 1. 预检：无副作用
            if (registry.contains(name)) {
                throw new DuplicatePluginException(name);
            }
            resolver.validateAndRequire(definition);
            PluginConfig config = configs.prepare(definition);

            // 2. 加载（失败时注册表不变）
            log.info("[{}] Installing version {}", name, definition.getVersion());
            PluginHandle handle = loader.load(artifact, StateBlob.empty());

            // 3. 图锁内复核并写入
            PluginRecord record;
            graphLock.lock();
            try {
                if (registry.contains(name)) {
                    throw new DuplicatePluginException(name);
                }
                resolver.validateAndRequire(definition);
                Instant now = Instant.now();
                record = toRecord(artifact, loader.capabilities(handle), StateBlob.empty(), now)
                        .status(PluginStatus.ACTIVE)
                        .build();
                registry.put(record);
            } catch (RuntimeException e) {
                loader.discard(handle);
                throw e;
            } finally {
                graphLock.unlock();
            }

            handles.swap(name, handle);
            configs.activate(config);
            log.info("[{}] Installed version {}", name, record.getVersion());
            eventBus.publish(new PluginInstalledEvent(name, record.getVersion()));
            return record;
        } finally {
            locks.release(name);
        }
    }

    // ==================== 重载 ====================

    public ReloadResult reload(String name, PluginArtifact artifact) {
        return reload(name, artifact, new ReloadOperation(name, artifact.getVersion()));
    }

    /**
     * 执行重载，并将阶段与结果报告给 operation
     */
    public ReloadResult reload(String name, PluginArtifact artifact, ReloadOperation operation) {
        try {
            ReloadResult result = doReload(name, artifact, operation);
            operation.complete(result);
            return result;
        } catch (RuntimeException e) {
            operation.fail(e);
            throw e;
        }
    }

    private ReloadResult doReload(String name, PluginArtifact artifact, ReloadOperation operation) {
        locks.acquire(name);
        try {
            // ===== 预检：无副作用 =====
            if (!name.equals(artifact.getName())) {
                throw new InvalidArgumentException("artifact",
                        "Artifact [" + artifact.getName() + "] cannot replace plugin [" + name + "]");
            }
            PluginRecord current = registry.get(name);
            if (!current.isActive()) {
                throw new IllegalPluginStateException(name, current.getStatus().name(),
                        "Plugin [" + name + "] cannot be reloaded in status " + current.getStatus());
            }
            PluginHandle oldHandle = handles.current(name);
            if (oldHandle == null) {
                throw new IllegalPluginStateException(name, current.getStatus().name(),
                        "Plugin [" + name + "] has no loaded handle");
            }
            PluginDefinition definition = artifact.getDefinition();
            resolver.validateAndRequire(definition);
            PluginConfig config = configs.prepare(definition);
            ReloadPlan plan = resolver.affectedClosure(name);
            Set<String> required = resolver.requiredCapabilities(name);

            // 取消边界
            operation.begin();
            if (Version.parse(artifact.getVersion()).compareTo(Version.parse(current.getVersion())) < 0) {
                log.warn("[{}] Downgrading from {} to {}", name, current.getVersion(), artifact.getVersion());
            }
            log.info("[{}] Reloading {} -> {}", name, current.getVersion(), artifact.getVersion());
            eventBus.publish(new PluginReloadingEvent(name, current.getVersion(), artifact.getVersion()));

            return runReload(current, oldHandle, artifact, config, plan, required, operation);
        } finally {
            locks.release(name);
        }
    }

    private ReloadResult runReload(PluginRecord current, PluginHandle oldHandle, PluginArtifact artifact,
                                   PluginConfig config, ReloadPlan plan, Set<String> required,
                                   ReloadOperation operation) {
        String name = current.getName();

        // ===== BACKING_UP =====
        SnapshotToken token = registry.snapshot(name);
        StateBlob blob = current.getStateBlob();
        PluginHandle newHandle = null;
        ErrorKind failureKind = ErrorKind.UNLOAD_FAILURE;
        try {
            blob = loader.unload(oldHandle);
            registry.put(current.toBuilder()
                    .status(PluginStatus.RELOADING)
                    .stateBlob(blob)
                    .previousVersionHandle(oldHandle)
                    .previousVersion(current.getVersion())
                    .updatedAt(Instant.now())
                    .build());

            // ===== UNLOADING =====
            operation.enter(ReloadPhase.UNLOADING);
            handles.clear(name);
            reaper.retire(oldHandle);

            // ===== LOADING_NEW =====
            failureKind = ErrorKind.LOAD_FAILURE;
            operation.enter(ReloadPhase.LOADING_NEW);
            newHandle = loader.load(artifact, blob);

            // ===== RESTORING_STATE =====
            operation.enter(ReloadPhase.RESTORING_STATE);
            Set<String> capabilities = loader.capabilities(newHandle);
            if (!capabilities.containsAll(required)) {
                Set<String> lacking = new LinkedHashSet<>(required);
                lacking.removeAll(capabilities);
                throw new PluginLoadException(name, String.format(
                        "Version %s of [%s] lacks capabilities %s required by dependents",
                        artifact.getVersion(), name, lacking));
            }
            PluginRecord committed = toRecord(artifact, capabilities, blob, current.getInstalledAt())
                    .status(PluginStatus.ACTIVE)
                    .build();
            graphLock.lock();
            try {
                // 重载期间依赖可能已被卸载或标记失败
                Set<String> missing = resolver.unavailableDependencies(artifact.getDefinition());
                if (!missing.isEmpty()) {
                    throw new PluginLoadException(name, String.format(
                            "Dependencies of [%s] %s are no longer satisfied", name, missing));
                }
                registry.put(committed);
            } finally {
                graphLock.unlock();
            }
            handles.swap(name, newHandle);
            configs.activate(config);
            registry.release(token);
            operation.enter(ReloadPhase.COMMITTED);

            if (plan.hasDependents()) {
                log.warn("[{}] Reloaded to {}; dependents need revalidation: {}", name, committed.getVersion(),
                        plan.getNeedsRevalidation());
            }
            log.info("[{}] Reload committed: {} -> {}", name, current.getVersion(), committed.getVersion());
            eventBus.publish(new PluginReloadedEvent(name, committed.getVersion(), current.getVersion(),
                    plan.getNeedsRevalidation()));
            return ReloadResult.succeeded(committed, plan.getNeedsRevalidation());
        } catch (RuntimeException e) {
            if (e instanceof IllegalStateException && failureKind == ErrorKind.UNLOAD_FAILURE) {
                // 句柄被重复卸载属于编程错误，不回滚
                registry.release(token);
                throw e;
            }
            if (newHandle != null) {
                loader.discard(newHandle);
            }
            return rollback(current, oldHandle, token, blob, artifact.getVersion(), failureKind, e, operation);
        }
    }

    /**
     * 用备份的状态重新实例化上一版本
     */
    private ReloadResult rollback(PluginRecord previous, PluginHandle oldHandle, SnapshotToken token,
                                  StateBlob blob, String rejectedVersion, ErrorKind kind,
                                  RuntimeException originalFailure, ReloadOperation operation) {
        String name = previous.getName();
        operation.enter(ReloadPhase.ROLLING_BACK);
        log.warn("[{}] Reload to {} failed ({}): {}; rolling back to {}", name, rejectedVersion, kind,
                originalFailure.getMessage(), previous.getVersion());
        try {
            registry.put(previous.toBuilder()
                    .status(PluginStatus.ROLLING_BACK)
                    .stateBlob(blob)
                    .previousVersionHandle(oldHandle)
                    .previousVersion(previous.getVersion())
                    .updatedAt(Instant.now())
                    .build());
            handles.clear(name);
            reaper.retire(oldHandle);

            PluginHandle recovered = loader.load(oldHandle.getArtifact(), blob);
            graphLock.lock();
            try {
                registry.restore(token);
                Set<String> missing = resolver.unavailableDependencies(name);
                if (!missing.isEmpty()) {
                    suspend(name, "Dependencies " + missing + " unavailable after rollback");
                }
            } finally {
                graphLock.unlock();
            }
            handles.swap(name, recovered);
        } catch (RuntimeException rollbackFailure) {
            markFailed(name, token, rollbackFailure);
            operation.enter(ReloadPhase.FAILED);
            log.error("[{}] Rollback to {} failed, plugin marked FAILED", name, previous.getVersion(),
                    rollbackFailure);
            throw new RollbackFailedException(name, originalFailure, rollbackFailure);
        }

        operation.enter(ReloadPhase.ROLLED_BACK);
        PluginRecord restored = registry.get(name);
        log.warn("[{}] Rolled back to version {}", name, restored.getVersion());
        eventBus.publish(new PluginRolledBackEvent(name, restored.getVersion(), rejectedVersion,
                originalFailure.getMessage()));
        return ReloadResult.rolledBack(restored, rejectedVersion, kind, originalFailure);
    }

    // ==================== 卸载 ====================

    public PluginRecord uninstall(String name) {
        locks.acquire(name);
        boolean removed = false;
        try {
            PluginRecord record;
            graphLock.lock();
            try {
                record = registry.get(name);
                List<String> dependents = resolver.liveDependents(name);
                if (!dependents.isEmpty()) {
                    throw new DependencyViolationException(name, dependents);
                }
                registry.remove(name);
            } finally {
                graphLock.unlock();
            }

            configs.remove(name);
            PluginHandle handle = handles.remove(name);
            if (handle != null) {
                try {
                    loader.unload(handle);
                } catch (PlugFrameException e) {
                    log.warn("[{}] onUnload failed during uninstall, removing anyway: {}", name, e.getMessage());
                }
                reaper.retire(handle);
            }
            log.info("[{}] Uninstalled version {}", name, record.getVersion());
            eventBus.publish(new PluginUninstalledEvent(name, record.getVersion()));
            removed = true;
            return record;
        } finally {
            if (removed) {
                locks.releaseAndRemove(name);
            } else {
                locks.release(name);
            }
        }
    }

    // ==================== 人工恢复 ====================

    /**
     * 恢复 FAILED 插件：用最后持久化的状态加载给定制品，并重新激活挂起的依赖方
     */
    public PluginRecord recover(String name, PluginArtifact artifact) {
        locks.acquire(name);
        try {
            if (!name.equals(artifact.getName())) {
                throw new InvalidArgumentException("artifact",
                        "Artifact [" + artifact.getName() + "] cannot recover plugin [" + name + "]");
            }
            PluginRecord current = registry.get(name);
            if (current.getStatus() != PluginStatus.FAILED) {
                throw new IllegalPluginStateException(name, current.getStatus().name(),
                        "Only FAILED plugins can be recovered, [" + name + "] is " + current.getStatus());
            }
            resolver.validateAndRequire(artifact.getDefinition());
            PluginConfig config = configs.prepare(artifact.getDefinition());

            log.info("[{}] Recovering with version {}", name, artifact.getVersion());
            PluginHandle handle = loader.load(artifact, current.getStateBlob());
            PluginRecord record;
            graphLock.lock();
            try {
                record = toRecord(artifact, loader.capabilities(handle), current.getStateBlob(),
                        current.getInstalledAt())
                        .status(PluginStatus.ACTIVE)
                        .build();
                registry.put(record);
            } catch (RuntimeException e) {
                loader.discard(handle);
                throw e;
            } finally {
                graphLock.unlock();
            }
            handles.swap(name, handle);
            configs.activate(config);

            List<String> reactivated = reactivateSuspended();
            log.info("[{}] Recovered to version {}, reactivated dependents: {}", name, record.getVersion(),
                    reactivated);
            eventBus.publish(new PluginReloadedEvent(name, record.getVersion(), current.getVersion(), reactivated));
            return record;
        } finally {
            locks.release(name);
        }
    }

    /**
     * 依赖重新满足的 SUSPENDED 插件恢复为 ACTIVE（迭代直到不再变化）
     */
    private List<String> reactivateSuspended() {
        List<String> reactivated = new ArrayList<>();
        boolean changed = true;
        while (changed) {
            changed = false;
            for (PluginRecord record : registry.list()) {
                if (record.getStatus() != PluginStatus.SUSPENDED
                        || !resolver.missingDependencies(record.getName()).isEmpty()) {
                    continue;
                }
                if (activateSuspended(record)) {
                    reactivated.add(record.getName());
                    changed = true;
                }
            }
        }
        return reactivated;
    }

    private boolean activateSuspended(PluginRecord record) {
        String name = record.getName();
        try {
            locks.acquire(name);
        } catch (PlugFrameException e) {
            log.warn("[{}] Busy, left SUSPENDED", name);
            return false;
        }
        try {
            Set<String> capabilities = record.getCapabilities();
            if (handles.current(name) == null) {
                // 启动时未加载过，需要从制品来源加载
                if (artifactSource == null) {
                    log.warn("[{}] No artifact source to load suspended plugin, left SUSPENDED", name);
                    return false;
                }
                PluginArtifact artifact = artifactSource.resolve(name, record.getVersion());
                PluginConfig config = configs.prepare(artifact.getDefinition());
                PluginHandle handle = loader.load(artifact, record.getStateBlob());
                capabilities = loader.capabilities(handle);
                handles.swap(name, handle);
                configs.activate(config);
            }
            registry.put(record.toBuilder()
                    .status(PluginStatus.ACTIVE)
                    .clearCapabilities()
                    .capabilities(capabilities)
                    .failureReason(null)
                    .updatedAt(Instant.now())
                    .build());
            log.info("[{}] Reactivated", name);
            return true;
        } catch (PlugFrameException e) {
            log.warn("[{}] Failed to reactivate, left SUSPENDED: {}", name, e.getMessage());
            return false;
        } finally {
            locks.release(name);
        }
    }

    // ==================== 启动恢复 ====================

    /**
     * 按依赖顺序重新加载持久化的 ACTIVE 插件
     * 过渡状态的记录说明上次进程在操作中途退出，标记为 FAILED
     *
     * @return 恢复为 ACTIVE 的插件数量
     */
    public int bootstrap() {
        List<PluginRecord> records = registry.list();
        if (records.isEmpty()) {
            return 0;
        }
        List<String> order;
        try {
            order = resolver.installOrder(records.stream().map(this::toDefinition).collect(Collectors.toList()))
                    .stream().map(PluginDefinition::getName).collect(Collectors.toList());
        } catch (CycleDetectedException e) {
            log.error("Persisted registry contains a dependency cycle: {}", e.getCyclePath());
            order = records.stream().map(PluginRecord::getName).collect(Collectors.toList());
            for (String name : new LinkedHashSet<>(e.getCyclePath())) {
                markFailed(name, null, e);
            }
        }

        int restored = 0;
        for (String name : order) {
            PluginRecord record = registry.get(name);
            if (record.getStatus().isTransient()) {
                markFailed(name, null, new IllegalPluginStateException(name, record.getStatus().name(),
                        "Interrupted while " + record.getStatus()));
            } else if (record.isActive() && bootstrapOne(record)) {
                restored++;
            }
        }
        log.info("Bootstrap finished: {}/{} plugins active", restored, records.size());
        return restored;
    }

    private boolean bootstrapOne(PluginRecord record) {
        String name = record.getName();
        locks.acquire(name);
        try {
            Set<String> missing = resolver.missingDependencies(name);
            if (!missing.isEmpty()) {
                registry.put(record.toBuilder()
                        .status(PluginStatus.SUSPENDED)
                        .failureReason("Missing dependencies: " + missing)
                        .updatedAt(Instant.now())
                        .build());
                log.warn("[{}] Suspended at bootstrap, missing dependencies {}", name, missing);
                return false;
            }
            if (artifactSource == null) {
                throw new PluginLoadException(name, "No artifact source configured");
            }
            PluginArtifact artifact = artifactSource.resolve(name, record.getVersion());
            PluginConfig config = configs.prepare(artifact.getDefinition());
            PluginHandle handle = loader.load(artifact, record.getStateBlob());
            registry.put(record.toBuilder()
                    .clearCapabilities()
                    .capabilities(loader.capabilities(handle))
                    .artifactLocation(artifact.getLocation())
                    .updatedAt(Instant.now())
                    .build());
            handles.swap(name, handle);
            configs.activate(config);
            log.info("[{}] Restored version {} at bootstrap", name, record.getVersion());
            return true;
        } catch (PlugFrameException e) {
            markFailed(name, null, e);
            return false;
        } finally {
            locks.release(name);
        }
    }

    // ==================== 内部 ====================

    /**
     * 标记 FAILED 并挂起所有（传递）ACTIVE 依赖方
     */
    private void markFailed(String name, SnapshotToken token, Throwable reason) {
        registry.release(token);
        String message = reason.getMessage() != null ? reason.getMessage() : reason.toString();
        List<String> dependents = Collections.emptyList();
        graphLock.lock();
        try {
            dependents = resolver.transitiveDependents(name);
            PluginRecord current = registry.get(name);
            registry.put(current.toBuilder()
                    .status(PluginStatus.FAILED)
                    .previousVersionHandle(null)
                    .failureReason(message)
                    .updatedAt(Instant.now())
                    .build());
            for (String dependent : dependents) {
                registry.put(registry.get(dependent).toBuilder()
                        .status(PluginStatus.SUSPENDED)
                        .failureReason("Dependency [" + name + "] failed")
                        .updatedAt(Instant.now())
                        .build());
                log.warn("[{}] Suspended because dependency [{}] failed", dependent, name);
            }
        } catch (RuntimeException e) {
            log.error("[{}] Failed to persist FAILED status", name, e);
        } finally {
            graphLock.unlock();
        }
        PluginHandle stale = handles.clear(name);
        if (stale != null) {
            reaper.retire(stale);
        }
        log.error("[{}] Marked FAILED: {}; suspended dependents: {}", name, message, dependents);
        eventBus.publish(new PluginFailedEvent(name, registry.find(name).map(PluginRecord::getVersion).orElse(null),
                message, Collections.unmodifiableList(dependents)));
    }

    /**
     * 挂起插件及其（传递）ACTIVE 依赖方，调用方须持有 graphLock
     */
    private void suspend(String name, String reason) {
        List<String> dependents = resolver.transitiveDependents(name);
        registry.put(registry.get(name).toBuilder()
                .status(PluginStatus.SUSPENDED)
                .failureReason(reason)
                .updatedAt(Instant.now())
                .build());
        log.warn("[{}] Suspended: {}", name, reason);
        for (String dependent : dependents) {
            registry.put(registry.get(dependent).toBuilder()
                    .status(PluginStatus.SUSPENDED)
                    .failureReason("Dependency [" + name + "] suspended")
                    .updatedAt(Instant.now())
                    .build());
            log.warn("[{}] Suspended because dependency [{}] is suspended", dependent, name);
        }
    }

    private PluginRecord.PluginRecordBuilder toRecord(PluginArtifact artifact, Set<String> capabilities,
                                                      StateBlob blob, Instant installedAt) {
        PluginDefinition definition = artifact.getDefinition();
        Map<String, Set<String>> requiredCapabilities = new LinkedHashMap<>();
        if (definition.getRequiredCapabilities() != null) {
            definition.getRequiredCapabilities()
                    .forEach((dep, caps) -> requiredCapabilities.put(dep, new LinkedHashSet<>(caps)));
        }
        Instant now = Instant.now();
        return PluginRecord.builder()
                .name(definition.getName())
                .version(definition.getVersion())
                .dependencies(definition.getDependencies() != null ? definition.getDependencies() : List.of())
                .requiredCapabilities(requiredCapabilities)
                .capabilities(capabilities)
                .stateBlob(blob)
                .artifactLocation(artifact.getLocation())
                .description(definition.getDescription())
                .author(definition.getAuthor())
                .tags(definition.getTags() != null ? definition.getTags() : List.of())
                .installedAt(installedAt != null ? installedAt : now)
                .updatedAt(now);
    }

    private PluginDefinition toDefinition(PluginRecord record) {
        PluginDefinition definition = PluginDefinition.of(record.getName(), record.getVersion());
        definition.setDependencies(new ArrayList<>(record.getDependencies()));
        return definition;
    }
}
