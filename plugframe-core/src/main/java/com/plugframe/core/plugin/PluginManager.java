package com.plugframe.core.plugin;

import com.plugframe.api.config.PluginDefinition;
import com.plugframe.api.exception.IllegalPluginStateException;
import com.plugframe.api.exception.InvalidArgumentException;
import com.plugframe.api.exception.PluginUnavailableException;
import com.plugframe.api.plugin.Plugin;
import com.plugframe.core.classloader.DefaultPluginLoaderFactory;
import com.plugframe.core.config.ConfigFormat;
import com.plugframe.core.config.PlugFrameConfig;
import com.plugframe.core.config.PluginConfig;
import com.plugframe.core.config.PluginConfigSchema;
import com.plugframe.core.config.PluginConfigStore;
import com.plugframe.core.enums.PluginStatus;
import com.plugframe.core.event.EventBus;
import com.plugframe.core.lifecycle.LifecycleCoordinator;
import com.plugframe.core.lifecycle.PluginLockTable;
import com.plugframe.core.lifecycle.ReloadOperation;
import com.plugframe.core.lifecycle.ReloadResult;
import com.plugframe.core.loader.DirectoryArtifactSource;
import com.plugframe.core.loader.HandleReaper;
import com.plugframe.core.loader.HandleTable;
import com.plugframe.core.loader.IsolatedPluginLoader;
import com.plugframe.core.loader.PluginArtifact;
import com.plugframe.core.loader.PluginCallExecutor;
import com.plugframe.core.loader.PluginHandle;
import com.plugframe.core.loader.PluginLoader;
import com.plugframe.core.loader.PluginManifestLoader;
import com.plugframe.core.persistence.InMemoryPersistenceBackend;
import com.plugframe.core.persistence.JsonFilePersistenceBackend;
import com.plugframe.core.registry.DefaultPluginRegistry;
import com.plugframe.core.registry.ImportMode;
import com.plugframe.core.registry.PluginRecord;
import com.plugframe.core.registry.PluginRegistry;
import com.plugframe.core.registry.RegistryStats;
import com.plugframe.core.resolver.DependencyResolver;
import com.plugframe.core.spi.ArtifactSource;
import com.plugframe.core.spi.PersistenceBackend;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * 插件管理器（对外门面）
 * <p>
 * 职责：
 * 1. 插件的安装、重载、卸载与人工恢复
 * 2. 注册表查询（列表、分页、搜索、统计、依赖树）
 * 3. 插件能力的调用 (execute)
 * 4. 资源的全局管控 (shutdown)
 */
@Slf4j
public class PluginManager {

    // ==================== 常量 ====================
    private static final long KEEP_ALIVE_TIME = 60L;
    private static final int SHUTDOWN_TIMEOUT_SECONDS = 10;

    // ==================== 核心组件 ====================

    private final PlugFrameConfig config;
    private final PluginRegistry registry;
    private final DependencyResolver resolver;
    private final PluginLoader loader;
    private final HandleTable handles;
    private final HandleReaper reaper;
    private final LifecycleCoordinator coordinator;
    private final ArtifactSource artifactSource;
    private final PluginConfigStore configs;
    private final EventBus eventBus;

    // ==================== 基础设施 ====================

    private final PluginCallExecutor callExecutor;
    private final ExecutorService lifecycleExecutor;
    private final AtomicInteger threadNumber = new AtomicInteger(1);

    /**
     * 按配置组装：registryFile 为空时使用内存注册表，制品来源为 pluginHome 目录
     */
    public PluginManager(PlugFrameConfig config) {
        this(config, createBackend(config), new DirectoryArtifactSource(new File(config.getPluginHome())),
                new EventBus());
    }

    public PluginManager(PlugFrameConfig config, PersistenceBackend backend, ArtifactSource artifactSource,
                         EventBus eventBus) {
        this(config, new DefaultPluginRegistry(backend), artifactSource, null, eventBus);
    }

    /**
     * @param loader 为 null 时使用 {@link IsolatedPluginLoader}
     */
    public PluginManager(PlugFrameConfig config,
                         PluginRegistry registry,
                         ArtifactSource artifactSource,
                         PluginLoader loader,
                         EventBus eventBus) {
        this.config = config;
        this.registry = registry;
        this.artifactSource = artifactSource;
        this.eventBus = eventBus != null ? eventBus : new EventBus();
        this.resolver = new DependencyResolver(registry);
        this.callExecutor = new PluginCallExecutor(config.getCallbackTimeoutMs());
        this.loader = loader != null
                ? loader
                : new IsolatedPluginLoader(new DefaultPluginLoaderFactory(), callExecutor);
        this.handles = new HandleTable();
        this.reaper = new HandleReaper(config.getReaperIntervalSeconds(), config.getForceCleanupDelaySeconds());
        this.configs = new PluginConfigStore(Paths.get(config.getConfigDir()));
        this.coordinator = new LifecycleCoordinator(registry, resolver, this.loader, handles, reaper,
                this.eventBus, new PluginLockTable(config.getLockWaitMs()), artifactSource, configs);
        this.lifecycleExecutor = createLifecycleExecutor();
        log.info("PluginManager started with {}", config);
    }

    // ==================== 安装 API ====================

    /**
     * 安装 Jar 包或 classes 目录插件
     */
    public PluginRecord install(PluginDefinition definition, File source) {
        return install(PluginArtifact.fromSource(definition, source));
    }

    /**
     * 安装内嵌插件（工厂每次加载创建新实例）
     */
    public PluginRecord install(PluginDefinition definition, Supplier<? extends Plugin> factory) {
        return install(PluginArtifact.embedded(definition, factory));
    }

    /**
     * 从制品来源安装
     *
     * @param version 为 null 时安装最新版本
     */
    public PluginRecord install(String name, String version) {
        return install(requireSource().resolve(name, version));
    }

    /**
     * 安装带 plugin.yml 的 Jar 包或目录
     */
    public PluginRecord install(File source) {
        return install(PluginManifestLoader.requireDefinition(source), source);
    }

    public PluginRecord install(PluginArtifact artifact) {
        return coordinator.install(artifact);
    }

    /**
     * 批量安装：按依赖拓扑序（同层按名称字典序）依次安装
     * 某个插件失败时立即停止，已安装的插件保留
     */
    public List<PluginRecord> installAll(Collection<PluginArtifact> artifacts) {
        Map<String, PluginArtifact> byName = artifacts.stream()
                .collect(Collectors.toMap(PluginArtifact::getName, a -> a, (a, b) -> {
                    throw new InvalidArgumentException("artifacts", "Duplicate plugin in batch: " + a.getName());
                }));
        List<PluginDefinition> order = resolver.installOrder(
                artifacts.stream().map(PluginArtifact::getDefinition).collect(Collectors.toList()));
        log.info("Installing {} plugins in order {}", order.size(),
                order.stream().map(PluginDefinition::getName).collect(Collectors.toList()));
        List<PluginRecord> installed = new ArrayList<>();
        for (PluginDefinition definition : order) {
            installed.add(install(byName.get(definition.getName())));
        }
        return installed;
    }

    // ==================== 重载 API ====================

    public ReloadResult reload(String name, PluginArtifact artifact) {
        return coordinator.reload(name, artifact);
    }

    /**
     * 从制品来源重载到指定版本
     */
    public ReloadResult reload(String name, String version) {
        return reload(name, requireSource().resolve(name, version));
    }

    public ReloadResult reload(String name, PluginDefinition definition, Supplier<? extends Plugin> factory) {
        return reload(name, PluginArtifact.embedded(definition, factory));
    }

    /**
     * 异步重载
     * 返回的操作在开始备份前可以取消
     */
    public ReloadOperation reloadAsync(String name, PluginArtifact artifact) {
        ReloadOperation operation = new ReloadOperation(name, artifact.getVersion());
        try {
            lifecycleExecutor.execute(() -> {
                try {
                    coordinator.reload(name, artifact, operation);
                } catch (RuntimeException e) {
                    log.warn("[{}] Async reload to {} ended with {}: {}", name, artifact.getVersion(),
                            e.getClass().getSimpleName(), e.getMessage());
                }
            });
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("PluginManager is shut down", e);
        }
        return operation;
    }

    // ==================== 卸载与恢复 API ====================

    public PluginRecord uninstall(String name) {
        return coordinator.uninstall(name);
    }

    /**
     * 人工恢复 FAILED 插件
     */
    public PluginRecord recover(String name, PluginArtifact artifact) {
        return coordinator.recover(name, artifact);
    }

    public PluginRecord recover(String name, String version) {
        return recover(name, requireSource().resolve(name, version));
    }

    /**
     * 启动时按持久化的注册表恢复插件
     */
    public int bootstrap() {
        return coordinator.bootstrap();
    }

    // ==================== 查询 API ====================

    public List<PluginRecord> list() {
        return registry.list();
    }

    public List<PluginRecord> list(int offset, int limit) {
        return registry.list(offset, limit);
    }

    public PluginRecord get(String name) {
        return registry.get(name);
    }

    public Optional<PluginRecord> find(String name) {
        return registry.find(name);
    }

    public List<PluginRecord> search(String query, Collection<String> tags, String author) {
        return registry.search(query, tags, author);
    }

    public RegistryStats stats() {
        return registry.stats();
    }

    public Map<String, List<String>> dependencyTree(String name) {
        return resolver.dependencyTree(name);
    }

    public Set<String> capabilities(String name) {
        return registry.get(name).getCapabilities();
    }

    /**
     * 当前可从制品来源安装的插件
     */
    public List<PluginArtifact> availableArtifacts() {
        return artifactSource != null ? artifactSource.available() : Collections.emptyList();
    }

    // ==================== 插件配置 API ====================

    /**
     * 当前生效的插件配置
     *
     * @throws com.plugframe.api.exception.PluginNotFoundException 插件未安装
     */
    public PluginConfig pluginConfig(String name) {
        return configs.get(name);
    }

    /**
     * 注册宿主提供的配置 schema，在该插件下一次安装或重载时生效
     */
    public void registerConfigSchema(String name, PluginConfigSchema schema) {
        configs.registerSchema(name, schema);
    }

    /**
     * 重新读取配置文件并按当前 schema 校验，失败时保留原配置
     */
    public PluginConfig reloadPluginConfig(String name) {
        PluginConfig pluginConfig = configs.get(name);
        pluginConfig.reload();
        return pluginConfig;
    }

    public Path savePluginConfig(String name, ConfigFormat format) {
        return configs.get(name).save(format);
    }

    // ==================== 注册表导入导出 API ====================

    public void exportRegistry(Path file) {
        registry.exportTo(file);
    }

    /**
     * 导入注册表，只能在没有运行中插件时进行（例如启动时 bootstrap 之前）
     * 导入后调用 {@link #bootstrap()} 加载其中的 ACTIVE 插件
     *
     * @throws IllegalPluginStateException 存在已加载的插件
     */
    public int importRegistry(Path file, ImportMode mode) {
        List<String> loaded = registry.list().stream()
                .map(PluginRecord::getName)
                .filter(name -> handles.current(name) != null)
                .collect(Collectors.toList());
        if (!loaded.isEmpty()) {
            throw new IllegalPluginStateException(loaded.get(0), registry.get(loaded.get(0)).getStatus().name(),
                    "Registry import requires no loaded plugins, found " + loaded);
        }
        return registry.importFrom(file, mode);
    }

    // ==================== 调用 API ====================

    /**
     * 调用插件能力
     *
     * @throws PluginUnavailableException 插件不是 ACTIVE 或正在重载
     */
    public Object execute(String name, String capability, Map<String, Object> params) {
        PluginRecord record = registry.get(name);
        if (record.getStatus() != PluginStatus.ACTIVE) {
            throw new PluginUnavailableException(name, "status is " + record.getStatus());
        }
        if (!record.getCapabilities().contains(capability)) {
            throw new InvalidArgumentException("capability",
                    "Plugin [" + name + "] does not provide capability: " + capability);
        }
        Map<String, Object> args = params != null ? params : Collections.emptyMap();
        return handles.withHandle(name, handle -> PluginCallExecutor.supplyInContext(handle.getClassLoader(),
                () -> handle.getPlugin().execute(capability, args)));
    }

    // ==================== 组件访问 ====================

    public EventBus getEventBus() {
        return eventBus;
    }

    public PlugFrameConfig getConfig() {
        return config;
    }

    public HandleReaper.ReaperStats getReaperStats() {
        return reaper.getStats();
    }

    PluginHandle currentHandle(String name) {
        return handles.current(name);
    }

    // ==================== 生命周期 ====================

    /**
     * 全局关闭
     * 按依赖逆序调用 onUnload，导出的状态写回注册表，下次 bootstrap 时恢复
     */
    public void shutdown() {
        log.info("Shutting down PluginManager...");
        lifecycleExecutor.shutdown();
        try {
            if (!lifecycleExecutor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Lifecycle executor did not terminate gracefully, forcing...");
                lifecycleExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            lifecycleExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        List<PluginRecord> active = registry.list().stream()
                .filter(PluginRecord::isActive)
                .collect(Collectors.toList());
        List<String> order = resolver.installOrder(active.stream()
                        .map(r -> {
                            PluginDefinition d = PluginDefinition.of(r.getName(), r.getVersion());
                            d.setDependencies(new ArrayList<>(r.getDependencies()));
                            return d;
                        })
                        .collect(Collectors.toList()))
                .stream().map(PluginDefinition::getName).collect(Collectors.toList());
        Collections.reverse(order);

        for (String name : order) {
            PluginHandle handle = handles.remove(name);
            if (handle == null) {
                continue;
            }
            try {
                PluginRecord record = registry.get(name);
                registry.put(record.toBuilder().stateBlob(loader.unload(handle)).build());
            } catch (RuntimeException e) {
                log.warn("[{}] Error unloading during shutdown: {}", name, e.getMessage());
            }
            reaper.retire(handle);
        }

        reaper.close();
        callExecutor.close();
        log.info("PluginManager shutdown complete.");
    }

    // ==================== 基础设施创建 ====================

    private ArtifactSource requireSource() {
        if (artifactSource == null) {
            throw new IllegalStateException("No ArtifactSource configured");
        }
        return artifactSource;
    }

    private static PersistenceBackend createBackend(PlugFrameConfig config) {
        if (config.getRegistryFile() == null || config.getRegistryFile().trim().isEmpty()) {
            return new InMemoryPersistenceBackend();
        }
        return new JsonFilePersistenceBackend(Paths.get(config.getRegistryFile()));
    }

    private ExecutorService createLifecycleExecutor() {
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                4, 4,
                KEEP_ALIVE_TIME, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                r -> {
                    Thread t = new Thread(r, "plugframe-lifecycle-" + threadNumber.getAndIncrement());
                    t.setDaemon(true);
                    t.setUncaughtExceptionHandler(
                            (thread, e) -> log.error("Lifecycle thread {} error: {}", thread.getName(),
                                    e.getMessage()));
                    return t;
                });
        executor.allowCoreThreadTimeOut(true);
        return executor;
    }
}
