package com.plugframe.core.loader;

import com.plugframe.api.plugin.Plugin;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 插件执行句柄
 * <p>
 * 一次加载产生的、可独立销毁的执行上下文：插件实例 + 专属类加载器。
 * 调用方通过 {@link #tryEnter()} / {@link #exit()} 维护在途调用计数，
 * 句柄退役后等计数归零再关闭类加载器。
 */
@Slf4j
public class PluginHandle {

    @Getter
    private final String pluginName;
    @Getter
    private final String version;
    @Getter
    private final PluginArtifact artifact;
    @Getter
    private final Set<String> capabilities;
    @Getter
    private final long loadedAt = System.currentTimeMillis();

    private volatile Plugin plugin; // 非 final，以便 close() 时清除
    private volatile ClassLoader classLoader; // 非 final，以便 close() 时清除

    private final AtomicInteger activeCalls = new AtomicInteger(0);
    private final AtomicBoolean unloaded = new AtomicBoolean(false);
    private final AtomicBoolean retired = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile long retiredAt;

    public PluginHandle(PluginArtifact artifact, Plugin plugin, ClassLoader classLoader, Set<String> capabilities) {
        this.pluginName = artifact.getName();
        this.version = artifact.getVersion();
        this.artifact = artifact;
        this.plugin = plugin;
        this.classLoader = classLoader;
        this.capabilities = Collections.unmodifiableSet(new LinkedHashSet<>(capabilities));
    }

    // ==================== 访问 ====================

    public Plugin getPlugin() {
        Plugin p = plugin;
        if (p == null) {
            throw new IllegalStateException("Handle already closed: " + this);
        }
        return p;
    }

    public ClassLoader getClassLoader() {
        return classLoader;
    }

    // ==================== 引用计数 ====================

    /**
     * 进入句柄
     *
     * @return 句柄已退役时返回 false，调用方应重新获取当前句柄
     */
    public boolean tryEnter() {
        if (retired.get()) {
            return false;
        }
        activeCalls.incrementAndGet();
        // 双重检查：计数增加后再次确认没有被退役
        if (retired.get()) {
            activeCalls.decrementAndGet();
            return false;
        }
        return true;
    }

    public void exit() {
        activeCalls.decrementAndGet();
    }

    public int getActiveCalls() {
        return activeCalls.get();
    }

    public boolean isIdle() {
        return activeCalls.get() <= 0;
    }

    // ==================== 状态 ====================

    /**
     * 标记 onUnload 已执行
     *
     * @return 首次标记返回 true
     */
    boolean markUnloaded() {
        return unloaded.compareAndSet(false, true);
    }

    public boolean isUnloaded() {
        return unloaded.get();
    }

    public void markRetired() {
        if (retired.compareAndSet(false, true)) {
            retiredAt = System.currentTimeMillis();
        }
    }

    public boolean isRetired() {
        return retired.get();
    }

    public long getRetiredAt() {
        return retiredAt;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * 释放句柄：清除实例引用并关闭类加载器（幂等）
     */
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        ClassLoader cl = this.classLoader;
        this.plugin = null;
        this.classLoader = null;
        if (cl instanceof AutoCloseable) {
            try {
                ((AutoCloseable) cl).close();
            } catch (Exception e) {
                log.warn("[{}] Failed to close class loader of version {}", pluginName, version, e);
            }
        }
        log.debug("[{}] Handle closed: version={}", pluginName, version);
    }

    @Override
    public String toString() {
        return String.format("PluginHandle{%s:%s, active=%d, unloaded=%s, retired=%s}",
                pluginName, version, activeCalls.get(), unloaded.get(), retired.get());
    }
}
