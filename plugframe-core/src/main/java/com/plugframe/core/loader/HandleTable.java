package com.plugframe.core.loader;

import com.plugframe.api.exception.PluginUnavailableException;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * 句柄表
 * <p>
 * 每个插件一个间接引用单元，调用方通过它访问当前句柄；
 * 只有生命周期协调器会交换或清空单元，重载期间单元为空，调用方得到 Unavailable。
 */
@Slf4j
public class HandleTable {

    private final Map<String, AtomicReference<PluginHandle>> cells = new ConcurrentHashMap<>();

    /**
     * 当前句柄，可能为 null
     */
    public PluginHandle current(String name) {
        AtomicReference<PluginHandle> cell = cells.get(name);
        return cell != null ? cell.get() : null;
    }

    /**
     * 设置新句柄
     *
     * @return 被替换的句柄
     */
    public PluginHandle swap(String name, PluginHandle next) {
        PluginHandle previous = cells.computeIfAbsent(name, k -> new AtomicReference<>()).getAndSet(next);
        log.debug("[{}] Handle swapped: {} -> {}", name,
                previous != null ? previous.getVersion() : null, next != null ? next.getVersion() : null);
        return previous;
    }

    /**
     * 清空单元（重载窗口内）
     */
    public PluginHandle clear(String name) {
        return swap(name, null);
    }

    /**
     * 删除单元（卸载后）
     */
    public PluginHandle remove(String name) {
        AtomicReference<PluginHandle> cell = cells.remove(name);
        return cell != null ? cell.getAndSet(null) : null;
    }

    /**
     * 以引用计数方式使用当前句柄
     *
     * @throws PluginUnavailableException 单元为空（重载中或插件不可用）
     */
    public <R> R withHandle(String name, Function<PluginHandle, R> action) {
        while (true) {
            PluginHandle handle = current(name);
            if (handle == null) {
                throw new PluginUnavailableException(name, "no active handle");
            }
            if (!handle.tryEnter()) {
                // 句柄刚被退役，重新读取单元
                if (current(name) == handle) {
                    throw new PluginUnavailableException(name, "handle retired");
                }
                continue;
            }
            try {
                return action.apply(handle);
            } finally {
                handle.exit();
            }
        }
    }

    public int size() {
        return cells.size();
    }
}
