package com.plugframe.core.loader;

import com.plugframe.api.exception.PluginLoadException;
import com.plugframe.api.exception.PluginUnloadException;
import com.plugframe.api.plugin.StateBlob;

import java.util.Set;

/**
 * 插件加载器
 * <p>
 * 每次 {@link #load} 都产生全新的、可独立销毁的执行上下文；
 * 加载失败只抛出异常，不触碰注册表。
 */
public interface PluginLoader {

    /**
     * 实例化制品并调用 onLoad
     *
     * @throws PluginLoadException 插件代码抛出异常、超时或违反能力契约
     */
    PluginHandle load(PluginArtifact artifact, StateBlob state);

    /**
     * 调用 onUnload 并导出状态
     *
     * @throws IllegalStateException 句柄已卸载（编程错误，不应重试）
     * @throws PluginUnloadException 插件代码抛出异常或超时
     */
    StateBlob unload(PluginHandle handle);

    /**
     * 句柄暴露的能力集合
     */
    Set<String> capabilities(PluginHandle handle);

    /**
     * 不调用 onUnload，直接释放句柄（用于被拒绝的新句柄）
     */
    void discard(PluginHandle handle);
}
