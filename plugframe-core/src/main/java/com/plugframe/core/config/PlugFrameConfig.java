package com.plugframe.core.config;

import lombok.Builder;
import lombok.Getter;

/**
 * 全局配置中心
 */
@Getter
@Builder(toBuilder = true)
public class PlugFrameConfig {

    // ==================== 回调控制 ====================

    /**
     * 插件回调（onLoad / onUnload / capabilities）超时时间（毫秒）
     * 超时等同于加载/卸载失败，触发回滚
     */
    @Builder.Default
    private long callbackTimeoutMs = 5000;

    /**
     * 获取插件锁的等待时间（毫秒）
     * 0 表示立即以 Busy 拒绝；大于 0 表示排队等待前一个操作结束
     */
    @Builder.Default
    private long lockWaitMs = 0;

    // ==================== 句柄回收 ====================

    /**
     * 退役句柄检查间隔（秒）
     */
    @Builder.Default
    private int reaperIntervalSeconds = 5;

    /**
     * 强制清理延迟时间（秒）
     * 退役句柄超过此时间仍有在途调用时强制关闭
     */
    @Builder.Default
    private int forceCleanupDelaySeconds = 30;

    // ==================== 存储 ====================

    /**
     * 插件制品根目录
     */
    @Builder.Default
    private String pluginHome = "plugins";

    /**
     * 注册表持久化文件，null 表示仅内存
     */
    private String registryFile;

    /**
     * 插件配置目录，存放 &lt;name&gt;.json / &lt;name&gt;.yaml
     */
    @Builder.Default
    private String configDir = "config/plugins";

    @Override
    public String toString() {
        return String.format(
                "PlugFrameConfig{timeout=%dms, lockWait=%dms, home=%s, registry=%s, configDir=%s}",
                callbackTimeoutMs, lockWaitMs, pluginHome, registryFile, configDir);
    }
}
