package com.plugframe.starter.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * PlugFrame 主配置属性
 * <p>
 * 提供 IDE 智能提示和启动时校验。
 */
@Data
@Validated
@ConfigurationProperties(prefix = "plugframe")
public class PlugFrameProperties {

    /**
     * 是否启用 PlugFrame。
     */
    private boolean enabled = true;

    /**
     * 插件制品根目录，存放带 plugin.yml 的 Jar 包或 classes 目录。
     * 支持绝对路径和相对路径。
     */
    @NotBlank
    private String pluginHome = "plugins";

    /**
     * 注册表持久化文件（JSON）。
     * 不配置时注册表只保存在内存中，重启后丢失。
     */
    private String registryFile;

    /**
     * 插件配置文件目录，按 {@code <插件名>.json} 或 {@code <插件名>.yaml} 查找。
     */
    @NotBlank
    private String configDir = "config/plugins";

    /**
     * 启动时是否按持久化的注册表恢复插件。
     */
    private boolean bootstrapOnStartup = true;

    @Valid
    private Runtime runtime = new Runtime();

    private Dashboard dashboard = new Dashboard();

    @Data
    public static class Runtime {

        /**
         * 插件回调（onLoad / onUnload / capabilities）超时时间
         */
        @NotNull
        @DurationUnit(ChronoUnit.MILLIS)
        private Duration callbackTimeout = Duration.ofMillis(5000);

        /**
         * 获取插件锁的等待时间，0 表示立即以 Busy 拒绝
         */
        @NotNull
        @DurationUnit(ChronoUnit.MILLIS)
        private Duration lockWait = Duration.ZERO;

        // --- 句柄回收 ---

        @NotNull
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration reaperInterval = Duration.ofSeconds(5);

        @NotNull
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration forceCleanupDelay = Duration.ofSeconds(30);
    }

    @Data
    public static class Dashboard {
        /**
         * 是否暴露 /plugframe/plugins 管理接口
         */
        private boolean enabled = false;
    }
}
