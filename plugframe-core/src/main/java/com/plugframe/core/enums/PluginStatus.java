package com.plugframe.core.enums;

public enum PluginStatus {
    INSTALLING, // 安装中
    ACTIVE, // 运行中
    RELOADING, // 重载中
    ROLLING_BACK, // 回滚中
    FAILED, // 回滚失败，需人工介入
    SUSPENDED, // 依赖失败而挂起
    UNINSTALLED; // 已卸载

    /**
     * 是否处于重载窗口（此时允许持有上一版本句柄）
     */
    public boolean inReloadWindow() {
        return this == RELOADING || this == ROLLING_BACK;
    }

    /**
     * ACTIVE 或处于重载窗口：仍然在为依赖方提供服务
     */
    public boolean isLive() {
        return this == ACTIVE || inReloadWindow();
    }

    /**
     * 是否为操作进行中的过渡状态
     */
    public boolean isTransient() {
        return this == INSTALLING || inReloadWindow();
    }
}
