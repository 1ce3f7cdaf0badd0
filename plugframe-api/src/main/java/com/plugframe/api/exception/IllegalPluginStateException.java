package com.plugframe.api.exception;

/**
 * 插件状态非法异常
 * 例如对非 ACTIVE 插件执行重载
 */
public class IllegalPluginStateException extends PlugFrameException {

    private final String pluginName;
    private final String currentStatus;

    public IllegalPluginStateException(String pluginName, String currentStatus, String message) {
        super(ErrorKind.INVALID_STATE, message);
        this.pluginName = pluginName;
        this.currentStatus = currentStatus;
    }

    public String getPluginName() {
        return pluginName;
    }

    public String getCurrentStatus() {
        return currentStatus;
    }
}
