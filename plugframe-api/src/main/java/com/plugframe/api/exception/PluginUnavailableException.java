package com.plugframe.api.exception;

/**
 * 插件不可用异常
 * <p>
 * 插件存在，但当前没有可用的执行句柄（例如正处于重载窗口，或已失败）
 */
public class PluginUnavailableException extends PlugFrameException {

    private final String pluginName;

    public PluginUnavailableException(String pluginName, String reason) {
        super(ErrorKind.UNAVAILABLE, "Plugin unavailable: " + pluginName + " - " + reason);
        this.pluginName = pluginName;
    }

    public String getPluginName() {
        return pluginName;
    }
}
