package com.plugframe.api.exception;

/**
 * 插件加载异常
 * 插件代码抛出异常、违反能力契约、超时或制品无法解析时抛出
 */
public class PluginLoadException extends PlugFrameException {

    private final String pluginName;

    public PluginLoadException(String pluginName, String message) {
        super(ErrorKind.LOAD_FAILURE, message);
        this.pluginName = pluginName;
    }

    public PluginLoadException(String pluginName, String message, Throwable cause) {
        super(ErrorKind.LOAD_FAILURE, message, cause);
        this.pluginName = pluginName;
    }

    public String getPluginName() {
        return pluginName;
    }
}
