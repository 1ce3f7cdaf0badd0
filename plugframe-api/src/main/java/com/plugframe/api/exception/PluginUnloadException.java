package com.plugframe.api.exception;

/**
 * 插件卸载异常
 */
public class PluginUnloadException extends PlugFrameException {

    private final String pluginName;

    public PluginUnloadException(String pluginName, String message, Throwable cause) {
        super(ErrorKind.UNLOAD_FAILURE, message, cause);
        this.pluginName = pluginName;
    }

    public String getPluginName() {
        return pluginName;
    }
}
