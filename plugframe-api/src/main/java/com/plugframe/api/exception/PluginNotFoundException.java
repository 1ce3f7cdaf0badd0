package com.plugframe.api.exception;

/**
 * 插件未找到异常
 * 当请求的插件不存在时抛出此异常。
 */
public class PluginNotFoundException extends PlugFrameException {

    private final String pluginName;

    public PluginNotFoundException(String pluginName) {
        super(ErrorKind.NOT_FOUND, "Plugin not found: " + pluginName);
        this.pluginName = pluginName;
    }

    public String getPluginName() {
        return pluginName;
    }
}
