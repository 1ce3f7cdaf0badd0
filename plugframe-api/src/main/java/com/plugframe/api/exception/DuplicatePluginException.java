package com.plugframe.api.exception;

/**
 * 插件重名异常
 */
public class DuplicatePluginException extends PlugFrameException {

    private final String pluginName;

    public DuplicatePluginException(String pluginName) {
        super(ErrorKind.DUPLICATE_NAME, "Plugin already installed: " + pluginName);
        this.pluginName = pluginName;
    }

    public String getPluginName() {
        return pluginName;
    }
}
