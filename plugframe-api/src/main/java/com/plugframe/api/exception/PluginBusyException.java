package com.plugframe.api.exception;

/**
 * 插件忙异常
 * 同一插件已有进行中的生命周期操作
 */
public class PluginBusyException extends PlugFrameException {

    private final String pluginName;

    public PluginBusyException(String pluginName) {
        super(ErrorKind.BUSY, "Plugin is busy with another lifecycle operation: " + pluginName);
        this.pluginName = pluginName;
    }

    public String getPluginName() {
        return pluginName;
    }
}
