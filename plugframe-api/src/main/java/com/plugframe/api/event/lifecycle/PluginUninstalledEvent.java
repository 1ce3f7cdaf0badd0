package com.plugframe.api.event.lifecycle;

/**
 * 卸载完成事件
 * 场景：清理配置、删除临时文件
 */
public class PluginUninstalledEvent extends PluginLifecycleEvent {
    public PluginUninstalledEvent(String pluginName, String version) {
        super(pluginName, version);
    }
}
