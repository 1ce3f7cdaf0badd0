package com.plugframe.api.event.lifecycle;

import lombok.Getter;

/**
 * 重载开始事件（备份之前发布）
 */
@Getter
public class PluginReloadingEvent extends PluginLifecycleEvent {
    private final String targetVersion;

    public PluginReloadingEvent(String pluginName, String version, String targetVersion) {
        super(pluginName, version);
        this.targetVersion = targetVersion;
    }
}
