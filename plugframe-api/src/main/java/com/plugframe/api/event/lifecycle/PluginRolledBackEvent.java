package com.plugframe.api.event.lifecycle;

import lombok.Getter;

/**
 * 回滚完成事件：插件已恢复到原版本
 */
@Getter
public class PluginRolledBackEvent extends PluginLifecycleEvent {
    private final String rejectedVersion;
    private final String reason;

    public PluginRolledBackEvent(String pluginName, String version, String rejectedVersion, String reason) {
        super(pluginName, version);
        this.rejectedVersion = rejectedVersion;
        this.reason = reason;
    }
}
