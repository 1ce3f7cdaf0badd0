package com.plugframe.api.event.lifecycle;

import lombok.Getter;

import java.util.List;

/**
 * 插件进入 FAILED 状态（需要人工介入）
 */
@Getter
public class PluginFailedEvent extends PluginLifecycleEvent {
    private final String reason;
    private final List<String> suspendedDependents;

    public PluginFailedEvent(String pluginName, String version, String reason, List<String> suspendedDependents) {
        super(pluginName, version);
        this.reason = reason;
        this.suspendedDependents = suspendedDependents;
    }
}
