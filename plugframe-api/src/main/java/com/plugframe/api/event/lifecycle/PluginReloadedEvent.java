package com.plugframe.api.event.lifecycle;

import lombok.Getter;

import java.util.List;

/**
 * 重载成功事件
 * needsRevalidation 为需要自行复核能力的活跃依赖方
 */
@Getter
public class PluginReloadedEvent extends PluginLifecycleEvent {
    private final String previousVersion;
    private final List<String> needsRevalidation;

    public PluginReloadedEvent(String pluginName, String version, String previousVersion,
                               List<String> needsRevalidation) {
        super(pluginName, version);
        this.previousVersion = previousVersion;
        this.needsRevalidation = needsRevalidation;
    }
}
