package com.plugframe.api.event.lifecycle;

import com.plugframe.api.event.AbstractPluginEvent;
import lombok.Getter;

/**
 * 插件生命周期事件基类
 */
@Getter
public abstract class PluginLifecycleEvent extends AbstractPluginEvent {
    private final String pluginName;
    private final String version;

    protected PluginLifecycleEvent(String pluginName, String version) {
        super();
        this.pluginName = pluginName;
        this.version = version;
    }

    @Override
    public String toString() {
        return super.toString() + " source=" + pluginName + ":" + version;
    }
}
