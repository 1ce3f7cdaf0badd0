package com.plugframe.api.event;

import lombok.Getter;

/**
 * 事件基类
 */
@Getter
public abstract class AbstractPluginEvent implements PluginEvent {

    private final long timestamp;

    protected AbstractPluginEvent() {
        this.timestamp = System.currentTimeMillis();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "@" + timestamp;
    }
}
