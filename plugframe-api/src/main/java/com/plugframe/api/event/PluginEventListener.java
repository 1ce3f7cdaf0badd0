package com.plugframe.api.event;

/**
 * 事件监听器
 */
@FunctionalInterface
public interface PluginEventListener<E extends PluginEvent> {

    void onEvent(E event);
}
