package com.plugframe.api.event;

/**
 * 框架事件标记接口
 */
public interface PluginEvent {

    long getTimestamp();
}
