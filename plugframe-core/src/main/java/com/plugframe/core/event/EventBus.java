package com.plugframe.core.event;

import com.plugframe.api.event.PluginEvent;
import com.plugframe.api.event.PluginEventListener;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 进程内事件总线
 * <p>
 * 生命周期事件在状态提交之后发布，监听器异常只记录日志，不影响已完成的操作。
 */
@Slf4j
public class EventBus {

    private final Map<Class<? extends PluginEvent>, List<ListenerWrapper>> listeners =
            new ConcurrentHashMap<>();

    // 包装器，记录监听器归属方
    @Value
    public static class ListenerWrapper {
        String owner;
        PluginEventListener<? extends PluginEvent> listener;
    }

    /**
     * 注册监听器
     *
     * @param owner 监听器归属方（插件名或宿主组件名），用于批量注销
     */
    public <E extends PluginEvent> void subscribe(String owner, Class<E> eventType, PluginEventListener<E> listener) {
        listeners.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>())
                .add(new ListenerWrapper(owner, listener));
    }

    /**
     * 移除归属方注册的所有监听器
     */
    public void unsubscribeAll(String owner) {
        for (List<ListenerWrapper> list : listeners.values()) {
            list.removeIf(wrapper -> {
                boolean match = wrapper.getOwner().equals(owner);
                if (match) {
                    log.debug("Removed listener: {}", wrapper.getListener().getClass().getName());
                }
                return match;
            });
        }
    }

    @SuppressWarnings("unchecked")
    public <E extends PluginEvent> void publish(E event) {
        List<ListenerWrapper> wrappers = listeners.get(event.getClass());
        if (wrappers == null) return;
        for (ListenerWrapper wrapper : wrappers) {
            try {
                ((PluginEventListener<E>) wrapper.getListener()).onEvent(event);
            } catch (Exception e) {
                log.error("Event listener of [{}] failed on {}", wrapper.getOwner(), event, e);
            }
        }
    }
}
