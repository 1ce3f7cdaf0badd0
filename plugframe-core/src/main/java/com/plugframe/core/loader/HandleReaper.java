package com.plugframe.core.loader;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 退役句柄回收器
 * 职责：管理死亡队列，在途调用归零后关闭句柄，超时后强制关闭
 */
@Slf4j
public class HandleReaper implements AutoCloseable {

    private final ConcurrentLinkedQueue<PluginHandle> dyingQueue = new ConcurrentLinkedQueue<>();
    private final long forceCleanupDelayMs;
    private final ScheduledExecutorService scheduler;

    public HandleReaper(int intervalSeconds, int forceCleanupDelaySeconds) {
        this.forceCleanupDelayMs = TimeUnit.SECONDS.toMillis(forceCleanupDelaySeconds);
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "plugframe-handle-reaper");
            t.setDaemon(true);
            t.setUncaughtExceptionHandler(
                    (thread, e) -> log.error("Reaper thread {} error: {}", thread.getName(), e.getMessage()));
            return t;
        });
        this.scheduler.scheduleWithFixedDelay(this::reap, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
    }

    /**
     * 将句柄移入死亡队列
     */
    public void retire(PluginHandle handle) {
        if (handle == null || handle.isRetired()) {
            return;
        }
        handle.markRetired();
        dyingQueue.add(handle);
        log.info("[{}] Handle {} moved to dying queue, dying count: {}",
                handle.getPluginName(), handle.getVersion(), dyingQueue.size());
        // 空闲句柄立即关闭
        if (handle.isIdle()) {
            reap();
        }
    }

    /**
     * 关闭空闲句柄，强制关闭超时句柄
     *
     * @return 关闭的句柄数量
     */
    public int reap() {
        long now = System.currentTimeMillis();
        int[] count = {0};
        dyingQueue.removeIf(handle -> {
            boolean overdue = now - handle.getRetiredAt() >= forceCleanupDelayMs;
            if (!handle.isIdle() && !overdue) {
                return false;
            }
            if (overdue && !handle.isIdle()) {
                log.warn("[{}] Force closing handle {} with {} active calls",
                        handle.getPluginName(), handle.getVersion(), handle.getActiveCalls());
            }
            try {
                handle.close();
                count[0]++;
            } catch (Exception e) {
                log.error("[{}] Failed to close handle {}", handle.getPluginName(), handle.getVersion(), e);
            }
            return true;
        });
        return count[0];
    }

    /**
     * 强制关闭所有退役句柄
     */
    public void forceCleanupAll() {
        if (!dyingQueue.isEmpty()) {
            log.warn("Force cleanup triggered, closing {} retired handles", dyingQueue.size());
        }
        PluginHandle handle;
        while ((handle = dyingQueue.poll()) != null) {
            handle.close();
        }
    }

    public int getDyingCount() {
        return dyingQueue.size();
    }

    public ReaperStats getStats() {
        return new ReaperStats(dyingQueue.size(),
                (int) dyingQueue.stream().filter(PluginHandle::isIdle).count());
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
        forceCleanupAll();
    }

    @Value
    public static class ReaperStats {
        int dyingCount;
        int idleCount;
    }
}
