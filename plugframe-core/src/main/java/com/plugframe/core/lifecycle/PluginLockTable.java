package com.plugframe.core.lifecycle;

import com.plugframe.api.exception.PluginBusyException;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 按插件名划分的操作锁
 * 同一插件同一时刻最多一个生命周期操作，不同插件之间互不阻塞
 */
@Slf4j
public class PluginLockTable {

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final long waitMs;

    /**
     * @param waitMs 0 表示立即以 Busy 拒绝，大于 0 表示最多等待的毫秒数
     */
    public PluginLockTable(long waitMs) {
        this.waitMs = waitMs;
    }

    /**
     * 拿到的锁已被 {@link #releaseAndRemove} 摘除时，重新取表中的当前锁再试
     *
     * @throws PluginBusyException 锁被其他操作持有
     */
    public void acquire(String name) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(waitMs);
        while (true) {
            ReentrantLock lock = locks.computeIfAbsent(name, k -> new ReentrantLock());
            if (!tryLock(lock, deadline)) {
                log.warn("[{}] Rejected: another lifecycle operation is in progress", name);
                throw new PluginBusyException(name);
            }
            if (locks.get(name) == lock) {
                return;
            }
            lock.unlock();
        }
    }

    private boolean tryLock(ReentrantLock lock, long deadline) {
        if (waitMs <= 0) {
            return lock.tryLock();
        }
        try {
            return lock.tryLock(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public void release(String name) {
        ReentrantLock lock = locks.get(name);
        if (lock != null && lock.isHeldByCurrentThread()) {
            lock.unlock();
        }
    }

    /**
     * 卸载完成后释放并移除该名字的锁，调用方必须持有锁
     */
    public void releaseAndRemove(String name) {
        ReentrantLock lock = locks.get(name);
        if (lock == null || !lock.isHeldByCurrentThread()) {
            return;
        }
        if (lock.getHoldCount() == 1) {
            locks.remove(name, lock);
        }
        lock.unlock();
    }

    public int size() {
        return locks.size();
    }

    public boolean isLocked(String name) {
        ReentrantLock lock = locks.get(name);
        return lock != null && lock.isLocked();
    }
}
