package com.plugframe.core.loader;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * 插件回调执行器
 * 职责：线程隔离、超时控制、线程上下文类加载器切换
 * <p>
 * onLoad / onUnload / capabilities 都在独立线程上执行，超时后中断并向调用方抛出 {@link TimeoutException}，
 * 卡死的插件代码不会阻塞生命周期操作。
 */
@Slf4j
public class PluginCallExecutor implements AutoCloseable {

    private static final long KEEP_ALIVE_TIME = 60L;
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5L;

    private final ExecutorService executor;
    private final long timeoutMs;
    private final AtomicInteger threadNumber = new AtomicInteger(1);

    public PluginCallExecutor(long timeoutMs) {
        this.timeoutMs = timeoutMs;
        this.executor = new ThreadPoolExecutor(
                0, Integer.MAX_VALUE,
                KEEP_ALIVE_TIME, TimeUnit.SECONDS,
                new SynchronousQueue<>(),
                r -> {
                    Thread t = new Thread(r, "plugframe-callback-" + threadNumber.getAndIncrement());
                    t.setDaemon(true);
                    t.setUncaughtExceptionHandler(
                            (thread, e) -> log.error("Callback thread {} error: {}", thread.getName(), e.getMessage()));
                    return t;
                });
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    /**
     * 在回调线程上执行插件代码
     *
     * @param contextClassLoader 执行期间的线程上下文类加载器，null 表示不切换
     * @throws TimeoutException 超过 timeoutMs 未完成
     * @throws Exception        插件代码抛出的异常（Error 包装为 ExecutionException）
     */
    public <T> T call(String pluginName, String action, ClassLoader contextClassLoader, Callable<T> task)
            throws Exception {
        Future<T> future = executor.submit(() -> runInContext(contextClassLoader, task));
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.error("[{}] {} timed out after {}ms", pluginName, action, timeoutMs);
            throw new TimeoutException(action + " timed out after " + timeoutMs + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            throw e;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw e;
        }
    }

    /**
     * 在当前线程执行，期间切换线程上下文类加载器
     */
    private static <T> T runInContext(ClassLoader contextClassLoader, Callable<T> task) throws Exception {
        Thread currentThread = Thread.currentThread();
        ClassLoader original = currentThread.getContextClassLoader();
        if (contextClassLoader != null) {
            currentThread.setContextClassLoader(contextClassLoader);
        }
        try {
            return task.call();
        } finally {
            currentThread.setContextClassLoader(original);
        }
    }

    /**
     * 在调用方线程执行，期间切换线程上下文类加载器
     */
    public static <T> T supplyInContext(ClassLoader contextClassLoader, Supplier<T> task) {
        Thread currentThread = Thread.currentThread();
        ClassLoader original = currentThread.getContextClassLoader();
        if (contextClassLoader != null) {
            currentThread.setContextClassLoader(contextClassLoader);
        }
        try {
            return task.get();
        } finally {
            currentThread.setContextClassLoader(original);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Callback executor did not terminate during shutdownNow");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
