package com.plugframe.core.lifecycle;

import com.plugframe.api.exception.OperationCancelledException;
import com.plugframe.core.enums.ReloadPhase;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 进行中的重载操作
 * <p>
 * 进入 BACKING_UP 之前可以取消，此时不会产生任何注册表变更；
 * 之后的取消请求只会被记录，操作照常走到终态（成功、回滚或失败）。
 */
@Slf4j
public class ReloadOperation {

    @Getter
    private final String pluginName;
    @Getter
    private final String targetVersion;

    private final AtomicReference<ReloadPhase> phase = new AtomicReference<>(ReloadPhase.PENDING);
    private final CompletableFuture<ReloadResult> future = new CompletableFuture<>();
    private volatile boolean cancelRequested;

    public ReloadOperation(String pluginName, String targetVersion) {
        this.pluginName = pluginName;
        this.targetVersion = targetVersion;
    }

    public ReloadPhase getPhase() {
        return phase.get();
    }

    public boolean isCancelRequested() {
        return cancelRequested;
    }

    public boolean isDone() {
        return future.isDone();
    }

    /**
     * 请求取消
     *
     * @return 取消是否生效（操作尚未开始备份）
     */
    public boolean cancel() {
        cancelRequested = true;
        if (phase.compareAndSet(ReloadPhase.PENDING, ReloadPhase.CANCELLED)) {
            log.info("[{}] Reload to {} cancelled before backup", pluginName, targetVersion);
            return true;
        }
        log.info("[{}] Cancel request recorded in phase {}, reload continues to a terminal state",
                pluginName, phase.get());
        return false;
    }

    /**
     * 等待结果
     *
     * @throws com.plugframe.api.exception.PlugFrameException 操作以异常结束（取消、Busy、回滚失败等）
     */
    public ReloadResult await() {
        try {
            return future.join();
        } catch (CompletionException e) {
            throw unwrap(e.getCause());
        }
    }

    public ReloadResult await(long timeout, TimeUnit unit) throws TimeoutException, InterruptedException {
        try {
            return future.get(timeout, unit);
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        }
    }

    public CompletableFuture<ReloadResult> toFuture() {
        return future.thenApply(r -> r);
    }

    // ==================== 协调器使用 ====================

    /**
     * 进入 BACKING_UP
     *
     * @throws OperationCancelledException 已被取消
     */
    void begin() {
        if (!phase.compareAndSet(ReloadPhase.PENDING, ReloadPhase.BACKING_UP)) {
            throw new OperationCancelledException(pluginName);
        }
    }

    void enter(ReloadPhase next) {
        ReloadPhase previous = phase.getAndSet(next);
        log.debug("[{}] Reload phase {} -> {}", pluginName, previous, next);
    }

    void complete(ReloadResult result) {
        future.complete(result);
    }

    void fail(Throwable error) {
        if (error instanceof OperationCancelledException) {
            phase.set(ReloadPhase.CANCELLED);
        }
        future.completeExceptionally(error);
    }

    private static RuntimeException unwrap(Throwable cause) {
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        return new IllegalStateException("Reload failed", cause);
    }
}
