package com.plugframe.core.enums;

/**
 * 重载状态机阶段
 * <pre>
 * BACKING_UP -> UNLOADING -> LOADING_NEW -> RESTORING_STATE -> COMMITTED
 *                  任一步失败 -> ROLLING_BACK -> ROLLED_BACK | FAILED
 * </pre>
 */
public enum ReloadPhase {
    PENDING,
    BACKING_UP,
    UNLOADING,
    LOADING_NEW,
    RESTORING_STATE,
    ROLLING_BACK,
    COMMITTED,
    ROLLED_BACK,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMMITTED || this == ROLLED_BACK || this == FAILED || this == CANCELLED;
    }
}
