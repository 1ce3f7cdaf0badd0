package com.plugframe.api.exception;

/**
 * 错误类型
 * 对外接口（例如 HTTP 层）按此枚举返回结构化错误
 */
public enum ErrorKind {
    NOT_FOUND, // 插件不存在
    DUPLICATE_NAME, // 名称冲突
    CYCLE_DETECTED, // 依赖成环
    MISSING_DEPENDENCY, // 依赖缺失或版本不满足
    DEPENDENCY_VIOLATION, // 仍被活跃插件依赖
    BUSY, // 同名插件有进行中的操作
    LOAD_FAILURE, // 加载失败
    UNLOAD_FAILURE, // 卸载失败
    ROLLBACK_FAILURE, // 回滚失败（致命）
    INVALID_STATE, // 当前状态不允许该操作
    CANCELLED, // 操作被取消
    UNAVAILABLE, // 插件暂不可用
    INVALID_ARGUMENT, // 参数非法
    INVALID_CONFIG; // 插件配置不满足 schema

    /**
     * 是否为致命错误（需要人工介入）
     */
    public boolean isFatal() {
        return this == ROLLBACK_FAILURE;
    }
}
