package com.plugframe.api.exception;

/**
 * 回滚失败异常（致命）
 * 插件已被标记为 FAILED，需要人工介入，框架不会自动重试
 */
public class RollbackFailedException extends PlugFrameException {

    private final String pluginName;
    private final Throwable originalFailure;

    public RollbackFailedException(String pluginName, Throwable originalFailure, Throwable rollbackFailure) {
        super(ErrorKind.ROLLBACK_FAILURE,
                String.format("Rollback of plugin [%s] failed, plugin marked FAILED: %s",
                        pluginName, rollbackFailure.getMessage()),
                rollbackFailure);
        this.pluginName = pluginName;
        this.originalFailure = originalFailure;
    }

    public String getPluginName() {
        return pluginName;
    }

    /**
     * 触发回滚的原始错误
     */
    public Throwable getOriginalFailure() {
        return originalFailure;
    }
}
