package com.plugframe.api.exception;

/**
 * 操作已取消
 * 仅在卸载阶段开始之前取消时抛出，此时注册表未被修改
 */
public class OperationCancelledException extends PlugFrameException {

    public OperationCancelledException(String pluginName) {
        super(ErrorKind.CANCELLED, "Lifecycle operation cancelled before unloading: " + pluginName);
    }
}
