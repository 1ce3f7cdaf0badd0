package com.plugframe.api.exception;

/**
 * 无效参数异常
 * 当传入的参数不满足业务要求时抛出此异常。
 */
public class InvalidArgumentException extends PlugFrameException {

    private final String paramName;

    public InvalidArgumentException(String paramName, String message) {
        super(ErrorKind.INVALID_ARGUMENT, message);
        this.paramName = paramName;
    }

    public InvalidArgumentException(String paramName, String message, Throwable cause) {
        super(ErrorKind.INVALID_ARGUMENT, message, cause);
        this.paramName = paramName;
    }

    public String getParamName() {
        return paramName;
    }
}
