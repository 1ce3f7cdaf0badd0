package com.plugframe.api.exception;

/**
 * 框架异常基类
 */
public class PlugFrameException extends RuntimeException {

    private final ErrorKind kind;

    public PlugFrameException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public PlugFrameException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
