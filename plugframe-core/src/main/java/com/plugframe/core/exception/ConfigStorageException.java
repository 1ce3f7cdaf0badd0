package com.plugframe.core.exception;

/**
 * 插件配置文件写入失败
 */
public class ConfigStorageException extends RuntimeException {

    public ConfigStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
