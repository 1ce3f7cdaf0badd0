package com.plugframe.core.exception;

/**
 * 注册表存储异常
 * 持久化后端读写失败时抛出
 */
public class RegistryStorageException extends RuntimeException {

    public RegistryStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
