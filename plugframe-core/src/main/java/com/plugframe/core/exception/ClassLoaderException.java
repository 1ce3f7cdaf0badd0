package com.plugframe.core.exception;

import com.plugframe.api.exception.ErrorKind;
import com.plugframe.api.exception.PlugFrameException;

/**
 * 类加载器异常
 * 用于类加载器创建失败、关闭后继续使用等场景。
 */
public class ClassLoaderException extends PlugFrameException {

    private final String pluginName;
    private final String resource;

    public ClassLoaderException(String pluginName, String resource, String message) {
        super(ErrorKind.LOAD_FAILURE, message);
        this.pluginName = pluginName;
        this.resource = resource;
    }

    public ClassLoaderException(String pluginName, String resource, String message, Throwable cause) {
        super(ErrorKind.LOAD_FAILURE, message, cause);
        this.pluginName = pluginName;
        this.resource = resource;
    }

    public String getPluginName() {
        return pluginName;
    }

    public String getResource() {
        return resource;
    }
}
