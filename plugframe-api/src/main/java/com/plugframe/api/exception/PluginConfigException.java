package com.plugframe.api.exception;

import java.util.Collections;
import java.util.List;

/**
 * 插件配置不满足 schema，或配置文件无法解析
 */
public class PluginConfigException extends PlugFrameException {

    private final String pluginName;
    private final List<String> errors;

    public PluginConfigException(String pluginName, List<String> errors) {
        super(ErrorKind.INVALID_CONFIG, "Invalid configuration for plugin [" + pluginName + "]: " + errors);
        this.pluginName = pluginName;
        this.errors = Collections.unmodifiableList(errors);
    }

    public PluginConfigException(String pluginName, String error, Throwable cause) {
        super(ErrorKind.INVALID_CONFIG, "Invalid configuration for plugin [" + pluginName + "]: " + error, cause);
        this.pluginName = pluginName;
        this.errors = Collections.singletonList(error);
    }

    public String getPluginName() {
        return pluginName;
    }

    public List<String> getErrors() {
        return errors;
    }
}
