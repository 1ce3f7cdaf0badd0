package com.plugframe.api.exception;

import java.util.Collections;
import java.util.List;

/**
 * 依赖约束违反异常
 * 卸载仍被活跃插件依赖的插件时抛出
 */
public class DependencyViolationException extends PlugFrameException {

    private final String pluginName;
    private final List<String> dependents;

    public DependencyViolationException(String pluginName, List<String> dependents) {
        super(ErrorKind.DEPENDENCY_VIOLATION,
                String.format("Plugin [%s] is required by active plugins: %s", pluginName, dependents));
        this.pluginName = pluginName;
        this.dependents = Collections.unmodifiableList(dependents);
    }

    public String getPluginName() {
        return pluginName;
    }

    public List<String> getDependents() {
        return dependents;
    }
}
