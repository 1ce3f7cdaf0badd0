package com.plugframe.api.exception;

import java.util.Collections;
import java.util.Set;

/**
 * 依赖缺失异常
 * 依赖不存在、未处于活跃状态，或版本不满足约束
 */
public class MissingDependencyException extends PlugFrameException {

    private final String pluginName;
    private final Set<String> missing;

    public MissingDependencyException(String pluginName, Set<String> missing) {
        super(ErrorKind.MISSING_DEPENDENCY,
                String.format("Plugin [%s] has unsatisfied dependencies: %s", pluginName, missing));
        this.pluginName = pluginName;
        this.missing = Collections.unmodifiableSet(missing);
    }

    public String getPluginName() {
        return pluginName;
    }

    public Set<String> getMissing() {
        return missing;
    }
}
