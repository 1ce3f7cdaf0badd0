package com.plugframe.api.exception;

import java.util.Collections;
import java.util.List;

/**
 * 依赖成环异常
 * cyclePath 首尾为同一个插件，例如 [a, b, c, a]
 */
public class CycleDetectedException extends PlugFrameException {

    private final List<String> cyclePath;

    public CycleDetectedException(List<String> cyclePath) {
        super(ErrorKind.CYCLE_DETECTED, "Dependency cycle detected: " + String.join(" -> ", cyclePath));
        this.cyclePath = Collections.unmodifiableList(cyclePath);
    }

    public List<String> getCyclePath() {
        return cyclePath;
    }
}
