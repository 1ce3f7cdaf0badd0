package com.plugframe.core.resolver;

import lombok.Value;

import java.util.List;

/**
 * 重载影响范围
 * 只有 target 被重载，依赖它的 ACTIVE 插件仅标记为需要重新校验
 */
@Value
public class ReloadPlan {
    String target;
    List<String> needsRevalidation;

    public boolean hasDependents() {
        return !needsRevalidation.isEmpty();
    }
}
