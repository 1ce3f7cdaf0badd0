package com.plugframe.core.registry;

import com.plugframe.api.plugin.StateBlob;
import com.plugframe.core.enums.PluginStatus;
import com.plugframe.core.loader.PluginHandle;
import com.plugframe.core.resolver.DependencyResolver;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 插件注册记录
 * <p>
 * 不可变值对象：注册表整体替换记录，读者不会看到写了一半的记录。
 * previousVersionHandle 只在 RELOADING / ROLLING_BACK 期间非空，且不会被持久化。
 */
@Value
@Builder(toBuilder = true)
public class PluginRecord {

    @NonNull
    String name;

    @NonNull
    String version;

    /**
     * 依赖声明（保持声明顺序）
     */
    @Singular
    Set<String> dependencies;

    /**
     * 对依赖的能力要求：依赖名 -> 能力集合
     */
    @Singular
    Map<String, Set<String>> requiredCapabilities;

    /**
     * 当前句柄暴露的能力
     */
    @Singular
    Set<String> capabilities;

    @NonNull
    PluginStatus status;

    @Builder.Default
    StateBlob stateBlob = StateBlob.empty();

    PluginHandle previousVersionHandle;

    String previousVersion;

    String artifactLocation;

    String description;

    String author;

    @Singular
    List<String> tags;

    String failureReason;

    Instant installedAt;

    Instant updatedAt;

    public boolean isActive() {
        return status == PluginStatus.ACTIVE;
    }

    /**
     * 依赖名（去掉版本约束）
     */
    public Set<String> dependencyNames() {
        return DependencyResolver.namesOf(dependencies);
    }

    @Override
    public String toString() {
        return String.format("PluginRecord{name='%s', version='%s', status=%s, deps=%s}",
                name, version, status, dependencies);
    }
}
