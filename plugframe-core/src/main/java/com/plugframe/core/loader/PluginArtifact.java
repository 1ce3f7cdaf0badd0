package com.plugframe.core.loader;

import com.plugframe.api.config.PluginDefinition;
import com.plugframe.api.exception.InvalidArgumentException;
import com.plugframe.api.plugin.Plugin;
import lombok.Getter;

import java.io.File;
import java.util.function.Supplier;

/**
 * 可加载的插件制品
 * <p>
 * 两种形态：
 * <ul>
 * <li>源文件制品：Jar 包或 classes 目录，每次加载使用独立的 PluginClassLoader</li>
 * <li>内嵌制品：由工厂创建实例，与宿主共享类加载器，每次加载创建新实例</li>
 * </ul>
 */
@Getter
public class PluginArtifact {

    private static final String EMBEDDED_PREFIX = "embedded:";

    private final PluginDefinition definition;
    private final File source;
    private final Supplier<? extends Plugin> factory;

    private PluginArtifact(PluginDefinition definition, File source, Supplier<? extends Plugin> factory) {
        if (definition == null) {
            throw new InvalidArgumentException("definition", "Plugin definition cannot be null");
        }
        definition.validate();
        // 持有独立副本，调用方后续修改不影响制品
        this.definition = definition.copy();
        this.source = source;
        this.factory = factory;
    }

    /**
     * Jar 包或 classes 目录制品
     */
    public static PluginArtifact fromSource(PluginDefinition definition, File source) {
        if (source == null || !source.exists()) {
            throw new InvalidArgumentException("source", "Artifact source does not exist: " + source);
        }
        if (definition != null && (definition.getMainClass() == null || definition.getMainClass().trim().isEmpty())) {
            throw new InvalidArgumentException("mainClass", "mainClass is required for artifact " + source);
        }
        return new PluginArtifact(definition, source, null);
    }

    /**
     * 内嵌制品，每次加载调用一次工厂
     */
    public static PluginArtifact embedded(PluginDefinition definition, Supplier<? extends Plugin> factory) {
        if (factory == null) {
            throw new InvalidArgumentException("factory", "Plugin factory cannot be null");
        }
        return new PluginArtifact(definition, null, factory);
    }

    public String getName() {
        return definition.getName();
    }

    public String getVersion() {
        return definition.getVersion();
    }

    public boolean isEmbedded() {
        return source == null;
    }

    /**
     * 制品位置，用于持久化和启动恢复
     */
    public String getLocation() {
        return isEmbedded()
                ? EMBEDDED_PREFIX + getName() + ":" + getVersion()
                : source.getAbsolutePath();
    }

    @Override
    public String toString() {
        return String.format("PluginArtifact{%s:%s @ %s}", getName(), getVersion(), getLocation());
    }
}
