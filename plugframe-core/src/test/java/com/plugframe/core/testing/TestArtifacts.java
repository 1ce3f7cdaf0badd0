package com.plugframe.core.testing;

import com.plugframe.api.config.PluginDefinition;
import com.plugframe.api.plugin.Plugin;
import com.plugframe.core.loader.PluginArtifact;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * 测试制品构造
 */
public final class TestArtifacts {

    private TestArtifacts() {
    }

    public static PluginDefinition definition(String name, String version, String... dependencies) {
        return PluginDefinition.of(name, version, dependencies);
    }

    public static PluginArtifact embedded(String name, String version, Supplier<? extends Plugin> factory,
                                          String... dependencies) {
        return PluginArtifact.embedded(definition(name, version, dependencies), factory);
    }

    public static PluginArtifact counter(String name, String version, String... dependencies) {
        return embedded(name, version, CounterPlugin::new, dependencies);
    }

    public static PluginArtifact failing(String name, String version, String... dependencies) {
        return embedded(name, version, FailingPlugin::new, dependencies);
    }

    /**
     * 声明对 dependency 的能力要求
     */
    public static PluginArtifact requiring(String name, String version, String dependency,
                                           String... capabilities) {
        PluginDefinition definition = definition(name, version, dependency);
        definition.setRequiredCapabilities(Map.of(dependency, List.of(capabilities)));
        return PluginArtifact.embedded(definition, CounterPlugin::new);
    }

    /**
     * 带额外能力的计数插件
     */
    public static PluginArtifact counterWith(String name, String version, String... capabilities) {
        return embedded(name, version, () -> new CounterPlugin(capabilities));
    }

    public static List<String> names(String... names) {
        return Arrays.asList(names);
    }
}
