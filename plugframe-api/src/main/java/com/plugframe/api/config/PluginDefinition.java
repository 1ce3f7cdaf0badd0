package com.plugframe.api.config;

import com.plugframe.api.exception.InvalidArgumentException;
import lombok.Getter;
import lombok.Setter;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 对应 plugin.yml 的根节点
 * 作为标准契约
 */
@Getter
@Setter
public class PluginDefinition implements Serializable {

    private static final Pattern NAME_PATTERN = Pattern.compile("^[a-zA-Z0-9_.-]+$");

    // === 基础元数据 ===
    private String name;
    private String version;
    private String description;
    private String author;
    private List<String> tags = new ArrayList<>();

    // === 运行时配置 ===
    private String mainClass; // 插件入口类全限定名

    // === 依赖配置 ===

    /**
     * 依赖声明，格式 name 或 name&gt;=1.0.0
     */
    private List<String> dependencies = new ArrayList<>();

    /**
     * 对依赖插件的能力要求：依赖名 -> 能力列表
     */
    private Map<String, List<String>> requiredCapabilities = new LinkedHashMap<>();

    // === 插件配置 ===

    /**
     * 配置字段声明，对应 config 目录下的 &lt;name&gt;.json 或 &lt;name&gt;.yaml
     */
    private List<ConfigFieldDefinition> configSchema = new ArrayList<>();

    /**
     * 深拷贝
     */
    public PluginDefinition copy() {
        PluginDefinition copy = new PluginDefinition();
        copy.name = this.name;
        copy.version = this.version;
        copy.description = this.description;
        copy.author = this.author;
        copy.mainClass = this.mainClass;
        copy.tags = this.tags != null ? new ArrayList<>(this.tags) : new ArrayList<>();
        copy.dependencies = this.dependencies != null ? new ArrayList<>(this.dependencies) : new ArrayList<>();
        copy.requiredCapabilities = new LinkedHashMap<>();
        if (this.requiredCapabilities != null) {
            this.requiredCapabilities.forEach((k, v) -> copy.requiredCapabilities.put(k, new ArrayList<>(v)));
        }
        copy.configSchema = new ArrayList<>();
        if (this.configSchema != null) {
            this.configSchema.forEach(field -> copy.configSchema.add(field.copy()));
        }
        return copy;
    }

    /**
     * 验证
     */
    public void validate() {
        if (name == null || name.trim().isEmpty()) {
            throw new InvalidArgumentException("name", "Plugin name cannot be blank");
        }
        if (!NAME_PATTERN.matcher(name).matches()) {
            throw new InvalidArgumentException("name", "Plugin name contains illegal characters: " + name);
        }
        if (version == null || version.trim().isEmpty()) {
            throw new InvalidArgumentException("version", "Plugin version cannot be blank");
        }
        if (dependencies != null) {
            for (String dependency : dependencies) {
                if (dependency == null || dependency.trim().isEmpty()) {
                    throw new InvalidArgumentException("dependencies", "Dependency entry cannot be blank");
                }
            }
        }
        if (configSchema != null) {
            for (ConfigFieldDefinition field : configSchema) {
                if (field == null || field.getName() == null || field.getName().trim().isEmpty()) {
                    throw new InvalidArgumentException("configSchema", "Config field name cannot be blank");
                }
            }
        }
    }

    public static PluginDefinition of(String name, String version, String... dependencies) {
        PluginDefinition definition = new PluginDefinition();
        definition.setName(name);
        definition.setVersion(version);
        definition.setDependencies(new ArrayList<>(List.of(dependencies)));
        return definition;
    }

    @Override
    public String toString() {
        return String.format("PluginDefinition{name='%s', version='%s', dependencies=%s}",
                name, version, dependencies);
    }
}
