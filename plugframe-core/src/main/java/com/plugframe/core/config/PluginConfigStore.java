package com.plugframe.core.config;

import com.plugframe.api.config.PluginDefinition;
import com.plugframe.api.exception.PluginConfigException;
import com.plugframe.api.exception.PluginNotFoundException;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 已安装插件的配置表
 * <p>
 * 安装、重载、恢复前用新版本的 schema 准备并校验配置，提交成功后才替换当前配置；
 * 宿主注册的 schema 优先于 plugin.yml 中的声明。
 */
@Slf4j
public class PluginConfigStore {

    private final Path configDir;
    private final Map<String, PluginConfig> configs = new ConcurrentHashMap<>();
    private final Map<String, PluginConfigSchema> hostSchemas = new ConcurrentHashMap<>();

    public PluginConfigStore(Path configDir) {
        this.configDir = configDir;
    }

    public Path getConfigDir() {
        return configDir;
    }

    /**
     * 宿主为某个插件提供的 schema（可带任意 validator），之后的 prepare 生效
     */
    public void registerSchema(String pluginName, PluginConfigSchema schema) {
        hostSchemas.put(pluginName, schema);
    }

    /**
     * 读取并校验 definition 对应的配置，不影响当前配置
     *
     * @throws PluginConfigException 配置文件无法解析或不满足 schema
     */
    public PluginConfig prepare(PluginDefinition definition) {
        String name = definition.getName();
        PluginConfigSchema schema = hostSchemas.getOrDefault(name,
                PluginConfigSchema.fromDefinitions(definition.getConfigSchema()));
        PluginConfig config = new PluginConfig(name, schema, configDir);
        List<String> errors = config.validate();
        if (!errors.isEmpty()) {
            log.warn("[{}] Config of version {} rejected: {}", name, definition.getVersion(), errors);
            throw new PluginConfigException(name, errors);
        }
        return config;
    }

    public void activate(PluginConfig config) {
        configs.put(config.getPluginName(), config);
    }

    /**
     * @throws PluginNotFoundException 插件未安装
     */
    public PluginConfig get(String pluginName) {
        return find(pluginName).orElseThrow(() -> new PluginNotFoundException(pluginName));
    }

    public Optional<PluginConfig> find(String pluginName) {
        return Optional.ofNullable(configs.get(pluginName));
    }

    /**
     * 卸载时调用，配置文件保留
     */
    public void remove(String pluginName) {
        configs.remove(pluginName);
    }
}
