package com.plugframe.core.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.plugframe.api.exception.PluginConfigException;
import com.plugframe.core.exception.ConfigStorageException;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 单个插件的配置
 * <p>
 * 从 configDir 下的 &lt;name&gt;.json 读取，不存在时读 &lt;name&gt;.yaml；
 * 文件中的值覆盖 schema 默认值，两个文件都不存在时只有默认值。
 */
@Slf4j
public class PluginConfig {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE =
            new TypeReference<LinkedHashMap<String, Object>>() {
            };

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final String pluginName;
    private final PluginConfigSchema schema;
    private final Path configDir;
    private Map<String, Object> values;

    /**
     * 构造时读取配置文件，但不校验，见 {@link #validate()}
     *
     * @throws PluginConfigException 配置文件无法解析
     */
    public PluginConfig(String pluginName, PluginConfigSchema schema, Path configDir) {
        this.pluginName = pluginName;
        this.schema = schema != null ? schema : PluginConfigSchema.empty();
        this.configDir = configDir;
        this.values = read();
    }

    public String getPluginName() {
        return pluginName;
    }

    public PluginConfigSchema getSchema() {
        return schema;
    }

    /**
     * @return 错误信息，空列表表示通过
     */
    public synchronized List<String> validate() {
        return schema.validate(values);
    }

    public synchronized Object get(String key) {
        return values.get(key);
    }

    public synchronized Object get(String key, Object fallback) {
        return values.getOrDefault(key, fallback);
    }

    public synchronized Map<String, Object> asMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * schema 中声明的键必须通过字段校验，未声明的键直接写入
     *
     * @throws PluginConfigException 值不满足字段约束，原值不变
     */
    public synchronized void set(String key, Object value) {
        schema.field(key)
                .filter(field -> !field.accepts(value))
                .ifPresent(field -> {
                    throw new PluginConfigException(pluginName,
                            Collections.singletonList("Field '" + key + "' has invalid value: " + value));
                });
        values.put(key, value);
    }

    /**
     * 重新读取配置文件并校验，失败时保留当前值
     *
     * @throws PluginConfigException 文件无法解析或不满足 schema
     */
    public synchronized void reload() {
        Map<String, Object> candidate = read();
        List<String> errors = schema.validate(candidate);
        if (!errors.isEmpty()) {
            log.warn("[{}] Config reload rejected: {}", pluginName, errors);
            throw new PluginConfigException(pluginName, errors);
        }
        values = candidate;
        log.info("[{}] Config reloaded ({} keys)", pluginName, candidate.size());
    }

    /**
     * 写入 configDir/&lt;name&gt;.&lt;ext&gt;
     *
     * @throws ConfigStorageException 写入失败
     */
    public synchronized Path save(ConfigFormat format) {
        Path target = configDir.resolve(format.fileName(pluginName));
        try {
            Files.createDirectories(configDir);
            if (format == ConfigFormat.JSON) {
                MAPPER.writeValue(target.toFile(), values);
            } else {
                DumperOptions options = new DumperOptions();
                options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
                try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
                    new Yaml(options).dump(values, writer);
                }
            }
        } catch (IOException e) {
            throw new ConfigStorageException("Failed to write config of [" + pluginName + "] to " + target, e);
        }
        log.info("[{}] Config saved to {}", pluginName, target);
        return target;
    }

    private Map<String, Object> read() {
        Map<String, Object> merged = new LinkedHashMap<>(schema.defaults());
        Path json = configDir.resolve(ConfigFormat.JSON.fileName(pluginName));
        Path yaml = configDir.resolve(ConfigFormat.YAML.fileName(pluginName));
        if (Files.isRegularFile(json)) {
            merged.putAll(readJson(json));
        } else if (Files.isRegularFile(yaml)) {
            merged.putAll(readYaml(yaml));
        }
        return merged;
    }

    private Map<String, Object> readJson(Path file) {
        try {
            Map<String, Object> parsed = MAPPER.readValue(file.toFile(), MAP_TYPE);
            return parsed != null ? parsed : Collections.emptyMap();
        } catch (IOException e) {
            throw new PluginConfigException(pluginName, "Unreadable config file " + file + ": " + e.getMessage(), e);
        }
    }

    private Map<String, Object> readYaml(Path file) {
        Object parsed;
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            parsed = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
        } catch (IOException | YAMLException e) {
            throw new PluginConfigException(pluginName, "Unreadable config file " + file + ": " + e.getMessage(), e);
        }
        if (parsed == null) {
            return Collections.emptyMap();
        }
        if (!(parsed instanceof Map)) {
            throw new PluginConfigException(pluginName,
                    Collections.singletonList("Config file " + file + " must contain a mapping"));
        }
        Map<String, Object> result = new LinkedHashMap<>();
        ((Map<?, ?>) parsed).forEach((k, v) -> result.put(String.valueOf(k), v));
        return result;
    }
}
