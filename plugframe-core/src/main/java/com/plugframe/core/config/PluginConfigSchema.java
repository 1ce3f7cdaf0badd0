package com.plugframe.core.config;

import com.plugframe.api.config.ConfigFieldDefinition;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 插件配置 schema：有序的字段集合
 */
public class PluginConfigSchema {

    private final List<ConfigField> fields = new ArrayList<>();

    public static PluginConfigSchema empty() {
        return new PluginConfigSchema();
    }

    public static PluginConfigSchema of(ConfigField... fields) {
        PluginConfigSchema schema = new PluginConfigSchema();
        Arrays.stream(fields).forEach(schema::addField);
        return schema;
    }

    public static PluginConfigSchema fromDefinitions(List<ConfigFieldDefinition> definitions) {
        PluginConfigSchema schema = new PluginConfigSchema();
        if (definitions != null) {
            definitions.stream().map(ConfigField::from).forEach(schema::addField);
        }
        return schema;
    }

    public PluginConfigSchema addField(ConfigField field) {
        fields.removeIf(existing -> existing.getName().equals(field.getName()));
        fields.add(field);
        return this;
    }

    public Optional<ConfigField> field(String name) {
        return fields.stream().filter(f -> f.getName().equals(name)).findFirst();
    }

    public List<ConfigField> getFields() {
        return Collections.unmodifiableList(fields);
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    /**
     * 未声明的键不检查
     *
     * @return 错误信息，空列表表示通过
     */
    public List<String> validate(Map<String, Object> config) {
        List<String> errors = new ArrayList<>();
        for (ConfigField field : fields) {
            if (!config.containsKey(field.getName())) {
                if (field.isRequired()) {
                    errors.add("Required field '" + field.getName() + "' is missing");
                }
                continue;
            }
            Object value = config.get(field.getName());
            if (!field.accepts(value)) {
                errors.add("Field '" + field.getName() + "' has invalid value: " + value);
            }
        }
        return errors;
    }

    public Map<String, Object> defaults() {
        Map<String, Object> defaults = new LinkedHashMap<>();
        for (ConfigField field : fields) {
            if (field.getDefaultValue() != null) {
                defaults.put(field.getName(), field.getDefaultValue());
            }
        }
        return defaults;
    }
}
