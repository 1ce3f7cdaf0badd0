package com.plugframe.api.config;

import lombok.Getter;
import lombok.Setter;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * plugin.yml 中 configSchema 的单个字段声明
 * <pre>
 * configSchema:
 *   - name: greeting
 *     type: string
 *     required: true
 *     pattern: "[a-z]+"
 *   - name: retries
 *     type: integer
 *     defaultValue: 3
 *     min: 0
 *     max: 10
 * </pre>
 */
@Getter
@Setter
public class ConfigFieldDefinition implements Serializable {

    private String name;

    /**
     * string / integer / float / boolean / list / dict
     */
    private String type = "string";

    private boolean required;

    private Object defaultValue;

    private String description;

    // === 约束，未设置表示不检查 ===

    /**
     * 数值下限；字符串与列表按长度比较
     */
    private Double min;

    private Double max;

    /**
     * 字符串必须整体匹配的正则
     */
    private String pattern;

    /**
     * 允许的取值
     */
    private List<Object> allowed = new ArrayList<>();

    public static ConfigFieldDefinition of(String name, String type) {
        ConfigFieldDefinition definition = new ConfigFieldDefinition();
        definition.setName(name);
        definition.setType(type);
        return definition;
    }

    public ConfigFieldDefinition copy() {
        ConfigFieldDefinition copy = new ConfigFieldDefinition();
        copy.name = name;
        copy.type = type;
        copy.required = required;
        copy.defaultValue = defaultValue;
        copy.description = description;
        copy.min = min;
        copy.max = max;
        copy.pattern = pattern;
        copy.allowed = allowed != null ? new ArrayList<>(allowed) : new ArrayList<>();
        return copy;
    }
}
