package com.plugframe.core.config;

import com.plugframe.api.config.ConfigFieldDefinition;
import lombok.Builder;
import lombok.Getter;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * 配置字段
 * <p>
 * 宿主可以直接用 builder 提供任意 validator；
 * 从 plugin.yml 声明构造时，min/max/pattern/allowed 被组合成 validator。
 */
@Getter
@Builder
public class ConfigField {

    private final String name;

    @Builder.Default
    private final ConfigFieldType type = ConfigFieldType.STRING;

    private final boolean required;

    private final Object defaultValue;

    private final String description;

    /**
     * 类型检查通过后才会调用
     */
    private final Predicate<Object> validator;

    public boolean accepts(Object value) {
        if (!type.matches(value)) {
            return false;
        }
        return validator == null || validator.test(value);
    }

    public static ConfigField from(ConfigFieldDefinition definition) {
        return ConfigField.builder()
                .name(definition.getName())
                .type(ConfigFieldType.of(definition.getType()))
                .required(definition.isRequired())
                .defaultValue(definition.getDefaultValue())
                .description(definition.getDescription())
                .validator(constraintsOf(definition))
                .build();
    }

    private static Predicate<Object> constraintsOf(ConfigFieldDefinition definition) {
        Predicate<Object> check = value -> true;
        if (definition.getMin() != null) {
            double min = definition.getMin();
            check = check.and(value -> magnitude(value) >= min);
        }
        if (definition.getMax() != null) {
            double max = definition.getMax();
            check = check.and(value -> magnitude(value) <= max);
        }
        if (definition.getPattern() != null) {
            Pattern pattern = Pattern.compile(definition.getPattern());
            check = check.and(value -> !(value instanceof String) || pattern.matcher((String) value).matches());
        }
        List<Object> allowed = definition.getAllowed();
        if (allowed != null && !allowed.isEmpty()) {
            check = check.and(value -> allowed.stream().anyMatch(candidate -> sameValue(candidate, value)));
        }
        return check;
    }

    /**
     * 数值取本身，字符串与集合取长度
     */
    private static double magnitude(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            return ((String) value).length();
        }
        if (value instanceof Collection) {
            return ((Collection<?>) value).size();
        }
        if (value instanceof Map) {
            return ((Map<?, ?>) value).size();
        }
        return 0;
    }

    // YAML 中的 3 与 JSON 中的 3L 视为同一个值
    private static boolean sameValue(Object allowed, Object value) {
        if (allowed instanceof Number && value instanceof Number) {
            return ((Number) allowed).doubleValue() == ((Number) value).doubleValue();
        }
        return allowed != null && allowed.equals(value);
    }
}
