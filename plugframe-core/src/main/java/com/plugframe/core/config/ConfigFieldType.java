package com.plugframe.core.config;

import com.plugframe.api.exception.InvalidArgumentException;

import java.math.BigInteger;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 配置字段类型
 */
public enum ConfigFieldType {

    STRING("string"),
    INTEGER("integer"),
    FLOAT("float"),
    BOOLEAN("boolean"),
    LIST("list"),
    DICT("dict");

    private final String key;

    ConfigFieldType(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    /**
     * JSON/YAML 解析出的值是否属于该类型，FLOAT 也接受整数
     */
    public boolean matches(Object value) {
        switch (this) {
            case STRING:
                return value instanceof String;
            case INTEGER:
                return value instanceof Integer || value instanceof Long || value instanceof Short
                        || value instanceof Byte || value instanceof BigInteger;
            case FLOAT:
                return value instanceof Number;
            case BOOLEAN:
                return value instanceof Boolean;
            case LIST:
                return value instanceof List;
            case DICT:
                return value instanceof Map;
            default:
                return false;
        }
    }

    /**
     * 按 key 解析，大小写不敏感，map 视为 dict
     */
    public static ConfigFieldType of(String text) {
        if (text == null || text.trim().isEmpty()) {
            return STRING;
        }
        String normalized = text.trim().toLowerCase(Locale.ROOT);
        if ("map".equals(normalized)) {
            return DICT;
        }
        for (ConfigFieldType type : values()) {
            if (type.key.equals(normalized)) {
                return type;
            }
        }
        throw new InvalidArgumentException("type", "Unknown config field type: " + text);
    }
}
