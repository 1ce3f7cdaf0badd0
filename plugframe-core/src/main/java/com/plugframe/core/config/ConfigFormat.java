package com.plugframe.core.config;

/**
 * 插件配置文件格式，加载时 JSON 优先
 */
public enum ConfigFormat {
    JSON("json"),
    YAML("yaml");

    private final String extension;

    ConfigFormat(String extension) {
        this.extension = extension;
    }

    public String fileName(String pluginName) {
        return pluginName + "." + extension;
    }
}
