package com.plugframe.core.loader;

import com.plugframe.api.config.PluginDefinition;
import com.plugframe.api.exception.PluginLoadException;
import com.plugframe.core.util.YamlUtils;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.Yaml;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;

/**
 * plugin.yml 清单解析器（支持 Jar 和目录）
 */
@Slf4j
public class PluginManifestLoader {

    public static final String MANIFEST_NAME = "plugin.yml";

    private PluginManifestLoader() {
    }

    /**
     * 解析插件定义
     *
     * @param file 插件 Jar 或 classes 目录
     * @return 插件定义，如果不是合法插件则返回 null
     */
    public static PluginDefinition parseDefinition(File file) {
        try {
            return readDefinition(file);
        } catch (Exception e) {
            log.warn("Failed to read plugin manifest from {}: {}", file.getName(), e.getMessage());
            return null;
        }
    }

    /**
     * 解析插件定义，失败时抛出异常
     *
     * @throws PluginLoadException 不是插件制品或清单非法
     */
    public static PluginDefinition requireDefinition(File file) {
        PluginDefinition definition;
        try {
            definition = readDefinition(file);
        } catch (Exception e) {
            throw new PluginLoadException(file.getName(), "Invalid plugin manifest in " + file + ": " + e.getMessage(), e);
        }
        if (definition == null) {
            throw new PluginLoadException(file.getName(), "No " + MANIFEST_NAME + " found in " + file);
        }
        return definition;
    }

    private static PluginDefinition readDefinition(File file) throws IOException {
        if (file.isDirectory()) {
            File yml = new File(file, MANIFEST_NAME);
            if (!yml.exists()) {
                return null;
            }
            try (InputStream is = Files.newInputStream(yml.toPath())) {
                return load(is);
            }
        }
        if (file.getName().endsWith(".jar")) {
            try (JarFile jar = new JarFile(file)) {
                JarEntry entry = jar.getJarEntry(MANIFEST_NAME);
                if (entry == null) {
                    log.debug("Skipping jar {}: no {} inside", file.getName(), MANIFEST_NAME);
                    return null;
                }
                try (InputStream is = jar.getInputStream(entry)) {
                    return load(is);
                }
            }
        }
        return null; // 忽略非 Jar 和非目录的文件
    }

    private static PluginDefinition load(InputStream inputStream) {
        Yaml yaml = YamlUtils.createLoaderYaml(PluginDefinition.class);
        PluginDefinition definition = yaml.load(inputStream);
        if (definition != null) {
            definition.validate();
        }
        return definition;
    }
}
