package com.plugframe.core.classloader;

import com.plugframe.api.exception.InvalidArgumentException;
import com.plugframe.core.exception.ClassLoaderException;
import com.plugframe.core.spi.PluginLoaderFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.net.MalformedURLException;
import java.net.URL;

/**
 * 默认插件类加载器工厂
 * 每次调用都创建全新的 {@link PluginClassLoader}，parent 为宿主类加载器
 */
@Slf4j
public class DefaultPluginLoaderFactory implements PluginLoaderFactory {

    @Override
    public ClassLoader create(String pluginName, String version, File sourceFile, ClassLoader parent) {
        try {
            URL[] urls = resolveUrls(sourceFile);
            PluginClassLoader classLoader = new PluginClassLoader(pluginName, version, urls, parent);
            log.debug("[{}] Creating class loader for version {} from {}", pluginName, version, sourceFile);
            return classLoader;
        } catch (MalformedURLException e) {
            throw new ClassLoaderException(pluginName, sourceFile.getPath(), "Failed to create PluginClassLoader", e);
        }
    }

    private URL[] resolveUrls(File sourceFile) throws MalformedURLException {
        if (sourceFile.isDirectory() || sourceFile.getName().endsWith(".jar")) {
            // classes 目录（开发模式）或 JAR 包
            return new URL[]{sourceFile.toURI().toURL()};
        }
        throw new InvalidArgumentException("sourceFile", "Unsupported artifact type: " + sourceFile);
    }
}
