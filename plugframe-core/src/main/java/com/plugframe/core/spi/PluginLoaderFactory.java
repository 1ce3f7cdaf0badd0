package com.plugframe.core.spi;

import java.io.File;

/**
 * 插件类加载器工厂 SPI
 * 每次加载源文件制品调用一次，返回的加载器只服务于该插件的这一个版本
 */
public interface PluginLoaderFactory {
    ClassLoader create(String pluginName, String version, File sourceFile, ClassLoader parent);
}
