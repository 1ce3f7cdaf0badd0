package com.plugframe.core.spi;

import com.plugframe.api.exception.PluginLoadException;
import com.plugframe.core.loader.PluginArtifact;

import java.util.List;

/**
 * 制品来源 SPI
 * 将 (name, version) 解析为可加载的制品
 */
public interface ArtifactSource {

    /**
     * @param version 为 null 时返回最新版本
     * @throws PluginLoadException 找不到对应制品
     */
    PluginArtifact resolve(String name, String version);

    /**
     * 当前可用的全部制品
     */
    List<PluginArtifact> available();
}
