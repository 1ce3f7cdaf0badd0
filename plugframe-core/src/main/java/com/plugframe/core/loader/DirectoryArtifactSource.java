package com.plugframe.core.loader;

import com.plugframe.api.config.PluginDefinition;
import com.plugframe.api.exception.PluginLoadException;
import com.plugframe.core.resolver.Version;
import com.plugframe.core.spi.ArtifactSource;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * 目录制品来源
 * 扫描插件根目录下带 plugin.yml 的 Jar 包和 classes 目录；每次解析都重新扫描，
 * 新放入目录的制品无需重启即可被安装或重载
 */
@Slf4j
public class DirectoryArtifactSource implements ArtifactSource {

    private final File home;

    public DirectoryArtifactSource(File home) {
        this.home = home;
    }

    public File getHome() {
        return home;
    }

    @Override
    public PluginArtifact resolve(String name, String version) {
        List<PluginArtifact> candidates = new ArrayList<>();
        for (PluginArtifact artifact : available()) {
            if (artifact.getName().equals(name)
                    && (version == null || Version.parse(artifact.getVersion()).equals(Version.parse(version)))) {
                candidates.add(artifact);
            }
        }
        return candidates.stream()
                .max(Comparator.comparing(a -> Version.parse(a.getVersion())))
                .orElseThrow(() -> new PluginLoadException(name, String.format(
                        "No artifact for plugin [%s] version %s in %s",
                        name, version != null ? version : "(latest)", home.getAbsolutePath())));
    }

    @Override
    public List<PluginArtifact> available() {
        List<PluginArtifact> artifacts = new ArrayList<>();
        File[] files = home.listFiles();
        if (files == null) {
            log.debug("Plugin home {} does not exist or is not a directory", home.getAbsolutePath());
            return artifacts;
        }
        Arrays.sort(files);
        for (File file : files) {
            PluginDefinition definition = PluginManifestLoader.parseDefinition(file);
            if (definition == null) {
                continue;
            }
            try {
                artifacts.add(PluginArtifact.fromSource(definition, file));
            } catch (RuntimeException e) {
                log.warn("Skipping artifact {}: {}", file.getName(), e.getMessage());
            }
        }
        return artifacts;
    }
}
