package com.plugframe.core.persistence;

import com.plugframe.api.plugin.StateBlob;
import com.plugframe.core.enums.PluginStatus;
import com.plugframe.core.registry.PluginRecord;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * 注册记录的落盘格式
 */
@Data
@NoArgsConstructor
public class PersistedRecord {

    private String name;
    private String version;
    private List<String> dependencies = new ArrayList<>();
    private Map<String, List<String>> requiredCapabilities = new LinkedHashMap<>();
    private List<String> capabilities = new ArrayList<>();
    private PluginStatus status;
    private int stateSchemaVersion;
    private byte[] stateData;
    private String previousVersion;
    private String artifactLocation;
    private String description;
    private String author;
    private List<String> tags = new ArrayList<>();
    private String failureReason;
    private Long installedAt;
    private Long updatedAt;

    public static PersistedRecord from(PluginRecord record) {
        PersistedRecord p = new PersistedRecord();
        p.name = record.getName();
        p.version = record.getVersion();
        p.dependencies = new ArrayList<>(record.getDependencies());
        record.getRequiredCapabilities().forEach((k, v) -> p.requiredCapabilities.put(k, new ArrayList<>(v)));
        p.capabilities = new ArrayList<>(record.getCapabilities());
        p.status = record.getStatus();
        p.stateSchemaVersion = record.getStateBlob().getSchemaVersion();
        p.stateData = record.getStateBlob().getData();
        p.previousVersion = record.getPreviousVersion();
        p.artifactLocation = record.getArtifactLocation();
        p.description = record.getDescription();
        p.author = record.getAuthor();
        p.tags = new ArrayList<>(record.getTags());
        p.failureReason = record.getFailureReason();
        p.installedAt = record.getInstalledAt() != null ? record.getInstalledAt().toEpochMilli() : null;
        p.updatedAt = record.getUpdatedAt() != null ? record.getUpdatedAt().toEpochMilli() : null;
        return p;
    }

    public PluginRecord toRecord() {
        PluginRecord.PluginRecordBuilder builder = PluginRecord.builder()
                .name(name)
                .version(version)
                .dependencies(dependencies != null ? dependencies : new ArrayList<>())
                .capabilities(capabilities != null ? capabilities : new ArrayList<>())
                .status(status)
                .stateBlob(StateBlob.of(stateSchemaVersion, stateData))
                .previousVersion(previousVersion)
                .artifactLocation(artifactLocation)
                .description(description)
                .author(author)
                .tags(tags != null ? tags : new ArrayList<>())
                .failureReason(failureReason)
                .installedAt(installedAt != null ? Instant.ofEpochMilli(installedAt) : null)
                .updatedAt(updatedAt != null ? Instant.ofEpochMilli(updatedAt) : null);
        if (requiredCapabilities != null) {
            requiredCapabilities.forEach((k, v) -> builder.requiredCapability(k, new LinkedHashSet<>(v)));
        }
        return builder.build();
    }
}
