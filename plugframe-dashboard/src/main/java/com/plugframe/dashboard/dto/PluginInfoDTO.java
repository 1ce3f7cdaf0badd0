package com.plugframe.dashboard.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PluginInfoDTO {

    private String name;

    private String version;

    private String status;

    private List<String> dependencies;

    private Map<String, List<String>> requiredCapabilities;

    private List<String> capabilities;

    /**
     * 重载过程中被替换的版本（仅在重载窗口内有值）
     */
    private String previousVersion;

    private String description;

    private String author;

    private List<String> tags;

    private String failureReason;

    private Instant installedAt;

    private Instant updatedAt;
}
