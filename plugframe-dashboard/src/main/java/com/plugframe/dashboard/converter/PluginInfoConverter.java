package com.plugframe.dashboard.converter;

import com.plugframe.core.lifecycle.ReloadResult;
import com.plugframe.core.registry.PluginRecord;
import com.plugframe.dashboard.dto.PluginInfoDTO;
import com.plugframe.dashboard.dto.ReloadResultDTO;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * 注册记录转换为 DTO
 */
public class PluginInfoConverter {

    public PluginInfoDTO toDTO(PluginRecord record) {
        return PluginInfoDTO.builder()
                .name(record.getName())
                .version(record.getVersion())
                .status(record.getStatus().name())
                .dependencies(new ArrayList<>(record.getDependencies()))
                .requiredCapabilities(toSortedLists(record.getRequiredCapabilities()))
                .capabilities(new ArrayList<>(new TreeSet<>(record.getCapabilities())))
                .previousVersion(record.getPreviousVersion())
                .description(record.getDescription())
                .author(record.getAuthor())
                .tags(new ArrayList<>(record.getTags()))
                .failureReason(record.getFailureReason())
                .installedAt(record.getInstalledAt())
                .updatedAt(record.getUpdatedAt())
                .build();
    }

    public ReloadResultDTO toDTO(ReloadResult result) {
        return ReloadResultDTO.builder()
                .outcome(result.getOutcome().name())
                .attemptedVersion(result.getAttemptedVersion())
                .plugin(toDTO(result.getRecord()))
                .needsRevalidation(result.getNeedsRevalidation())
                .build();
    }

    private static Map<String, List<String>> toSortedLists(Map<String, Set<String>> source) {
        Map<String, List<String>> result = new LinkedHashMap<>();
        source.forEach((dependency, capabilities) ->
                result.put(dependency, new ArrayList<>(new TreeSet<>(capabilities))));
        return result;
    }
}
