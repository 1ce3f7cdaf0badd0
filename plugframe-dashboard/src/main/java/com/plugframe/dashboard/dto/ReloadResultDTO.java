package com.plugframe.dashboard.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReloadResultDTO {

    /**
     * SUCCEEDED / ROLLED_BACK
     */
    private String outcome;

    private String attemptedVersion;

    /**
     * 结束后的插件信息：成功为新版本，回滚为原版本
     */
    private PluginInfoDTO plugin;

    private List<String> needsRevalidation;
}
