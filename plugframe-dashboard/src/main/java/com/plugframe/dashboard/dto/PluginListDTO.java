package com.plugframe.dashboard.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 插件列表（分页）
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PluginListDTO {

    private List<PluginInfoDTO> plugins;

    /**
     * 注册表中的插件总数，与分页参数无关
     */
    private int total;
}
