package com.plugframe.core.registry;

import com.plugframe.core.enums.PluginStatus;
import lombok.Value;

import java.util.Map;

/**
 * 注册表统计信息
 */
@Value
public class RegistryStats {
    int total;
    Map<PluginStatus, Integer> byStatus;
    Map<String, Integer> byAuthor;
    Map<String, Integer> byTag;
}
