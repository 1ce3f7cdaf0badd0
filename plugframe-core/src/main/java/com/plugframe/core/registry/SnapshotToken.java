package com.plugframe.core.registry;

import lombok.Value;

import java.time.Instant;

/**
 * 注册表快照令牌
 * 持有变更前的完整记录（含 stateBlob），用于回滚时恢复
 */
@Value
public class SnapshotToken {
    String id;
    String pluginName;
    PluginRecord record;
    Instant takenAt;
}
