package com.plugframe.core.spi;

import com.plugframe.core.registry.PluginRecord;

import java.util.List;

/**
 * 注册表持久化后端 SPI
 * <p>
 * 要求单条记录的读写是原子的：崩溃后要么是旧记录，要么是新记录。
 * 运行期字段（如 previousVersionHandle）不会被持久化。
 */
public interface PersistenceBackend {

    /**
     * 启动时加载全部记录（保持写入顺序）
     */
    List<PluginRecord> loadAll();

    /**
     * 持久化单条记录，返回前必须已落盘
     */
    void save(PluginRecord record);

    /**
     * 删除单条记录
     */
    void delete(String name);
}
