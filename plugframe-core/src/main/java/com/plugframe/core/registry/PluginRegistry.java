package com.plugframe.core.registry;

import com.plugframe.api.exception.PluginNotFoundException;

import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * 插件注册表
 * <p>
 * 插件元数据与状态快照的权威存储。所有写操作在返回前已经持久化。
 */
public interface PluginRegistry {

    /**
     * @throws PluginNotFoundException 记录不存在
     */
    PluginRecord get(String name);

    Optional<PluginRecord> find(String name);

    boolean contains(String name);

    /**
     * 插入或整体替换记录
     */
    void put(PluginRecord record);

    /**
     * 移除记录
     *
     * @return 被移除的记录，不存在时为 null
     */
    PluginRecord remove(String name);

    /**
     * 在变更操作开始前捕获完整记录
     *
     * @throws PluginNotFoundException 记录不存在
     */
    SnapshotToken snapshot(String name);

    /**
     * 将记录恢复到快照，并释放快照
     *
     * @throws IllegalStateException 快照未知或已释放
     */
    void restore(SnapshotToken token);

    /**
     * 提交成功后释放快照
     */
    void release(SnapshotToken token);

    /**
     * 按插入顺序返回所有记录
     */
    List<PluginRecord> list();

    /**
     * 分页查询（插入顺序稳定）
     */
    List<PluginRecord> list(int offset, int limit);

    /**
     * 按名称/描述关键字、标签、作者过滤
     * 参数为 null 或空表示不过滤
     */
    List<PluginRecord> search(String query, Collection<String> tags, String author);

    RegistryStats stats();

    /**
     * 把所有记录导出为 JSON 文件（运行期字段不导出）
     */
    void exportTo(Path file);

    /**
     * 从 {@link #exportTo} 产生的文件导入记录，导入的记录会被持久化
     *
     * @return 导入的记录数
     */
    int importFrom(Path file, ImportMode mode);
}
