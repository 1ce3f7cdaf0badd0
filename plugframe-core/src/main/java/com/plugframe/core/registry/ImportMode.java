package com.plugframe.core.registry;

/**
 * 注册表导入方式
 */
public enum ImportMode {

    /**
     * 导入的记录覆盖同名记录，其他记录保留；格式不对的条目跳过
     */
    MERGE,

    /**
     * 注册表替换为导入的内容；任何条目格式不对都整体拒绝
     */
    REPLACE
}
