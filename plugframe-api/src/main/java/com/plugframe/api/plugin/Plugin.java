package com.plugframe.api.plugin;

import java.util.Map;
import java.util.Set;

/**
 * 插件生命周期契约
 * 所有插件的主入口类必须实现此接口，并提供无参构造器
 * <p>
 * 每次加载都会创建新的实例（以及新的类加载器），因此实例字段和静态字段
 * 不会在版本之间泄漏。需要跨版本延续的数据必须通过 {@link StateBlob} 传递。
 */
public interface Plugin {

    /**
     * 插件加载时调用
     *
     * @param state 上一个版本卸载时导出的状态；首次安装时为 {@link StateBlob#empty()}
     * @throws IncompatibleStateException 状态快照的 schema 版本无法识别时
     */
    default void onLoad(StateBlob state) {
        // Default empty implementation
    }

    /**
     * 插件卸载时调用，导出需要保留的状态
     *
     * @return 状态快照，不关心状态的插件返回 {@link StateBlob#empty()}
     */
    default StateBlob onUnload() {
        return StateBlob.empty();
    }

    /**
     * 插件对外提供的能力集合
     * 加载完成后由管理器读取，用于依赖方的能力校验
     */
    Set<String> capabilities();

    /**
     * 执行插件的某项能力
     *
     * @param capability 能力名称，必须属于 {@link #capabilities()}
     * @param params     调用参数
     * @return 执行结果
     */
    default Object execute(String capability, Map<String, Object> params) {
        throw new UnsupportedOperationException("Capability not executable: " + capability);
    }
}
