package com.plugframe.core.lifecycle;

import com.plugframe.api.exception.ErrorKind;
import com.plugframe.core.registry.PluginRecord;
import lombok.Value;

import java.util.Collections;
import java.util.List;

/**
 * 重载结果
 * <p>
 * 回滚成功属于软失败，以结果而不是异常返回；只有回滚本身失败才会抛出异常。
 */
@Value
public class ReloadResult {

    public enum Outcome {
        SUCCEEDED,
        ROLLED_BACK
    }

    Outcome outcome;

    /**
     * 结束后的注册记录（成功为新版本，回滚为原版本）
     */
    PluginRecord record;

    String attemptedVersion;

    /**
     * 回滚原因类型：LOAD_FAILURE 或 UNLOAD_FAILURE，成功时为 null
     */
    ErrorKind errorKind;

    Throwable cause;

    /**
     * 需要自行复核的 ACTIVE 依赖方（仅提示，不会被自动重载）
     */
    List<String> needsRevalidation;

    public static ReloadResult succeeded(PluginRecord record, List<String> needsRevalidation) {
        return new ReloadResult(Outcome.SUCCEEDED, record, record.getVersion(), null, null,
                Collections.unmodifiableList(needsRevalidation));
    }

    public static ReloadResult rolledBack(PluginRecord record, String attemptedVersion, ErrorKind errorKind,
                                          Throwable cause) {
        return new ReloadResult(Outcome.ROLLED_BACK, record, attemptedVersion, errorKind, cause,
                Collections.emptyList());
    }

    public boolean isSucceeded() {
        return outcome == Outcome.SUCCEEDED;
    }

    public boolean isRolledBack() {
        return outcome == Outcome.ROLLED_BACK;
    }
}
