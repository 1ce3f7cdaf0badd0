package com.plugframe.api.plugin;

import java.io.Serializable;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * 插件状态快照
 * <p>
 * 对管理器而言是不透明的字节序列，由插件自行序列化/反序列化。
 * schemaVersion 用于让 {@link Plugin#onLoad(StateBlob)} 显式拒绝不兼容的快照。
 */
public final class StateBlob implements Serializable {

    private static final byte[] NO_DATA = new byte[0];
    private static final StateBlob EMPTY = new StateBlob(0, NO_DATA);

    private final int schemaVersion;
    private final byte[] data;

    private StateBlob(int schemaVersion, byte[] data) {
        this.schemaVersion = schemaVersion;
        this.data = data;
    }

    public static StateBlob empty() {
        return EMPTY;
    }

    public static StateBlob of(int schemaVersion, byte[] data) {
        if (data == null || data.length == 0) {
            return schemaVersion == 0 ? EMPTY : new StateBlob(schemaVersion, NO_DATA);
        }
        return new StateBlob(schemaVersion, data.clone());
    }

    public static StateBlob ofUtf8(int schemaVersion, String text) {
        return of(schemaVersion, text == null ? null : text.getBytes(StandardCharsets.UTF_8));
    }

    public int getSchemaVersion() {
        return schemaVersion;
    }

    /**
     * 返回数据副本
     */
    public byte[] getData() {
        return data.clone();
    }

    public String asUtf8() {
        return new String(data, StandardCharsets.UTF_8);
    }

    public boolean isEmpty() {
        return data.length == 0;
    }

    public int size() {
        return data.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StateBlob)) return false;
        StateBlob other = (StateBlob) o;
        return schemaVersion == other.schemaVersion && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * schemaVersion + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return String.format("StateBlob{schema=%d, size=%d}", schemaVersion, data.length);
    }
}
