package com.plugframe.api.plugin;

/**
 * 状态快照不兼容
 * 由插件在 {@link Plugin#onLoad(StateBlob)} 中抛出，用于显式拒绝无法识别的 schema
 */
public class IncompatibleStateException extends RuntimeException {

    private final int expectedSchema;
    private final int actualSchema;

    public IncompatibleStateException(int expectedSchema, int actualSchema) {
        super(String.format("Incompatible state schema: expected=%d, actual=%d", expectedSchema, actualSchema));
        this.expectedSchema = expectedSchema;
        this.actualSchema = actualSchema;
    }

    public int getExpectedSchema() {
        return expectedSchema;
    }

    public int getActualSchema() {
        return actualSchema;
    }
}
