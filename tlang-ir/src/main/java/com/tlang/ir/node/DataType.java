package com.tlang.ir.node;

/**
 * IR 标量类型。
 */
public enum DataType {
    INT32,
    INT64,
    FLOAT32,
    FLOAT64,
    /** 尚未确定（交给类型检查） */
    UNKNOWN;

    public boolean isKnown() {
        return this != UNKNOWN;
    }

    @Override
    public String toString() {
        return name().toLowerCase();
    }
}
