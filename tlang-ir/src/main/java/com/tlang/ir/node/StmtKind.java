package com.tlang.ir.node;

/**
 * IR 语句种类（封闭集合）。
 */
public enum StmtKind {
    CONST,
    ALLOCA,
    BINARY_OP,
    LOCAL_LOAD,
    LOCAL_STORE,
    /** 前端赋值，降级后不得存在 */
    ASSIGN,
    /** 前端打印，降级后不得存在 */
    FRONTEND_PRINT,
    PRINT,
    IF,
    FOR,
    BLOCK;

    /**
     * 是否为仅前端存在的语句种类（内嵌表达式树，需要降级）。
     */
    public boolean isFrontendOnly() {
        return this == ASSIGN || this == FRONTEND_PRINT;
    }
}
