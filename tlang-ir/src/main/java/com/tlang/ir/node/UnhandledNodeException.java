package com.tlang.ir.node;

/**
 * Pass 遇到没有声明处理器的节点种类（且未开启 allowUndefinedVisits）。
 * 属于开发期错误，编译应当中止。
 */
public class UnhandledNodeException extends RuntimeException {

    private final String visitorName;
    private final StmtKind kind;

    public UnhandledNodeException(String visitorName, StmtKind kind) {
        super("No handler for IR node kind " + kind + " in " + visitorName);
        this.visitorName = visitorName;
        this.kind = kind;
    }

    public String getVisitorName() {
        return visitorName;
    }

    public StmtKind getKind() {
        return kind;
    }
}
