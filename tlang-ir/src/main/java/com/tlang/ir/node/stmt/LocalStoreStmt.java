package com.tlang.ir.node.stmt;

import com.tlang.ir.node.*;

/**
 * 写入局部变量：{@code [store] target = value}。
 */
public class LocalStoreStmt extends Stmt {

    private final Identifier target;
    private final Identifier value;

    public LocalStoreStmt(Identifier target, Identifier value) {
        this.target = target;
        this.value = value;
    }

    public Identifier getTarget() { return target; }
    public Identifier getValue() { return value; }

    @Override
    public StmtKind kind() {
        return StmtKind.LOCAL_STORE;
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitLocalStore(this);
    }
}
