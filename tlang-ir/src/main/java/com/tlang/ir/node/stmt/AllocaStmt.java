package com.tlang.ir.node.stmt;

import com.tlang.ir.node.*;

/**
 * 为具名局部变量声明存储。
 */
public class AllocaStmt extends Stmt {

    private final Identifier id;
    private final DataType type;

    public AllocaStmt(Identifier id, DataType type) {
        this.id = id;
        this.type = type;
    }

    public Identifier getId() { return id; }
    public DataType getType() { return type; }

    @Override
    public StmtKind kind() {
        return StmtKind.ALLOCA;
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitAlloca(this);
    }
}
