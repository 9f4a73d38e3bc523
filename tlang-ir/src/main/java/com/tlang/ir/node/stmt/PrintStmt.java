package com.tlang.ir.node.stmt;

import com.tlang.ir.node.*;

/**
 * 降级后的打印，引用一个已产生的值。
 */
public class PrintStmt extends Stmt {

    private final DataType type;
    private final Identifier value;

    public PrintStmt(DataType type, Identifier value) {
        this.type = type;
        this.value = value;
    }

    public DataType getType() { return type; }
    public Identifier getValue() { return value; }

    @Override
    public StmtKind kind() {
        return StmtKind.PRINT;
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitPrint(this);
    }
}
