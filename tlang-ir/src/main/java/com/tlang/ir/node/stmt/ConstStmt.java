package com.tlang.ir.node.stmt;

import com.tlang.ir.node.*;

/**
 * 常量：{@code name = const value}。
 */
public class ConstStmt extends Stmt {

    private final Identifier name;
    private final DataType type;
    private final Number value;

    public ConstStmt(Identifier name, DataType type, Number value) {
        this.name = name;
        this.type = type;
        this.value = value;
    }

    public Identifier getName() { return name; }
    public DataType getType() { return type; }
    public Number getValue() { return value; }

    @Override
    public StmtKind kind() {
        return StmtKind.CONST;
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitConst(this);
    }
}
