package com.tlang.ir.node.stmt;

import com.tlang.ir.node.*;

/**
 * 二元运算：{@code name = op left right}。操作数按标识符引用。
 */
public class BinaryOpStmt extends Stmt {

    private final Identifier name;
    private final DataType type;
    private final BinaryOpType op;
    private final Identifier left;
    private final Identifier right;

    public BinaryOpStmt(Identifier name, DataType type, BinaryOpType op,
                        Identifier left, Identifier right) {
        this.name = name;
        this.type = type;
        this.op = op;
        this.left = left;
        this.right = right;
    }

    public Identifier getName() { return name; }
    public DataType getType() { return type; }
    public BinaryOpType getOp() { return op; }
    public Identifier getLeft() { return left; }
    public Identifier getRight() { return right; }

    @Override
    public StmtKind kind() {
        return StmtKind.BINARY_OP;
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitBinaryOp(this);
    }
}
