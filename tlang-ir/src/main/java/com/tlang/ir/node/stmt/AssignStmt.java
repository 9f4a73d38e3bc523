package com.tlang.ir.node.stmt;

import com.tlang.ir.node.*;
import com.tlang.ir.node.expr.Expression;

/**
 * 前端赋值 {@code target = rhs}，rhs 仍是表达式树。仅存在于降级前。
 */
public class AssignStmt extends Stmt {

    private final Identifier target;
    private final Expression rhs;

    public AssignStmt(Identifier target, Expression rhs) {
        this.target = target;
        this.rhs = rhs;
    }

    public Identifier getTarget() { return target; }
    public Expression getRhs() { return rhs; }

    @Override
    public StmtKind kind() {
        return StmtKind.ASSIGN;
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitAssign(this);
    }
}
