package com.tlang.ir.node.stmt;

import com.tlang.ir.node.*;
import com.tlang.ir.node.expr.Expression;

/**
 * 前端打印，参数是表达式树。降级为 {@link PrintStmt}。
 */
public class FrontendPrintStmt extends Stmt {

    private final Expression expr;

    public FrontendPrintStmt(Expression expr) {
        this.expr = expr;
    }

    public Expression getExpr() { return expr; }

    @Override
    public StmtKind kind() {
        return StmtKind.FRONTEND_PRINT;
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitFrontendPrint(this);
    }
}
