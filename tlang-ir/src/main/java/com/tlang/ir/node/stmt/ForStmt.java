package com.tlang.ir.node.stmt;

import com.tlang.ir.node.*;
import com.tlang.ir.node.expr.Expression;

import java.util.Objects;

/**
 * 区间循环 {@code for loopVar in range(begin, end)}，循环变量为 int32。
 */
public class ForStmt extends Stmt {

    private final Identifier loopVar;
    private final Expression begin;
    private final Expression end;
    private final Block body;

    public ForStmt(Identifier loopVar, Expression begin, Expression end, Block body) {
        this.loopVar = Objects.requireNonNull(loopVar, "loopVar");
        this.begin = Objects.requireNonNull(begin, "begin");
        this.end = Objects.requireNonNull(end, "end");
        this.body = own(Objects.requireNonNull(body, "body"));
    }

    public Identifier getLoopVar() { return loopVar; }
    public Expression getBegin() { return begin; }
    public Expression getEnd() { return end; }
    public Block getBody() { return body; }

    @Override
    public StmtKind kind() {
        return StmtKind.FOR;
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitFor(this);
    }
}
