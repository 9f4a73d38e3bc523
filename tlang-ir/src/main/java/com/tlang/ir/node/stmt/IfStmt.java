package com.tlang.ir.node.stmt;

import com.tlang.ir.node.*;
import com.tlang.ir.node.expr.Expression;

import java.util.Objects;

/**
 * 条件语句。条件保持为表达式，降级只改写分支内部的叶子语句。
 */
public class IfStmt extends Stmt {

    private final Expression condition;
    private final Block thenBlock;
    private Block elseBlock;  // nullable

    public IfStmt(Expression condition, Block thenBlock, Block elseBlock) {
        this.condition = Objects.requireNonNull(condition, "condition");
        this.thenBlock = own(Objects.requireNonNull(thenBlock, "thenBlock"));
        this.elseBlock = elseBlock != null ? own(elseBlock) : null;
    }

    public IfStmt(Expression condition, Block thenBlock) {
        this(condition, thenBlock, null);
    }

    public Expression getCondition() { return condition; }
    public Block getThenBlock() { return thenBlock; }
    public Block getElseBlock() { return elseBlock; }

    public boolean hasElse() {
        return elseBlock != null;
    }

    /**
     * 补上 else 分支（构建期使用）。
     *
     * @throws IllegalStateException 已有 else 分支
     */
    public void setElseBlock(Block elseBlock) {
        if (this.elseBlock != null) {
            throw new IllegalStateException("if 已有 else 分支");
        }
        this.elseBlock = own(Objects.requireNonNull(elseBlock, "elseBlock"));
    }

    @Override
    public StmtKind kind() {
        return StmtKind.IF;
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitIf(this);
    }
}
