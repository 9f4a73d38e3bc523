package com.tlang.ir.node.expr;

import com.tlang.ir.lowering.LoweringContext;
import com.tlang.ir.node.BinaryOpType;
import com.tlang.ir.node.DataType;
import com.tlang.ir.node.Identifier;
import com.tlang.ir.node.Stmt;
import com.tlang.ir.node.stmt.BinaryOpStmt;

import java.util.Collection;
import java.util.List;

/**
 * 二元运算表达式。
 */
public class BinaryOpExpression extends Expression {

    private final BinaryOpType op;
    private final Expression left;
    private final Expression right;

    public BinaryOpExpression(BinaryOpType op, Expression left, Expression right) {
        this.op = op;
        this.left = left;
        this.right = right;
    }

    public BinaryOpType getOp() { return op; }
    public Expression getLeft() { return left; }
    public Expression getRight() { return right; }

    /**
     * 后序展平：左、右操作数，然后恰好一条 BinaryOpStmt。
     * 相同子表达式每次出现都会重新展平（不做公共子表达式消除）。
     */
    @Override
    public Identifier flatten(LoweringContext ctx, List<Stmt> out) {
        Identifier l = left.flatten(ctx, out);
        Identifier r = right.flatten(ctx, out);
        DataType type = resultType(op, ctx.typeOf(l), ctx.typeOf(r));
        Identifier temp = ctx.freshTemp();
        out.add(new BinaryOpStmt(temp, type, op, l, r));
        ctx.declare(temp, type);
        return temp;
    }

    /**
     * 结果类型：比较为 int32；算术要求两侧类型一致，否则为 unknown（类型提升留给类型检查）。
     */
    public static DataType resultType(BinaryOpType op, DataType left, DataType right) {
        if (op.isComparison()) return DataType.INT32;
        return left == right ? left : DataType.UNKNOWN;
    }

    @Override
    public void collectIdentifiers(Collection<Identifier> out) {
        left.collectIdentifiers(out);
        right.collectIdentifiers(out);
    }

    @Override
    public String serialize() {
        return "(" + left.serialize() + " " + op.symbol() + " " + right.serialize() + ")";
    }
}
