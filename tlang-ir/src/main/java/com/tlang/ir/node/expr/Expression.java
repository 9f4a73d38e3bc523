package com.tlang.ir.node.expr;

import com.tlang.ir.lowering.LoweringContext;
import com.tlang.ir.node.BinaryOpType;
import com.tlang.ir.node.Identifier;
import com.tlang.ir.node.Stmt;

import java.util.Collection;
import java.util.List;

/**
 * 表达式树基类。表达式是纯值树，不修改任何状态。
 * <p>
 * 表达式只通过 {@link #flatten} 与 {@link #serialize} 被消费，访问者不会进入表达式内部。
 */
public abstract class Expression {

    /**
     * 将表达式展平为 SSA 语句，按操作数先于运算的顺序追加到 out。
     * 每次调用都使用新的临时名，不复用之前展平的结果。
     *
     * @return 表达式结果值的句柄（最后追加的语句产生的名字，
     *         或无需语句时直接是被引用的标识符）
     */
    public abstract Identifier flatten(LoweringContext ctx, List<Stmt> out);

    /**
     * 人类可读的表达式文本。
     */
    public abstract String serialize();

    /**
     * 把表达式中出现的全部标识符加入 out。
     */
    public abstract void collectIdentifiers(Collection<Identifier> out);

    // ===== 组合 =====

    public BinaryOpExpression add(Expression rhs) { return binary(BinaryOpType.ADD, rhs); }
    public BinaryOpExpression sub(Expression rhs) { return binary(BinaryOpType.SUB, rhs); }
    public BinaryOpExpression mul(Expression rhs) { return binary(BinaryOpType.MUL, rhs); }
    public BinaryOpExpression div(Expression rhs) { return binary(BinaryOpType.DIV, rhs); }
    public BinaryOpExpression mod(Expression rhs) { return binary(BinaryOpType.MOD, rhs); }
    public BinaryOpExpression lt(Expression rhs) { return binary(BinaryOpType.LT, rhs); }
    public BinaryOpExpression le(Expression rhs) { return binary(BinaryOpType.LE, rhs); }
    public BinaryOpExpression gt(Expression rhs) { return binary(BinaryOpType.GT, rhs); }
    public BinaryOpExpression ge(Expression rhs) { return binary(BinaryOpType.GE, rhs); }
    public BinaryOpExpression eq(Expression rhs) { return binary(BinaryOpType.EQ, rhs); }
    public BinaryOpExpression ne(Expression rhs) { return binary(BinaryOpType.NE, rhs); }

    private BinaryOpExpression binary(BinaryOpType op, Expression rhs) {
        return new BinaryOpExpression(op, this, rhs);
    }

    @Override
    public String toString() {
        return serialize();
    }
}
