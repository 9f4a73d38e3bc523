package com.tlang.ir.node.expr;

import com.tlang.ir.lowering.LoweringContext;
import com.tlang.ir.node.DataType;
import com.tlang.ir.node.Identifier;
import com.tlang.ir.node.Stmt;
import com.tlang.ir.node.stmt.ConstStmt;

import java.util.Collection;
import java.util.List;

/**
 * 字面量常量。
 */
public class ConstExpression extends Expression {

    private final DataType type;
    private final Number value;

    public ConstExpression(DataType type, Number value) {
        this.type = type;
        this.value = value;
    }

    public static ConstExpression of(int value)    { return new ConstExpression(DataType.INT32, value); }
    public static ConstExpression of(long value)   { return new ConstExpression(DataType.INT64, value); }
    public static ConstExpression of(float value)  { return new ConstExpression(DataType.FLOAT32, value); }
    public static ConstExpression of(double value) { return new ConstExpression(DataType.FLOAT64, value); }

    public DataType getType() { return type; }
    public Number getValue() { return value; }

    /**
     * 每次展平都产生一条新的 const 语句（不做常量折叠）。
     */
    @Override
    public Identifier flatten(LoweringContext ctx, List<Stmt> out) {
        Identifier temp = ctx.freshTemp();
        out.add(new ConstStmt(temp, type, value));
        ctx.declare(temp, type);
        return temp;
    }

    @Override
    public void collectIdentifiers(Collection<Identifier> out) {
    }

    @Override
    public String serialize() {
        return String.valueOf(value);
    }
}
