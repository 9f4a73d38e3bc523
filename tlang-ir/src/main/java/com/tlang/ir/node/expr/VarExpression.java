package com.tlang.ir.node.expr;

import com.tlang.ir.lowering.LoweringContext;
import com.tlang.ir.node.DataType;
import com.tlang.ir.node.Identifier;
import com.tlang.ir.node.Stmt;
import com.tlang.ir.node.stmt.AllocaStmt;

import java.util.Collection;
import java.util.List;

/**
 * 带类型的变量声明，展平为一条 alloca。
 */
public class VarExpression extends Expression {

    private final Identifier id;
    private final DataType type;

    public VarExpression(Identifier id, DataType type) {
        this.id = id;
        this.type = type;
    }

    public Identifier getId() { return id; }
    public DataType getType() { return type; }

    @Override
    public Identifier flatten(LoweringContext ctx, List<Stmt> out) {
        out.add(new AllocaStmt(id, type));
        ctx.declareLocal(id, type);
        return id;
    }

    @Override
    public void collectIdentifiers(Collection<Identifier> out) {
        out.add(id);
    }

    @Override
    public String serialize() {
        return type + " " + id.getName();
    }
}
