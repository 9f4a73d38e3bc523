package com.tlang.ir.node.expr;

import com.tlang.ir.lowering.LoweringContext;
import com.tlang.ir.node.Identifier;
import com.tlang.ir.node.Stmt;
import com.tlang.ir.node.stmt.LocalLoadStmt;

import java.util.Collection;
import java.util.List;

/**
 * 标识符引用。
 */
public class IdExpression extends Expression {

    private final Identifier id;

    public IdExpression(Identifier id) {
        this.id = id;
    }

    public IdExpression(String name) {
        this(new Identifier(name));
    }

    public Identifier getId() {
        return id;
    }

    /**
     * 直接引用标识符，不产生语句。
     * materializeLoads 开启时，局部变量先 load 到新的临时值。
     */
    @Override
    public Identifier flatten(LoweringContext ctx, List<Stmt> out) {
        if (ctx.isMaterializeLoads() && ctx.isLocal(id)) {
            Identifier temp = ctx.freshTemp();
            out.add(new LocalLoadStmt(temp, id));
            ctx.declare(temp, ctx.typeOf(id));
            return temp;
        }
        return id;
    }

    @Override
    public void collectIdentifiers(Collection<Identifier> out) {
        out.add(id);
    }

    @Override
    public String serialize() {
        return id.getName();
    }
}
