package com.tlang.ir.node.stmt;

import com.tlang.ir.node.*;

/**
 * 读取局部变量：{@code name = load source}。
 */
public class LocalLoadStmt extends Stmt {

    private final Identifier name;
    private final Identifier source;

    public LocalLoadStmt(Identifier name, Identifier source) {
        this.name = name;
        this.source = source;
    }

    public Identifier getName() { return name; }
    public Identifier getSource() { return source; }

    @Override
    public StmtKind kind() {
        return StmtKind.LOCAL_LOAD;
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitLocalLoad(this);
    }
}
