package com.tlang.ir.lowering;

import com.tlang.ir.node.Block;
import com.tlang.ir.node.DataType;
import com.tlang.ir.node.Identifier;
import com.tlang.ir.node.IrVisitor;
import com.tlang.ir.node.Stmt;
import com.tlang.ir.node.expr.Expression;
import com.tlang.ir.node.stmt.*;
import com.tlang.ir.pass.IrPass;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * AST → SSA 降级。
 * <p>
 * 消除表达式树与可变局部变量的赋值语义：每条 Assign / FrontendPrint 展平为一串
 * SSA 语句，并在所在 Block 中原地替换。
 * <p>
 * 替换会改变正在遍历的容器，因此每次改写后返回 {@link VisitResult#RESTARTED}，
 * 沿 block → if/for → block 一路传播到 {@link #lower}，由它从根重新遍历，
 * 直到一次完整遍历没有任何改写。k 条前端语句最多需要 k + 1 次遍历。
 */
public class LowerAst extends IrVisitor<VisitResult> implements IrPass {

    private static final Logger LOG = Logger.getLogger(LowerAst.class.getName());

    private final boolean materializeLoads;
    private LoweringContext ctx;
    private int iterations;

    public LowerAst() {
        this(false);
    }

    /**
     * @param materializeLoads 局部变量引用是否展平为显式 load
     */
    public LowerAst(boolean materializeLoads) {
        this.materializeLoads = materializeLoads;
        this.ctx = new LoweringContext(materializeLoads);
    }

    @Override
    public boolean run(Block root) {
        return lower(root) > 0;
    }

    /**
     * 降级到不动点。
     *
     * @return 改写的前端语句数量
     */
    public int lower(Block root) {
        ctx = new LoweringContext(materializeLoads);
        root.accept(new NameReservation(ctx));
        iterations = 0;
        int rewrites = 0;
        while (true) {
            iterations++;
            ctx.resetScopes();
            if (root.accept(this) == VisitResult.CONTINUE) break;
            rewrites++;
        }
        LOG.fine("LowerAst: " + rewrites + " 条前端语句已降级，遍历 " + iterations + " 次");
        return rewrites;
    }

    /** 最近一次 {@link #lower} 的外层遍历次数 */
    public int getIterations() {
        return iterations;
    }

    // ===== 结构 =====

    @Override
    public VisitResult visitBlock(Block block) {
        ctx.pushScope();
        try {
            return visitStatements(block);
        } finally {
            ctx.popScope();
        }
    }

    @Override
    public VisitResult visitIf(IfStmt stmt) {
        return visitBranches(stmt);
    }

    @Override
    public VisitResult visitFor(ForStmt stmt) {
        ctx.pushScope();
        try {
            ctx.declare(stmt.getLoopVar(), DataType.INT32);
            return visitBody(stmt);
        } finally {
            ctx.popScope();
        }
    }

    // ===== 已是 SSA 形式的语句：只登记类型 =====

    @Override
    public VisitResult visitAlloca(AllocaStmt stmt) {
        ctx.declareLocal(stmt.getId(), stmt.getType());
        return VisitResult.CONTINUE;
    }

    @Override
    public VisitResult visitConst(ConstStmt stmt) {
        ctx.declare(stmt.getName(), stmt.getType());
        return VisitResult.CONTINUE;
    }

    @Override
    public VisitResult visitBinaryOp(BinaryOpStmt stmt) {
        ctx.declare(stmt.getName(), stmt.getType());
        return VisitResult.CONTINUE;
    }

    @Override
    public VisitResult visitLocalLoad(LocalLoadStmt stmt) {
        ctx.declare(stmt.getName(), ctx.typeOf(stmt.getSource()));
        return VisitResult.CONTINUE;
    }

    @Override
    public VisitResult visitLocalStore(LocalStoreStmt stmt) {
        return VisitResult.CONTINUE;
    }

    @Override
    public VisitResult visitPrint(PrintStmt stmt) {
        return VisitResult.CONTINUE;
    }

    // ===== 前端语句：展平并替换 =====

    @Override
    public VisitResult visitAssign(AssignStmt stmt) {
        List<Stmt> flattened = new ArrayList<>();
        Identifier value = stmt.getRhs().flatten(ctx, flattened);
        flattened.add(new LocalStoreStmt(stmt.getTarget(), value));
        return splice(stmt, flattened);
    }

    @Override
    public VisitResult visitFrontendPrint(FrontendPrintStmt stmt) {
        List<Stmt> flattened = new ArrayList<>();
        Identifier value = stmt.getExpr().flatten(ctx, flattened);
        flattened.add(new PrintStmt(ctx.typeOf(value), value));
        return splice(stmt, flattened);
    }

    private VisitResult splice(Stmt original, List<Stmt> flattened) {
        Block parent = original.getParent();
        if (parent == null) {
            throw new IllegalStateException(original.kind() + " 不在任何 Block 中，无法替换");
        }
        parent.replaceWith(original, flattened);
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("降级 " + original.kind() + " → " + flattened.size() + " 条语句");
        }
        return VisitResult.RESTARTED;
    }

    @Override
    protected VisitResult defaultResult() {
        return VisitResult.CONTINUE;
    }

    @Override
    protected boolean shouldStop(VisitResult result) {
        return result == VisitResult.RESTARTED;
    }

    /**
     * 预先登记树中出现的全部名字（产生的与引用的），避免新临时值与之重名。
     */
    private static final class NameReservation extends IrVisitor<Void> {

        private final LoweringContext ctx;

        NameReservation(LoweringContext ctx) {
            super(true);
            this.ctx = ctx;
        }

        @Override
        public Void visitConst(ConstStmt stmt) {
            ctx.reserve(stmt.getName());
            return null;
        }

        @Override
        public Void visitAlloca(AllocaStmt stmt) {
            ctx.reserve(stmt.getId());
            return null;
        }

        @Override
        public Void visitBinaryOp(BinaryOpStmt stmt) {
            ctx.reserve(stmt.getName());
            ctx.reserve(stmt.getLeft());
            ctx.reserve(stmt.getRight());
            return null;
        }

        @Override
        public Void visitLocalLoad(LocalLoadStmt stmt) {
            ctx.reserve(stmt.getName());
            ctx.reserve(stmt.getSource());
            return null;
        }

        @Override
        public Void visitLocalStore(LocalStoreStmt stmt) {
            ctx.reserve(stmt.getTarget());
            ctx.reserve(stmt.getValue());
            return null;
        }

        @Override
        public Void visitPrint(PrintStmt stmt) {
            ctx.reserve(stmt.getValue());
            return null;
        }

        @Override
        public Void visitAssign(AssignStmt stmt) {
            ctx.reserve(stmt.getTarget());
            reserveAll(stmt.getRhs());
            return null;
        }

        @Override
        public Void visitFrontendPrint(FrontendPrintStmt stmt) {
            reserveAll(stmt.getExpr());
            return null;
        }

        @Override
        public Void visitIf(IfStmt stmt) {
            reserveAll(stmt.getCondition());
            return visitBranches(stmt);
        }

        @Override
        public Void visitFor(ForStmt stmt) {
            ctx.reserve(stmt.getLoopVar());
            reserveAll(stmt.getBegin());
            reserveAll(stmt.getEnd());
            return visitBody(stmt);
        }

        private void reserveAll(Expression expr) {
            List<Identifier> ids = new ArrayList<>();
            expr.collectIdentifiers(ids);
            for (Identifier id : ids) {
                ctx.reserve(id);
            }
        }
    }
}
