package com.tlang.ir.pass;

import com.tlang.ir.node.Block;
import com.tlang.ir.node.IrVisitor;
import com.tlang.ir.node.Stmt;
import com.tlang.ir.node.stmt.*;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * 调度传播（向量宽度、并行化方案等）。
 * <p>
 * 只接受降级后的语句：遇到 Assign / FrontendPrint 会因没有处理器而中止，
 * 以此发现在降级之前调用本 pass 的错误。目前只记录每条语句所处的循环嵌套深度。
 */
public class PropagateSchedule extends IrVisitor<Void> implements IrPass {

    private final Map<Stmt, Integer> loopDepth = new IdentityHashMap<>();
    private int depth;

    @Override
    public boolean run(Block root) {
        loopDepth.clear();
        depth = 0;
        root.accept(this);
        return false;
    }

    /**
     * 语句所在的循环嵌套深度（0 = 不在循环内）；未访问过的语句返回 -1。
     */
    public int getLoopDepth(Stmt stmt) {
        Integer d = loopDepth.get(stmt);
        return d != null ? d : -1;
    }

    private Void annotate(Stmt stmt) {
        loopDepth.put(stmt, depth);
        return null;
    }

    @Override
    public Void visitFor(ForStmt stmt) {
        annotate(stmt);
        depth++;
        visitBody(stmt);
        depth--;
        return null;
    }

    @Override
    public Void visitIf(IfStmt stmt) {
        annotate(stmt);
        return visitBranches(stmt);
    }

    @Override public Void visitConst(ConstStmt stmt) { return annotate(stmt); }
    @Override public Void visitAlloca(AllocaStmt stmt) { return annotate(stmt); }
    @Override public Void visitBinaryOp(BinaryOpStmt stmt) { return annotate(stmt); }
    @Override public Void visitLocalLoad(LocalLoadStmt stmt) { return annotate(stmt); }
    @Override public Void visitLocalStore(LocalStoreStmt stmt) { return annotate(stmt); }
    @Override public Void visitPrint(PrintStmt stmt) { return annotate(stmt); }
}
