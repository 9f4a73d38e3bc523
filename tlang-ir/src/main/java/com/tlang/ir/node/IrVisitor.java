package com.tlang.ir.node;

import com.tlang.ir.node.stmt.*;

/**
 * IR 访问者基类。
 *
 * <p>子类只覆盖关心的节点种类。未覆盖的种类进入 {@link #unhandled}：
 * 默认抛出 {@link UnhandledNodeException}；构造时开启 allowUndefinedVisits
 * 则静默返回 {@link #defaultResult()}。</p>
 *
 * <p>遍历总是自顶向下：Block 依次访问子语句，If/For 访问子 Block。
 * 表达式树不经过访问者，只通过 flatten/serialize 消费。</p>
 *
 * @param <R> 返回类型
 */
public abstract class IrVisitor<R> {

    private final boolean allowUndefinedVisits;

    protected IrVisitor() {
        this(false);
    }

    protected IrVisitor(boolean allowUndefinedVisits) {
        this.allowUndefinedVisits = allowUndefinedVisits;
    }

    public boolean allowsUndefinedVisits() {
        return allowUndefinedVisits;
    }

    // ===== 叶子语句 =====

    public R visitConst(ConstStmt stmt) { return unhandled(stmt); }
    public R visitAlloca(AllocaStmt stmt) { return unhandled(stmt); }
    public R visitBinaryOp(BinaryOpStmt stmt) { return unhandled(stmt); }
    public R visitLocalLoad(LocalLoadStmt stmt) { return unhandled(stmt); }
    public R visitLocalStore(LocalStoreStmt stmt) { return unhandled(stmt); }
    public R visitAssign(AssignStmt stmt) { return unhandled(stmt); }
    public R visitFrontendPrint(FrontendPrintStmt stmt) { return unhandled(stmt); }
    public R visitPrint(PrintStmt stmt) { return unhandled(stmt); }

    // ===== 结构语句 =====

    public R visitIf(IfStmt stmt) {
        R result = unhandled(stmt);
        if (shouldStop(result)) return result;
        return visitBranches(stmt);
    }

    public R visitFor(ForStmt stmt) {
        R result = unhandled(stmt);
        if (shouldStop(result)) return result;
        return visitBody(stmt);
    }

    public R visitBlock(Block block) {
        return visitStatements(block);
    }

    // ===== 遍历辅助 =====

    /**
     * 按顺序访问 Block 的子语句；某个结果需要向上传播时立即返回。
     * 按下标遍历，调用方在返回前不得继续使用已被替换的位置。
     */
    protected R visitStatements(Block block) {
        for (int i = 0; i < block.size(); i++) {
            R result = block.get(i).accept(this);
            if (shouldStop(result)) return result;
        }
        return defaultResult();
    }

    protected R visitBranches(IfStmt stmt) {
        R result = stmt.getThenBlock().accept(this);
        if (shouldStop(result)) return result;
        if (stmt.hasElse()) {
            return stmt.getElseBlock().accept(this);
        }
        return defaultResult();
    }

    protected R visitBody(ForStmt stmt) {
        return stmt.getBody().accept(this);
    }

    /**
     * 未声明处理器的节点。
     */
    protected R unhandled(Stmt stmt) {
        if (allowUndefinedVisits) {
            return defaultResult();
        }
        throw new UnhandledNodeException(getName(), stmt.kind());
    }

    /** 用于诊断信息的访问者名称 */
    public String getName() {
        String name = getClass().getSimpleName();
        return name.isEmpty() ? getClass().getName() : name;
    }

    /** 无需传播时的结果 */
    protected R defaultResult() {
        return null;
    }

    /** 结果是否需要中断当前遍历并向上传播 */
    protected boolean shouldStop(R result) {
        return false;
    }
}
