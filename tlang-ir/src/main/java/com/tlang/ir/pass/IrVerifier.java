package com.tlang.ir.pass;

import com.tlang.ir.node.Block;
import com.tlang.ir.node.Identifier;
import com.tlang.ir.node.IrVisitor;
import com.tlang.ir.node.Stmt;
import com.tlang.ir.node.stmt.*;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 降级后 IR 校验：
 * - 不存在 Assign / FrontendPrint 残留
 * - 每个产生值（alloca、const、二元运算、load）只被一条语句产生
 * - 被使用的值已在之前的语句中产生，且位于同一或外层 Block
 * <p>
 * 条件、循环边界仍是表达式，不参与校验。
 */
public class IrVerifier extends IrVisitor<Void> implements IrPass {

    private final List<String> violations = new ArrayList<>();
    private final Set<Identifier> produced = new HashSet<>();
    private final Deque<Set<Identifier>> scopes = new ArrayDeque<>();

    /**
     * 校验并在有违例时抛出 {@link IrVerificationException}。
     */
    public static void verify(Block root) {
        List<String> violations = new IrVerifier().check(root);
        if (!violations.isEmpty()) {
            throw new IrVerificationException(violations);
        }
    }

    @Override
    public boolean run(Block root) {
        verify(root);
        return false;
    }

    /**
     * 收集全部违例，不抛异常。
     */
    public List<String> check(Block root) {
        violations.clear();
        produced.clear();
        scopes.clear();
        root.accept(this);
        return new ArrayList<>(violations);
    }

    // ===== 作用域 =====

    @Override
    public Void visitBlock(Block block) {
        scopes.push(new HashSet<>());
        visitStatements(block);
        scopes.pop();
        return null;
    }

    @Override
    public Void visitIf(IfStmt stmt) {
        return visitBranches(stmt);
    }

    @Override
    public Void visitFor(ForStmt stmt) {
        Set<Identifier> loopScope = new HashSet<>();
        loopScope.add(stmt.getLoopVar());
        scopes.push(loopScope);
        visitBody(stmt);
        scopes.pop();
        return null;
    }

    // ===== 叶子 =====

    @Override
    public Void visitAlloca(AllocaStmt stmt) {
        produce(stmt.getId());
        return null;
    }

    @Override
    public Void visitConst(ConstStmt stmt) {
        produce(stmt.getName());
        return null;
    }

    @Override
    public Void visitBinaryOp(BinaryOpStmt stmt) {
        use(stmt.getLeft(), stmt);
        use(stmt.getRight(), stmt);
        produce(stmt.getName());
        return null;
    }

    @Override
    public Void visitLocalLoad(LocalLoadStmt stmt) {
        use(stmt.getSource(), stmt);
        produce(stmt.getName());
        return null;
    }

    @Override
    public Void visitLocalStore(LocalStoreStmt stmt) {
        use(stmt.getTarget(), stmt);
        use(stmt.getValue(), stmt);
        return null;
    }

    @Override
    public Void visitPrint(PrintStmt stmt) {
        use(stmt.getValue(), stmt);
        return null;
    }

    @Override
    public Void visitAssign(AssignStmt stmt) {
        violations.add("前端语句残留: " + stmt.kind() + " " + stmt.getTarget());
        return null;
    }

    @Override
    public Void visitFrontendPrint(FrontendPrintStmt stmt) {
        violations.add("前端语句残留: " + stmt.kind() + " " + stmt.getExpr().serialize());
        return null;
    }

    private void produce(Identifier id) {
        if (!produced.add(id)) {
            violations.add("值被重复产生: " + id);
        }
        scopes.peek().add(id);
    }

    private void use(Identifier id, Stmt user) {
        for (Set<Identifier> scope : scopes) {
            if (scope.contains(id)) return;
        }
        violations.add(user.kind() + " 使用了未定义的值: " + id);
    }
}
