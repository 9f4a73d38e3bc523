package com.tlang.ir.builder;

import com.tlang.ir.node.Block;
import com.tlang.ir.node.DataType;
import com.tlang.ir.node.Stmt;
import com.tlang.ir.node.expr.ConstExpression;
import com.tlang.ir.node.expr.Expression;
import com.tlang.ir.node.expr.IdExpression;
import com.tlang.ir.node.stmt.*;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 前端树构建辅助类。
 * 语句追加到当前 Block；then/orElse/forRange 的 body 在新的子 Block 中执行。
 *
 * <pre>
 * IrBuilder b = new IrBuilder();
 * IdExpression a = b.var(DataType.FLOAT32, b.declare("a"));
 * b.ifThen(a.lt(IrBuilder.literal(500)))
 *         .then(() -&gt; b.print(a))
 *         .orElse(() -&gt; b.assign(a, a.add(a)));
 * </pre>
 */
public class IrBuilder {

    private final Block root = new Block();
    private final Deque<Block> blocks = new ArrayDeque<>();

    public IrBuilder() {
        blocks.push(root);
    }

    public Block root() {
        return root;
    }

    public Block currentBlock() {
        return blocks.peek();
    }

    // ========== 表达式 ==========

    public IdExpression declare(String name) {
        return new IdExpression(name);
    }

    public static ConstExpression literal(int value) {
        return ConstExpression.of(value);
    }

    public static ConstExpression literal(float value) {
        return ConstExpression.of(value);
    }

    public static ConstExpression literal(double value) {
        return ConstExpression.of(value);
    }

    // ========== 语句 ==========

    /**
     * 声明带类型的局部变量（alloca）。
     */
    public IdExpression var(DataType type, IdExpression id) {
        emit(new AllocaStmt(id.getId(), type));
        return id;
    }

    public void assign(IdExpression target, Expression rhs) {
        emit(new AssignStmt(target.getId(), rhs));
    }

    public void print(Expression expr) {
        emit(new FrontendPrintStmt(expr));
    }

    public IfBuilder ifThen(Expression condition) {
        return new IfBuilder(condition);
    }

    public void forRange(IdExpression loopVar, Expression begin, Expression end, Runnable body) {
        emit(new ForStmt(loopVar.getId(), begin, end, nested(body)));
    }

    private void emit(Stmt stmt) {
        currentBlock().add(stmt);
    }

    private Block nested(Runnable body) {
        Block block = new Block();
        blocks.push(block);
        try {
            body.run();
        } finally {
            blocks.pop();
        }
        return block;
    }

    /**
     * {@code ifThen(cond).then(...).orElse(...)}。
     */
    public final class IfBuilder {

        private final Expression condition;
        private IfStmt stmt;

        private IfBuilder(Expression condition) {
            this.condition = condition;
        }

        public IfBuilder then(Runnable body) {
            if (stmt != null) {
                throw new IllegalStateException("then 只能调用一次");
            }
            stmt = new IfStmt(condition, nested(body));
            emit(stmt);
            return this;
        }

        public void orElse(Runnable body) {
            if (stmt == null) {
                throw new IllegalStateException("orElse 之前必须先调用 then");
            }
            if (stmt.hasElse()) {
                throw new IllegalStateException("orElse 只能调用一次");
            }
            stmt.setElseBlock(nested(body));
        }
    }
}
