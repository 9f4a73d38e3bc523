package com.tlang.ir.builder;

import com.tlang.ir.node.Block;
import com.tlang.ir.node.DataType;
import com.tlang.ir.node.StmtKind;
import com.tlang.ir.node.expr.IdExpression;
import com.tlang.ir.node.stmt.ForStmt;
import com.tlang.ir.node.stmt.IfStmt;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.tlang.ir.builder.IrBuilder.literal;
import static org.assertj.core.api.Assertions.*;

@DisplayName("IrBuilder")
class IrBuilderTest {

    @Test
    @DisplayName("语句按调用顺序追加到根 Block")
    void appendsInOrder() {
        IrBuilder b = new IrBuilder();
        IdExpression a = b.var(DataType.FLOAT32, b.declare("a"));
        b.assign(a, a.add(literal(1f)));
        b.print(a);

        assertThat(b.root().getStatements()).extracting(s -> s.kind())
                .containsExactly(StmtKind.ALLOCA, StmtKind.ASSIGN, StmtKind.FRONTEND_PRINT);
        assertThat(b.root().get(0).getParent()).isSameAs(b.root());
    }

    @Test
    @DisplayName("then/orElse 构建带两个分支的 if")
    void ifElse() {
        IrBuilder b = new IrBuilder();
        IdExpression a = b.var(DataType.INT32, b.declare("a"));
        b.ifThen(a.lt(literal(3)))
                .then(() -> b.print(a))
                .orElse(() -> {
                    b.print(a);
                    b.print(a);
                });

        assertThat(b.root().size()).isEqualTo(2);
        IfStmt stmt = (IfStmt) b.root().get(1);
        assertThat(stmt.getParent()).isSameAs(b.root());
        assertThat(stmt.getThenBlock().size()).isEqualTo(1);
        assertThat(stmt.getElseBlock().size()).isEqualTo(2);
        assertThat(stmt.getThenBlock().getParent()).isNull();
        assertThat(stmt.getThenBlock().getOwner()).isSameAs(stmt);
        assertThat(stmt.getElseBlock().getOwner()).isSameAs(stmt);
        assertThat(b.currentBlock()).isSameAs(b.root());
    }

    @Test
    @DisplayName("没有 orElse 时 if 没有 else 分支")
    void ifWithoutElse() {
        IrBuilder b = new IrBuilder();
        b.ifThen(b.declare("c")).then(() -> { });

        assertThat(((IfStmt) b.root().get(0)).hasElse()).isFalse();
    }

    @Test
    @DisplayName("forRange 在子 Block 中构建循环体")
    void forRange() {
        IrBuilder b = new IrBuilder();
        IdExpression i = b.declare("i");
        b.forRange(i, literal(0), literal(10), () -> b.print(i));

        ForStmt loop = (ForStmt) b.root().get(0);
        assertThat(loop.getLoopVar().getName()).isEqualTo("i");
        assertThat(loop.getBody().size()).isEqualTo(1);
        assertThat(b.root().size()).isEqualTo(1);
    }

    @Test
    @DisplayName("then/orElse 的调用顺序错误")
    void misuse() {
        IrBuilder b = new IrBuilder();
        IrBuilder.IfBuilder pending = b.ifThen(b.declare("c"));

        assertThatThrownBy(() -> pending.orElse(() -> { }))
                .isInstanceOf(IllegalStateException.class);

        pending.then(() -> { });
        assertThatThrownBy(() -> pending.then(() -> { }))
                .isInstanceOf(IllegalStateException.class);

        pending.orElse(() -> { });
        assertThatThrownBy(() -> pending.orElse(() -> { }))
                .isInstanceOf(IllegalStateException.class);
        assertThat(b.root().size()).isEqualTo(1);
    }
}
