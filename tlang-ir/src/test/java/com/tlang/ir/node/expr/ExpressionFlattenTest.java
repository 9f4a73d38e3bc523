package com.tlang.ir.node.expr;

import com.tlang.ir.lowering.LoweringContext;
import com.tlang.ir.node.BinaryOpType;
import com.tlang.ir.node.DataType;
import com.tlang.ir.node.Identifier;
import com.tlang.ir.node.Stmt;
import com.tlang.ir.node.StmtKind;
import com.tlang.ir.node.stmt.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("表达式展平")
class ExpressionFlattenTest {

    private LoweringContext ctx;
    private IdExpression a;
    private IdExpression b;

    @BeforeEach
    void setUp() {
        ctx = new LoweringContext();
        a = new IdExpression("a");
        b = new IdExpression("b");
        ctx.declareLocal(a.getId(), DataType.FLOAT32);
        ctx.declareLocal(b.getId(), DataType.FLOAT32);
    }

    private List<Stmt> flatten(Expression expr) {
        List<Stmt> out = new ArrayList<>();
        expr.flatten(ctx, out);
        return out;
    }

    @Nested
    @DisplayName("基本规则")
    class Rules {

        @Test
        @DisplayName("标识符不产生语句，结果就是标识符本身")
        void identifierEmitsNothing() {
            List<Stmt> out = new ArrayList<>();
            Identifier result = a.flatten(ctx, out);

            assertThat(out).isEmpty();
            assertThat(result).isEqualTo(Identifier.of("a"));
        }

        @Test
        @DisplayName("二元运算恰好产生一条 BinaryOpStmt，引用操作数")
        void binaryEmitsOneStatement() {
            List<Stmt> out = new ArrayList<>();
            Identifier result = a.add(b).flatten(ctx, out);

            assertThat(out).hasSize(1);
            BinaryOpStmt bin = (BinaryOpStmt) out.get(0);
            assertThat(bin.getName()).isEqualTo(result);
            assertThat(bin.getOp()).isEqualTo(BinaryOpType.ADD);
            assertThat(bin.getLeft()).isEqualTo(a.getId());
            assertThat(bin.getRight()).isEqualTo(b.getId());
            assertThat(bin.getType()).isEqualTo(DataType.FLOAT32);
        }

        @Test
        @DisplayName("嵌套表达式后序展平，最后一条是结果")
        void nestedIsPostOrder() {
            // (a + b) * (a - b)
            List<Stmt> out = new ArrayList<>();
            Identifier result = a.add(b).mul(a.sub(b)).flatten(ctx, out);

            assertThat(out).extracting(s -> ((BinaryOpStmt) s).getOp())
                    .containsExactly(BinaryOpType.ADD, BinaryOpType.SUB, BinaryOpType.MUL);
            BinaryOpStmt mul = (BinaryOpStmt) out.get(2);
            assertThat(mul.getName()).isEqualTo(result);
            assertThat(mul.getLeft()).isEqualTo(((BinaryOpStmt) out.get(0)).getName());
            assertThat(mul.getRight()).isEqualTo(((BinaryOpStmt) out.get(1)).getName());
        }

        @Test
        @DisplayName("常量每次出现都产生一条 const")
        void constantEmitsConst() {
            List<Stmt> out = flatten(a.add(ConstExpression.of(2f)).add(ConstExpression.of(2f)));

            assertThat(out).extracting(Stmt::kind).containsExactly(
                    StmtKind.CONST, StmtKind.BINARY_OP,
                    StmtKind.CONST, StmtKind.BINARY_OP);
            ConstStmt c = (ConstStmt) out.get(0);
            assertThat(c.getType()).isEqualTo(DataType.FLOAT32);
            assertThat(c.getValue()).isEqualTo(2f);
        }

        @Test
        @DisplayName("变量声明展平为 alloca")
        void varEmitsAlloca() {
            VarExpression v = new VarExpression(Identifier.of("x"), DataType.INT32);
            List<Stmt> out = new ArrayList<>();
            Identifier result = v.flatten(ctx, out);

            assertThat(result).isEqualTo(Identifier.of("x"));
            assertThat(out).singleElement().isInstanceOf(AllocaStmt.class);
            assertThat(ctx.typeOf(result)).isEqualTo(DataType.INT32);
            assertThat(ctx.isLocal(result)).isTrue();
        }
    }

    @Nested
    @DisplayName("不做 CSE / 折叠")
    class NoSharing {

        @Test
        @DisplayName("重复子表达式各自展平")
        void duplicatesAreReflattened() {
            // (a + b) + (a + b)
            List<Stmt> out = flatten(a.add(b).add(a.add(b)));

            assertThat(out).hasSize(3);
            BinaryOpStmt first = (BinaryOpStmt) out.get(0);
            BinaryOpStmt second = (BinaryOpStmt) out.get(1);
            assertThat(first.getName()).isNotEqualTo(second.getName());
        }

        @Test
        @DisplayName("再次展平同一表达式使用新的临时名且不修改表达式")
        void reflattenUsesFreshNames() {
            BinaryOpExpression expr = a.add(b);
            String before = expr.serialize();

            Identifier first = expr.flatten(ctx, new ArrayList<>());
            Identifier second = expr.flatten(ctx, new ArrayList<>());

            assertThat(first).isNotEqualTo(second);
            assertThat(expr.serialize()).isEqualTo(before);
        }

        @Test
        @DisplayName("常量表达式不折叠")
        void constantsAreNotFolded() {
            List<Stmt> out = flatten(ConstExpression.of(1).add(ConstExpression.of(2)));
            assertThat(out).hasSize(3);
        }
    }

    @Nested
    @DisplayName("类型")
    class Types {

        @Test
        @DisplayName("比较运算结果为 int32")
        void comparisonIsInt32() {
            assertThat(BinaryOpExpression.resultType(BinaryOpType.LT, DataType.FLOAT32, DataType.FLOAT32))
                    .isEqualTo(DataType.INT32);
        }

        @Test
        @DisplayName("操作数类型不一致时为 unknown")
        void mixedOperandsAreUnknown() {
            List<Stmt> out = flatten(a.add(ConstExpression.of(1)));
            BinaryOpStmt bin = (BinaryOpStmt) out.get(1);
            assertThat(bin.getType()).isEqualTo(DataType.UNKNOWN);
        }

        @Test
        @DisplayName("未声明的标识符类型为 unknown")
        void undeclaredIsUnknown() {
            assertThat(ctx.typeOf(Identifier.of("nope"))).isEqualTo(DataType.UNKNOWN);
        }
    }

    @Test
    @DisplayName("materializeLoads：局部变量先 load")
    void materializeLoads() {
        LoweringContext loading = new LoweringContext(true);
        loading.declareLocal(a.getId(), DataType.FLOAT32);
        loading.declare(Identifier.of("i"), DataType.INT32);
        List<Stmt> out = new ArrayList<>();

        a.add(new IdExpression("i")).flatten(loading, out);

        assertThat(out).hasSize(2);
        LocalLoadStmt load = (LocalLoadStmt) out.get(0);
        assertThat(load.getSource()).isEqualTo(a.getId());
        BinaryOpStmt bin = (BinaryOpStmt) out.get(1);
        assertThat(bin.getLeft()).isEqualTo(load.getName());
        assertThat(bin.getRight()).isEqualTo(Identifier.of("i"));
    }

    @Test
    @DisplayName("serialize 输出带括号的中缀形式")
    void serialize() {
        assertThat(a.add(b).div(ConstExpression.of(3)).serialize()).isEqualTo("((a + b) / 3)");
        assertThat(new VarExpression(Identifier.of("x"), DataType.FLOAT32).serialize()).isEqualTo("float32 x");
    }
}
