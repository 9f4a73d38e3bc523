package com.tlang.ir;

import com.tlang.ir.builder.IrBuilder;
import com.tlang.ir.node.Block;
import com.tlang.ir.node.DataType;
import com.tlang.ir.node.expr.IdExpression;

import static com.tlang.ir.builder.IrBuilder.literal;

/**
 * 测试共用的示例程序。
 */
public final class DemoPrograms {

    /** {@link #full()} 中前端语句的数量 */
    public static final int FULL_FRONTEND_STMTS = 11;

    public static final String FULL_LOWERED = String.join("\n",
            "float32 alloca a",
            "float32 alloca b",
            "int32 alloca p",
            "int32 alloca q",
            "float32 t0 = + a b",
            "[store] a = t0",
            "int32 t1 = + p q",
            "[store] p = t1",
            "float32 print a",
            "if (a < 500) {",
            "  float32 print b",
            "} else {",
            "  float32 print a",
            "}",
            "if (a > 5) {",
            "  float32 t2 = const 1.0",
            "  float32 t3 = + b t2",
            "  float32 t4 = const 3.0",
            "  float32 t5 = / t3 t4",
            "  [store] b = t5",
            "  float32 t6 = const 3.0",
            "  float32 t7 = * b t6",
            "  [store] b = t7",
            "} else {",
            "  float32 t8 = const 2.0",
            "  float32 t9 = + b t8",
            "  [store] b = t9",
            "  float32 t10 = const 4.0",
            "  float32 t11 = - b t10",
            "  [store] b = t11",
            "}",
            "for i in range(0, 100) {",
            "  for j in range(0, 200) {",
            "    int32 t12 = + i j",
            "    int32 print t12",
            "  }",
            "}",
            "float32 print b") + "\n";

    private DemoPrograms() {
    }

    /**
     * 覆盖全部前端构造的程序：变量、赋值、打印、if/else、嵌套 for。
     */
    public static Block full() {
        IrBuilder b = new IrBuilder();
        IdExpression a = b.declare("a");
        IdExpression bv = b.declare("b");
        IdExpression p = b.declare("p");
        IdExpression q = b.declare("q");
        IdExpression i = b.declare("i");
        IdExpression j = b.declare("j");

        b.var(DataType.FLOAT32, a);
        b.var(DataType.FLOAT32, bv);
        b.var(DataType.INT32, p);
        b.var(DataType.INT32, q);

        b.assign(a, a.add(bv));
        b.assign(p, p.add(q));

        b.print(a);
        b.ifThen(a.lt(literal(500)))
                .then(() -> b.print(bv))
                .orElse(() -> b.print(a));

        b.ifThen(a.gt(literal(5)))
                .then(() -> {
                    b.assign(bv, bv.add(literal(1f)).div(literal(3f)));
                    b.assign(bv, bv.mul(literal(3f)));
                })
                .orElse(() -> {
                    b.assign(bv, bv.add(literal(2f)));
                    b.assign(bv, bv.sub(literal(4f)));
                });

        b.forRange(i, literal(0), literal(100), () ->
                b.forRange(j, literal(0), literal(200), () -> b.print(i.add(j))));
        b.print(bv);
        return b.root();
    }

    /**
     * {@code a = a + b}，a、b 为预先声明的 float32 变量。
     */
    public static Block assignSum() {
        IrBuilder b = new IrBuilder();
        IdExpression a = b.var(DataType.FLOAT32, b.declare("a"));
        IdExpression bv = b.var(DataType.FLOAT32, b.declare("b"));
        b.assign(a, a.add(bv));
        return b.root();
    }
}
