package com.tlang.ir.print;

import com.tlang.ir.node.Block;
import com.tlang.ir.node.IrVisitor;
import com.tlang.ir.node.Stmt;
import com.tlang.ir.node.stmt.*;

import java.io.PrintStream;

/**
 * 只读 IR 打印器，每条语句一行，每层嵌套缩进两个空格。
 * 仅用于调试与测试，后续编译阶段不依赖其输出。
 */
public class IrPrinter extends IrVisitor<Void> {

    private final StringBuilder sb = new StringBuilder();
    private int indent;
    /** 已开始输出；最外层 Block 不增加缩进，根 Block 的子语句位于 0 级 */
    private boolean started;

    /**
     * 打印为字符串。
     */
    public static String print(Stmt node) {
        IrPrinter printer = new IrPrinter();
        node.accept(printer);
        return printer.getOutput();
    }

    public static void run(Stmt node, PrintStream out) {
        out.print(print(node));
    }

    public String getOutput() {
        return sb.toString();
    }

    private void line(String text) {
        started = true;
        for (int i = 0; i < indent; i++) {
            sb.append("  ");
        }
        sb.append(text).append('\n');
    }

    @Override
    public Void visitBlock(Block block) {
        int step = started ? 1 : 0;
        started = true;
        indent += step;
        visitStatements(block);
        indent -= step;
        return null;
    }

    @Override
    public Void visitAssign(AssignStmt stmt) {
        line(stmt.getTarget() + " = " + stmt.getRhs().serialize());
        return null;
    }

    @Override
    public Void visitAlloca(AllocaStmt stmt) {
        line(stmt.getType() + " alloca " + stmt.getId());
        return null;
    }

    @Override
    public Void visitBinaryOp(BinaryOpStmt stmt) {
        line(stmt.getType() + " " + stmt.getName() + " = " + stmt.getOp().symbol()
                + " " + stmt.getLeft() + " " + stmt.getRight());
        return null;
    }

    @Override
    public Void visitIf(IfStmt stmt) {
        line("if " + stmt.getCondition().serialize() + " {");
        stmt.getThenBlock().accept(this);
        if (stmt.hasElse()) {
            line("} else {");
            stmt.getElseBlock().accept(this);
        }
        line("}");
        return null;
    }

    @Override
    public Void visitFrontendPrint(FrontendPrintStmt stmt) {
        line("print " + stmt.getExpr().serialize());
        return null;
    }

    @Override
    public Void visitPrint(PrintStmt stmt) {
        line(stmt.getType() + " print " + stmt.getValue());
        return null;
    }

    @Override
    public Void visitConst(ConstStmt stmt) {
        line(stmt.getType() + " " + stmt.getName() + " = const " + stmt.getValue());
        return null;
    }

    @Override
    public Void visitFor(ForStmt stmt) {
        line("for " + stmt.getLoopVar() + " in range(" + stmt.getBegin().serialize()
                + ", " + stmt.getEnd().serialize() + ") {");
        stmt.getBody().accept(this);
        line("}");
        return null;
    }

    @Override
    public Void visitLocalLoad(LocalLoadStmt stmt) {
        line(stmt.getName() + " = load " + stmt.getSource());
        return null;
    }

    @Override
    public Void visitLocalStore(LocalStoreStmt stmt) {
        line("[store] " + stmt.getTarget() + " = " + stmt.getValue());
        return null;
    }
}
