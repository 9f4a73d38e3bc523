package com.tlang.ir.pass;

import com.tlang.ir.node.Block;
import com.tlang.ir.node.IrVisitor;
import com.tlang.ir.node.stmt.BinaryOpStmt;
import com.tlang.ir.node.stmt.PrintStmt;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * 类型检查（"类型"不含向量宽度）。
 * <p>
 * 仍在逐步实现中，开启 allowUndefinedVisits：未处理的节点种类直接跳过。
 * 目前只报告类型仍为 unknown 的值。
 */
public class TypeCheck extends IrVisitor<Void> implements IrPass {

    private static final Logger LOG = Logger.getLogger(TypeCheck.class.getName());

    private final List<String> diagnostics = new ArrayList<>();

    public TypeCheck() {
        super(true);
    }

    @Override
    public boolean run(Block root) {
        diagnostics.clear();
        root.accept(this);
        return false;
    }

    public List<String> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    @Override
    public Void visitBinaryOp(BinaryOpStmt stmt) {
        if (!stmt.getType().isKnown()) {
            report(stmt.getName() + ": 无法确定 " + stmt.getOp().symbol() + " "
                    + stmt.getLeft() + " " + stmt.getRight() + " 的类型");
        }
        return null;
    }

    @Override
    public Void visitPrint(PrintStmt stmt) {
        if (!stmt.getType().isKnown()) {
            report("print " + stmt.getValue() + ": 类型未知");
        }
        return null;
    }

    private void report(String message) {
        diagnostics.add(message);
        LOG.warning(message);
    }
}
