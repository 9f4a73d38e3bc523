package com.tlang.ir.node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 语句块：有序、拥有子语句的可变容器，对应一个词法作用域
 * （函数体、分支、循环体）。
 */
public class Block extends Stmt {

    private final List<Stmt> statements = new ArrayList<>();
    /** 作为 If/For 子 Block 时的所属语句，与 parent 互斥 */
    private Stmt owner;

    public Block() {
    }

    public Block(List<? extends Stmt> statements) {
        for (Stmt stmt : statements) {
            add(stmt);
        }
    }

    @Override
    public StmtKind kind() {
        return StmtKind.BLOCK;
    }

    public Stmt getOwner() {
        return owner;
    }

    void setOwner(Stmt owner) {
        this.owner = owner;
    }

    /** 只读视图 */
    public List<Stmt> getStatements() {
        return Collections.unmodifiableList(statements);
    }

    public int size() {
        return statements.size();
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }

    public Stmt get(int index) {
        return statements.get(index);
    }

    /**
     * 按引用查找语句位置，不存在返回 -1。
     */
    public int indexOf(Stmt stmt) {
        for (int i = 0; i < statements.size(); i++) {
            if (statements.get(i) == stmt) return i;
        }
        return -1;
    }

    /**
     * 追加语句并接管所有权。
     *
     * @throws IllegalStateException 语句已属于某个 Block
     */
    public void add(Stmt stmt) {
        adopt(stmt);
        statements.add(stmt);
    }

    /**
     * 用 replacement 序列原地替换 old，前后语句保持不变。
     * old 的 parent 引用被清除，新语句的 parent 指向本 Block。
     *
     * @throws IllegalArgumentException old 不在本 Block 中
     */
    public void replaceWith(Stmt old, List<? extends Stmt> replacement) {
        int index = indexOf(old);
        if (index < 0) {
            throw new IllegalArgumentException("语句不属于该 Block: " + old.kind());
        }
        for (Stmt stmt : replacement) {
            checkDetached(stmt);
        }
        statements.remove(index);
        old.setParent(null);
        statements.addAll(index, replacement);
        for (Stmt stmt : replacement) {
            stmt.setParent(this);
        }
    }

    private void adopt(Stmt stmt) {
        checkDetached(stmt);
        stmt.setParent(this);
    }

    private void checkDetached(Stmt stmt) {
        if (stmt == this) {
            throw new IllegalArgumentException("Block 不能包含自身");
        }
        if (stmt.getParent() != null) {
            throw new IllegalStateException(stmt.kind() + " 已属于一个 Block");
        }
        if (stmt instanceof Block && ((Block) stmt).owner != null) {
            throw new IllegalStateException("Block 已是 " + ((Block) stmt).owner.kind() + " 的子 Block");
        }
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitBlock(this);
    }
}
