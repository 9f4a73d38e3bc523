package com.tlang.ir.node;

/**
 * IR 语句基类。
 * <p>
 * parent 是指向所在 {@link Block} 的非拥有引用，只用于原地替换时定位自身，
 * 由 Block 在插入/移除时维护。
 */
public abstract class Stmt {

    private Block parent;

    public abstract StmtKind kind();

    public abstract <R> R accept(IrVisitor<R> visitor);

    public Block getParent() {
        return parent;
    }

    void setParent(Block parent) {
        this.parent = parent;
    }

    public boolean isFrontendOnly() {
        return kind().isFrontendOnly();
    }

    /**
     * If/For 接管子 Block：子 Block 不能已挂在某个 Block 中或已属于另一条语句。
     */
    protected final Block own(Block block) {
        if (block.getParent() != null || block.getOwner() != null) {
            throw new IllegalStateException("子 Block 已属于另一个容器");
        }
        block.setOwner(this);
        return block;
    }
}
