package com.tlang.ir.pass;

import com.tlang.ir.node.Block;

/**
 * IR pass 接口。Pass 原地修改或只读遍历以 Block 为根的树。
 */
public interface IrPass {

    /**
     * Pass 名称（用于日志/调试）。
     */
    String getName();

    /**
     * 对 IR 树执行 pass。
     *
     * @return 树是否被修改
     */
    boolean run(Block root);
}
