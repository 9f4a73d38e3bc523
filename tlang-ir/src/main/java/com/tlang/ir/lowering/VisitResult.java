package com.tlang.ir.lowering;

/**
 * 降级遍历的结果。
 * RESTARTED 表示树结构已被原地修改，当前遍历必须立即终止并从根重新开始。
 * 这是预期的控制流信号，不是错误。
 */
public enum VisitResult {
    CONTINUE,
    RESTARTED
}
