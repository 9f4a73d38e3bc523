package com.tlang.ir.lowering;

import com.tlang.ir.node.DataType;
import com.tlang.ir.node.Identifier;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * 展平上下文。
 * 生成唯一的临时值名，并维护按词法作用域划分的类型表。
 */
public class LoweringContext {

    private static final String TEMP_PREFIX = "t";

    private final boolean materializeLoads;
    private final Set<Identifier> reserved = new HashSet<>();
    private final Deque<Map<Identifier, Binding>> scopes = new ArrayDeque<>();
    private int tempCounter = 0;

    public LoweringContext() {
        this(false);
    }

    public LoweringContext(boolean materializeLoads) {
        this.materializeLoads = materializeLoads;
        resetScopes();
    }

    /**
     * 局部变量引用是否先 load 到临时值。
     */
    public boolean isMaterializeLoads() {
        return materializeLoads;
    }

    // ===== 临时值 =====

    /**
     * 生成未被占用的临时值名（t0, t1, ...）。
     */
    public Identifier freshTemp() {
        Identifier id;
        do {
            id = new Identifier(TEMP_PREFIX + (tempCounter++));
        } while (reserved.contains(id));
        reserved.add(id);
        return id;
    }

    /**
     * 标记已被树中语句产生的名字，freshTemp 不会再生成它。
     */
    public void reserve(Identifier id) {
        reserved.add(id);
    }

    // ===== 作用域 =====

    public void pushScope() {
        scopes.push(new HashMap<>());
    }

    public void popScope() {
        if (scopes.size() <= 1) {
            throw new IllegalStateException("不能弹出最外层作用域");
        }
        scopes.pop();
    }

    /** 清空所有作用域，只保留一个空的最外层作用域 */
    public void resetScopes() {
        scopes.clear();
        pushScope();
    }

    public void declare(Identifier id, DataType type) {
        scopes.peek().put(id, new Binding(type, false));
    }

    /** 声明可变局部变量（来自 alloca） */
    public void declareLocal(Identifier id, DataType type) {
        scopes.peek().put(id, new Binding(type, true));
    }

    public boolean isDeclared(Identifier id) {
        return lookup(id) != null;
    }

    public boolean isLocal(Identifier id) {
        Binding binding = lookup(id);
        return binding != null && binding.local;
    }

    /**
     * 查找类型，未声明时为 {@link DataType#UNKNOWN}。
     */
    public DataType typeOf(Identifier id) {
        Binding binding = lookup(id);
        return binding != null ? binding.type : DataType.UNKNOWN;
    }

    private Binding lookup(Identifier id) {
        for (Map<Identifier, Binding> scope : scopes) {
            Binding binding = scope.get(id);
            if (binding != null) return binding;
        }
        return null;
    }

    private static final class Binding {
        final DataType type;
        final boolean local;

        Binding(DataType type, boolean local) {
            this.type = type;
            this.local = local;
        }
    }
}
