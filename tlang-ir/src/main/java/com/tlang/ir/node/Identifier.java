package com.tlang.ir.node;

import java.util.Objects;

/**
 * 符号句柄：前端变量名或 SSA 临时值名。
 * 不可变，名字相同即视为同一实体。
 */
public final class Identifier {

    private final String name;

    public Identifier(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public static Identifier of(String name) {
        return new Identifier(name);
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Identifier)) return false;
        return name.equals(((Identifier) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
