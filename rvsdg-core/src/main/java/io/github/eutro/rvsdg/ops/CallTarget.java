package io.github.eutro.rvsdg.ops;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * The callee of a call instruction: a function name, and the type it returns, if any.
 * <p>
 * Functions are referenced by name, never by graph node, so each function can be
 * converted independently of the others.
 */
public final class CallTarget {
    public final String name;
    @Nullable
    public final Type returnType;

    public CallTarget(String name, @Nullable Type returnType) {
        this.name = name;
        this.returnType = returnType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CallTarget that = (CallTarget) o;
        return name.equals(that.name) && returnType == that.returnType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, returnType);
    }

    @Override
    public String toString() {
        return "@" + name + (returnType == null ? "" : " -> " + returnType);
    }
}
