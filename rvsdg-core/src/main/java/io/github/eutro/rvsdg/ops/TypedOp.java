package io.github.eutro.rvsdg.ops;

import java.util.Objects;

/**
 * A {@link ValueOp} together with the type of its result.
 */
public final class TypedOp {
    public final ValueOp op;
    public final Type type;

    public TypedOp(ValueOp op, Type type) {
        this.op = op;
        this.type = type;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TypedOp typedOp = (TypedOp) o;
        return op == typedOp.op && type == typedOp.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(op, type);
    }

    @Override
    public String toString() {
        return op + ":" + type;
    }
}
