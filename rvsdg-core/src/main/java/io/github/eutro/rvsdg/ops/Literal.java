package io.github.eutro.rvsdg.ops;

import java.util.Objects;

/**
 * A literal constant of some {@link Type}.
 * <p>
 * The boxed value is a {@link Long} for {@link Type#INT}, a {@link Boolean} for
 * {@link Type#BOOL} and a {@link Double} for {@link Type#FLOAT}.
 */
public final class Literal {
    /**
     * The type of the literal.
     */
    public final Type type;
    /**
     * The boxed value of the literal.
     */
    public final Object value;

    private Literal(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Literal ofInt(long value) {
        return new Literal(Type.INT, value);
    }

    public static Literal ofBool(boolean value) {
        return new Literal(Type.BOOL, value);
    }

    public static Literal ofFloat(double value) {
        return new Literal(Type.FLOAT, value);
    }

    /**
     * Get the zero value of a type, used where a value must exist but is never observed.
     *
     * @param type The type.
     * @return The zero literal.
     */
    public static Literal zero(Type type) {
        switch (type) {
            case INT:
                return ofInt(0);
            case BOOL:
                return ofBool(false);
            case FLOAT:
                return ofFloat(0);
            default:
                throw new IllegalArgumentException(type.toString());
        }
    }

    public long asInt() {
        return (Long) value;
    }

    public boolean asBool() {
        return (Boolean) value;
    }

    public double asFloat() {
        return (Double) value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Literal literal = (Literal) o;
        return type == literal.type && value.equals(literal.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
