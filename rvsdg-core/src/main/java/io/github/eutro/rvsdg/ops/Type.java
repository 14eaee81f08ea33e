package io.github.eutro.rvsdg.ops;

import org.jetbrains.annotations.Nullable;

/**
 * The types of values flowing through a program.
 */
public enum Type {
    INT("int"),
    BOOL("bool"),
    FLOAT("float"),
    ;

    /**
     * The name of the type, as written in source programs.
     */
    public final String name;

    Type(String name) {
        this.name = name;
    }

    /**
     * Look up a type by its source name.
     *
     * @param name The name.
     * @return The type, or null if there is no type with that name.
     */
    public static @Nullable Type byName(String name) {
        for (Type type : values()) {
            if (type.name.equals(name)) return type;
        }
        return null;
    }

    @Override
    public String toString() {
        return name;
    }
}
