package io.github.eutro.rvsdg.cfg;

import io.github.eutro.rvsdg.ext.ExtHolder;
import io.github.eutro.rvsdg.ops.Type;

/**
 * A variable of the input control flow graph.
 * <p>
 * Variables are compared by identity, and may be assigned any number of times:
 * the graph is not in SSA form.
 */
public final class Var extends ExtHolder {
    /**
     * The name of the variable.
     */
    public final String name;
    /**
     * The index of the variable, to distinguish from
     * others with the same name in the same function,
     * if {@link Function#UNIQUE_VAR_NAMES counting is enabled}.
     */
    public final int index;
    /**
     * The type of every value assigned to the variable.
     */
    public final Type type;

    Var(String name, int index, Type type) {
        this.name = name;
        this.index = index;
        this.type = type;
    }

    @Override
    public String toString() {
        return name + (index == 0 ? "" : "." + index);
    }
}
