package io.github.eutro.rvsdg.cfg;

import io.github.eutro.rvsdg.ops.Type;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * A whole program: an ordered list of {@link Function functions}, which call each other by name.
 */
public final class Program {
    public final List<Function> functions = new ArrayList<>();

    /**
     * Create and add a new function.
     *
     * @param name       The name of the function.
     * @param returnType The return type, or null if it returns nothing.
     * @return The new function.
     */
    public Function newFunction(String name, @Nullable Type returnType) {
        Function func = new Function(name, returnType);
        functions.add(func);
        return func;
    }

    /**
     * Look up a function by name.
     *
     * @param name The name.
     * @return The function, or null if there is none with that name.
     */
    public @Nullable Function getFunction(String name) {
        for (Function function : functions) {
            if (function.name.equals(name)) return function;
        }
        return null;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Function function : functions) {
            sb.append(function).append('\n');
        }
        return sb.toString();
    }
}
