package io.github.eutro.rvsdg.graph;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The RVSDG functions of a program, and the reasons any function of the program could not be converted.
 */
public final class RvsdgProgram {
    public final List<RvsdgFunction> functions = new ArrayList<>();
    public final Map<String, RuntimeException> failures = new LinkedHashMap<>();

    /**
     * Look up a function by name.
     *
     * @param name The name.
     * @return The function, or null if there is none with that name.
     */
    public @Nullable RvsdgFunction getFunction(String name) {
        for (RvsdgFunction function : functions) {
            if (function.name.equals(name)) return function;
        }
        return null;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (RvsdgFunction function : functions) {
            sb.append(function).append('\n');
        }
        for (Map.Entry<String, RuntimeException> failure : failures.entrySet()) {
            sb.append("; @").append(failure.getKey()).append(" failed: ").append(failure.getValue().getMessage()).append('\n');
        }
        return sb.toString();
    }
}
