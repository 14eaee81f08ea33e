package io.github.eutro.rvsdg.graph;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A function of the RVSDG: an arena of nodes, and the operands of its result and final state.
 * <p>
 * At the top level, {@code Arg(i)} for {@code i < nArgs} is the {@code i}th argument, and
 * {@code Arg(nArgs)} is the initial state.
 */
public final class RvsdgFunction {
    public final String name;
    public final int nArgs;
    public final List<RvsdgNode> nodes;
    @Nullable
    public final Operand result;
    public final Operand state;

    public RvsdgFunction(String name, int nArgs, List<RvsdgNode> nodes, @Nullable Operand result, Operand state) {
        this.name = name;
        this.nArgs = nArgs;
        this.nodes = Collections.unmodifiableList(new ArrayList<>(nodes));
        this.result = result;
        this.state = state;
    }

    /**
     * Get the node with the given index.
     *
     * @param index The index.
     * @return The node.
     */
    public RvsdgNode node(int index) {
        return nodes.get(index);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append('@').append(name).append('(').append(nArgs).append(") {\n");
        for (int i = 0; i < nodes.size(); i++) {
            sb.append("  %").append(i).append(" = ").append(nodes.get(i)).append('\n');
        }
        if (result != null) sb.append("  result ").append(result).append('\n');
        sb.append("  state ").append(state).append("\n}");
        return sb.toString();
    }
}
