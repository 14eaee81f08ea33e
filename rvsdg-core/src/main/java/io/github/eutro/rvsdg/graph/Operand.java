package io.github.eutro.rvsdg.graph;

/**
 * A reference to a value in an {@link RvsdgFunction}.
 * <p>
 * Operands compare by value. {@link Id Id(n)} and {@link Project Project(0, n)} name the same value,
 * but are only identified by {@link StructuralEquality}.
 */
public abstract class Operand {
    private Operand() {
    }

    /**
     * The {@code index}th input of the innermost enclosing region.
     *
     * @param index The index.
     * @return The operand.
     */
    public static Arg arg(int index) {
        return new Arg(index);
    }

    /**
     * The only output of a node.
     *
     * @param node The index of the node in the arena.
     * @return The operand.
     */
    public static Id id(int node) {
        return new Id(node);
    }

    /**
     * An output of a node.
     *
     * @param output The index of the output.
     * @param node   The index of the node in the arena.
     * @return The operand.
     */
    public static Project project(int output, int node) {
        return new Project(output, node);
    }

    /**
     * An input of the innermost enclosing region: a function argument or state at the top level,
     * or an element of the inputs of the enclosing {@link RvsdgNode.Branch} or {@link RvsdgNode.Loop}.
     */
    public static final class Arg extends Operand {
        public final int index;

        private Arg(int index) {
            this.index = index;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Arg && ((Arg) o).index == index;
        }

        @Override
        public int hashCode() {
            return index;
        }

        @Override
        public String toString() {
            return "Arg(" + index + ")";
        }
    }

    /**
     * The only output of a single-output node.
     */
    public static final class Id extends Operand {
        public final int node;

        private Id(int node) {
            this.node = node;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Id && ((Id) o).node == node;
        }

        @Override
        public int hashCode() {
            return 31 * node + 1;
        }

        @Override
        public String toString() {
            return "Id(" + node + ")";
        }
    }

    /**
     * An output of a node.
     */
    public static final class Project extends Operand {
        public final int output;
        public final int node;

        private Project(int output, int node) {
            this.output = output;
            this.node = node;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Project)) return false;
            Project that = (Project) o;
            return that.output == output && that.node == node;
        }

        @Override
        public int hashCode() {
            return 31 * (31 * node + 2) + output;
        }

        @Override
        public String toString() {
            return "Project(" + output + ", " + node + ")";
        }
    }
}
