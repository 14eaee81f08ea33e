package io.github.eutro.rvsdg.graph;

import io.github.eutro.rvsdg.ops.ConstOp;
import io.github.eutro.rvsdg.ops.Literal;
import io.github.eutro.rvsdg.ops.Type;
import io.github.eutro.rvsdg.ops.ValueOp;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The computation of a {@link RvsdgNode.BasicOp}.
 */
public abstract class Expr {
    private Expr() {
    }

    /**
     * Get the operands of this expression, in the region of its node.
     *
     * @return The operands.
     */
    public abstract List<Operand> operands();

    /**
     * Get the number of outputs of this expression.
     *
     * @return The number of outputs.
     */
    public int outputCount() {
        return 1;
    }

    private static List<Operand> freeze(List<Operand> args) {
        return Collections.unmodifiableList(new ArrayList<>(args));
    }

    private static String render(String head, List<Operand> args) {
        StringBuilder sb = new StringBuilder(head);
        for (Operand arg : args) {
            sb.append(' ').append(arg);
        }
        return sb.toString();
    }

    /**
     * A constant.
     */
    public static final class Const extends Expr {
        public final ConstOp op;
        public final Literal literal;
        public final Type type;

        public Const(ConstOp op, Literal literal, Type type) {
            this.op = op;
            this.literal = literal;
            this.type = type;
        }

        @Override
        public List<Operand> operands() {
            return Collections.emptyList();
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Const)) return false;
            Const that = (Const) o;
            return op == that.op && literal.equals(that.literal) && type == that.type;
        }

        @Override
        public int hashCode() {
            return Objects.hash(op, literal, type);
        }

        @Override
        public String toString() {
            return op + " " + literal + ": " + type;
        }
    }

    /**
     * A pure value operation.
     */
    public static final class Op extends Expr {
        public final ValueOp op;
        public final List<Operand> args;
        public final Type type;

        public Op(ValueOp op, List<Operand> args, Type type) {
            this.op = op;
            this.args = freeze(args);
            this.type = type;
        }

        @Override
        public List<Operand> operands() {
            return args;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Op)) return false;
            Op that = (Op) o;
            return op == that.op && args.equals(that.args) && type == that.type;
        }

        @Override
        public int hashCode() {
            return Objects.hash(op, args, type);
        }

        @Override
        public String toString() {
            return render(op.toString(), args) + ": " + type;
        }
    }

    /**
     * A call of a function by name. The last argument is the state, and the outputs are
     * the returned value, if any, then the state.
     */
    public static final class Call extends Expr {
        public final String target;
        public final List<Operand> args;
        public final int outputs;
        @Nullable
        public final Type returnType;

        public Call(String target, List<Operand> args, int outputs, @Nullable Type returnType) {
            this.target = target;
            this.args = freeze(args);
            this.outputs = outputs;
            this.returnType = returnType;
        }

        @Override
        public List<Operand> operands() {
            return args;
        }

        @Override
        public int outputCount() {
            return outputs;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Call)) return false;
            Call that = (Call) o;
            return target.equals(that.target)
                    && args.equals(that.args)
                    && outputs == that.outputs
                    && returnType == that.returnType;
        }

        @Override
        public int hashCode() {
            return Objects.hash(target, args, outputs, returnType);
        }

        @Override
        public String toString() {
            return render("call @" + target, args) + " -> " + outputs + (returnType == null ? "" : ": " + returnType);
        }
    }

    /**
     * A print of its arguments. The last argument is the state, and the only output is the new state.
     */
    public static final class Print extends Expr {
        public final List<Operand> args;

        public Print(List<Operand> args) {
            this.args = freeze(args);
        }

        @Override
        public List<Operand> operands() {
            return args;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Print && args.equals(((Print) o).args);
        }

        @Override
        public int hashCode() {
            return args.hashCode();
        }

        @Override
        public String toString() {
            return render("print", args);
        }
    }
}
