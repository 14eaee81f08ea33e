package io.github.eutro.rvsdg.cfg;

import io.github.eutro.rvsdg.ext.DelegatingExtHolder;
import io.github.eutro.rvsdg.ext.ExtContainer;
import io.github.eutro.rvsdg.ops.Op;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * An instruction: an {@link Op operation} applied to argument variables.
 */
public final class Insn extends DelegatingExtHolder {
    public final Op op;
    private final List<Var> args;

    public Insn(Op op, List<Var> args) {
        this.op = op;
        this.args = new ArrayList<>(args);
    }

    public Insn(Op op, Var... args) {
        this(op, Arrays.asList(args));
    }

    @Override
    protected ExtContainer getDelegate() {
        return op;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(op);
        for (Var arg : args) {
            sb.append(' ').append(arg);
        }
        return sb.toString();
    }

    /**
     * Get the arguments of this instruction.
     *
     * @return The arguments, unmodifiable.
     */
    public List<Var> args() {
        return Collections.unmodifiableList(args);
    }

    public Effect assignTo(Var... vars) {
        return new Effect(Arrays.asList(vars), this);
    }

    public Effect assignTo(List<Var> vars) {
        return new Effect(vars, this);
    }

    public Control jumpsTo(BasicBlock... targets) {
        return jumpsTo(Arrays.asList(targets));
    }

    public Control jumpsTo(List<BasicBlock> targets) {
        return new Control(this, targets);
    }
}
