package io.github.eutro.rvsdg.cfg;

import io.github.eutro.rvsdg.ext.ExtHolder;
import io.github.eutro.rvsdg.ops.CfgOps;

import java.util.ArrayList;
import java.util.List;

/**
 * A control instruction, encapsulating a raw {@link Insn instruction}
 * and the jump targets.
 */
public final class Control extends ExtHolder {
    private final Insn insn;
    /**
     * The jump targets of this instruction. The semantics of the order depend on the instruction,
     * see {@link CfgOps}. Restructuring passes redirect edges by setting elements of this list.
     */
    public final List<BasicBlock> targets;

    Control(Insn insn, List<BasicBlock> targets) {
        this.insn = insn;
        this.targets = new ArrayList<>(targets);
    }

    /**
     * Construct an unconditional jump to a block.
     *
     * @param target The jump target.
     * @return The jump instruction.
     */
    public static Control br(BasicBlock target) {
        return CfgOps.BR.insn().jumpsTo(target);
    }

    /**
     * Construct a jump on a boolean.
     *
     * @param cond    The condition.
     * @param ifTrue  The target if {@code cond} is true.
     * @param ifFalse The target if {@code cond} is false.
     * @return The jump instruction.
     */
    public static Control brIf(Var cond, BasicBlock ifTrue, BasicBlock ifFalse) {
        return CfgOps.BR_IF.insn(cond).jumpsTo(ifFalse, ifTrue);
    }

    /**
     * Construct a jump on an integer discriminant.
     *
     * @param discriminant The discriminant.
     * @param targets      The target of each discriminant value.
     * @return The jump instruction.
     */
    public static Control switchOn(Var discriminant, List<BasicBlock> targets) {
        return CfgOps.SWITCH.insn(discriminant).jumpsTo(targets);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(insn);
        if (!targets.isEmpty()) {
            sb.append(" ->");
            for (BasicBlock target : targets) {
                sb.append(' ').append(target.toTargetString());
            }
        }
        return sb.toString();
    }

    /**
     * Get the {@link Insn underlying instruction} of this control instruction.
     *
     * @return The instruction.
     */
    public Insn insn() {
        return insn;
    }

    /**
     * Whether this control chooses between targets based on its argument.
     *
     * @return Whether this is a {@link CfgOps#BR_IF} or {@link CfgOps#SWITCH}.
     */
    public boolean isConditional() {
        return insn.op == CfgOps.BR_IF || insn.op == CfgOps.SWITCH;
    }
}
