package io.github.eutro.rvsdg.cfg;

import io.github.eutro.rvsdg.ops.CallTarget;
import io.github.eutro.rvsdg.ops.CfgOps;
import io.github.eutro.rvsdg.ops.Literal;
import io.github.eutro.rvsdg.ops.ValueOp;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;

/**
 * An IR, or instruction, builder, which encapsulates a position in a function
 * where instructions are being inserted.
 */
public class IRBuilder {
    /**
     * The function being inserted into.
     */
    public final Function func;
    private BasicBlock bb;

    /**
     * Construct an instruction builder, inserting into
     * a specific basic block.
     *
     * @param func The function.
     * @param bb   One of the functions basic blocks.
     */
    public IRBuilder(Function func, BasicBlock bb) {
        this.func = func;
        this.bb = bb;
    }

    /**
     * Get the block this builder is inserting at the end of.
     *
     * @return The block.
     */
    public BasicBlock getBlock() {
        return bb;
    }

    /**
     * Set the block this builder should insert at the end of.
     *
     * @param bb The block.
     */
    public void setBlock(BasicBlock bb) {
        this.bb = bb;
    }

    /**
     * Insert an effect at the end of the block.
     *
     * @param effect The effect.
     */
    public void insert(Effect effect) {
        bb.addEffect(effect);
    }

    /**
     * Assign the result of the instruction to a variable,
     * and insert the effect.
     *
     * @param insn The instruction.
     * @param v    The variable.
     * @return The same variable.
     */
    public Var insert(Insn insn, Var v) {
        insert(insn.assignTo(v));
        return v;
    }

    /**
     * Assign {@code k} to {@code v}.
     *
     * @param v The variable.
     * @param k The constant.
     * @return The same variable.
     */
    public Var constant(Var v, Literal k) {
        return insert(CfgOps.constant(k), v);
    }

    /**
     * Assign the result of a value operation to {@code v}.
     *
     * @param v    The variable, whose type is the result type.
     * @param op   The operation.
     * @param args The arguments.
     * @return The same variable.
     */
    public Var op(Var v, ValueOp op, Var... args) {
        return insert(CfgOps.value(op, v.type, args), v);
    }

    /**
     * Insert a call whose result, if any, is assigned to {@code v}.
     *
     * @param v      The variable to assign, or null for a call to a function returning nothing.
     * @param target The name of the called function.
     * @param args   The arguments.
     */
    public void call(@Nullable Var v, String target, Var... args) {
        Insn insn = CfgOps.CALL.create(new CallTarget(target, v == null ? null : v.type)).insn(args);
        if (v == null) {
            insert(insn.assignTo());
        } else {
            insert(insn, v);
        }
    }

    /**
     * Insert a print of the arguments.
     *
     * @param args The arguments.
     */
    public void print(Var... args) {
        insert(CfgOps.PRINT.insn(Arrays.asList(args)).assignTo());
    }

    /**
     * Insert a control instruction at the end of the current block.
     *
     * @param ctrl The instruction to insert.
     */
    public void insertCtrl(Control ctrl) {
        bb.setControl(ctrl);
    }

    /**
     * End the current block with a return.
     *
     * @param value The returned variable, or null for none.
     */
    public void ret(@Nullable Var value) {
        insertCtrl(value == null ? CfgOps.RETURN.insn().jumpsTo() : CfgOps.RETURN.insn(value).jumpsTo());
    }
}
