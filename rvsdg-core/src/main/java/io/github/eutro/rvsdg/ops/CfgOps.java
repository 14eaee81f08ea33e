package io.github.eutro.rvsdg.ops;

import io.github.eutro.rvsdg.cfg.Insn;
import io.github.eutro.rvsdg.cfg.Var;
import io.github.eutro.rvsdg.ext.CommonExts;

/**
 * The {@link Op}s and {@link OpKey}s of the input control flow graph.
 */
public class CfgOps {
    /**
     * Control: an unconditional jump to its single target.
     */
    public static final Op BR = new SimpleOpKey("br").create();
    /**
     * Control: jumps to {@code targets[0]} if its boolean argument is false, {@code targets[1]} otherwise.
     */
    public static final Op BR_IF = new SimpleOpKey("br_if").create();
    /**
     * Control: jumps to {@code targets[n]}, where {@code n} is its integer argument.
     */
    public static final Op SWITCH = new SimpleOpKey("switch").create();
    /**
     * Control: returns from the function, with its argument if there is one.
     */
    public static final Op RETURN = new SimpleOpKey("return").create();

    /**
     * Effect: returns the constant.
     */
    public static final UnaryOpKey<Literal> CONST = new UnaryOpKey<>("const");
    /**
     * Effect: applies a pure value operation to its arguments.
     */
    public static final UnaryOpKey<TypedOp> VALUE = new UnaryOpKey<>("op");
    /**
     * Effect: calls a function, returning its result if it has one.
     */
    public static final UnaryOpKey<CallTarget> CALL = new UnaryOpKey<>("call");
    /**
     * Effect: prints its arguments, returns nothing.
     */
    public static final Op PRINT = new SimpleOpKey("print").create();

    static {
        CONST.attachExt(CommonExts.IS_PURE, true);
        VALUE.attachExt(CommonExts.IS_PURE, true);
        CALL.attachExt(CommonExts.IS_PURE, false);
        PRINT.key.attachExt(CommonExts.IS_PURE, false);
    }

    /**
     * Return a constant instruction which returns {@code k}.
     *
     * @param k The constant.
     * @return The instruction.
     */
    public static Insn constant(Literal k) {
        return CONST.create(k).insn();
    }

    /**
     * Return a value instruction.
     *
     * @param op   The operation.
     * @param type The result type.
     * @param args The arguments.
     * @return The instruction.
     */
    public static Insn value(ValueOp op, Type type, Var... args) {
        return VALUE.create(new TypedOp(op, type)).insn(args);
    }

    /**
     * Return a copy instruction.
     *
     * @param arg The variable copied.
     * @return The instruction.
     */
    public static Insn copy(Var arg) {
        return value(ValueOp.ID, arg.type, arg);
    }

    /**
     * Whether the instruction is free of side effects, so does not take part in state threading.
     *
     * @param insn The instruction.
     * @return Whether it is pure.
     */
    public static boolean isPure(Insn insn) {
        return insn.getExt(CommonExts.IS_PURE).orElse(false);
    }
}
