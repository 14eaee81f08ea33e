package io.github.eutro.rvsdg.ops;

import org.jetbrains.annotations.Nullable;

/**
 * Pure operations on values.
 */
public enum ValueOp {
    ADD("add", 2),
    SUB("sub", 2),
    MUL("mul", 2),
    DIV("div", 2),
    EQ("eq", 2),
    LT("lt", 2),
    GT("gt", 2),
    LE("le", 2),
    GE("ge", 2),
    NOT("not", 1),
    AND("and", 2),
    OR("or", 2),
    /**
     * A copy of its argument. Never appears in a graph, since copies are resolved to their source.
     */
    ID("id", 1),
    FADD("fadd", 2),
    FSUB("fsub", 2),
    FMUL("fmul", 2),
    FDIV("fdiv", 2),
    FEQ("feq", 2),
    FLT("flt", 2),
    FGT("fgt", 2),
    FLE("fle", 2),
    FGE("fge", 2),
    ;

    /**
     * The name of the operation, as written in source programs and terms.
     */
    public final String mnemonic;
    /**
     * The number of arguments the operation takes.
     */
    public final int arity;

    ValueOp(String mnemonic, int arity) {
        this.mnemonic = mnemonic;
        this.arity = arity;
    }

    /**
     * Look up an operation by mnemonic.
     *
     * @param mnemonic The mnemonic.
     * @return The operation, or null if none has that mnemonic.
     */
    public static @Nullable ValueOp byMnemonic(String mnemonic) {
        for (ValueOp op : values()) {
            if (op.mnemonic.equals(mnemonic)) return op;
        }
        return null;
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
