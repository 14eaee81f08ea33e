package io.github.eutro.rvsdg.ops;

/**
 * The operations that produce constants.
 */
public enum ConstOp {
    CONST("const"),
    ;

    public final String mnemonic;

    ConstOp(String mnemonic) {
        this.mnemonic = mnemonic;
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
