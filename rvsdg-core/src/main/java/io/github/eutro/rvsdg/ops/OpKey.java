package io.github.eutro.rvsdg.ops;

import io.github.eutro.rvsdg.ext.ExtHolder;

/**
 * An operation key, representing a kind of operation, without intermediates.
 */
public abstract class OpKey extends ExtHolder {
    public final String mnemonic;

    public OpKey(String mnemonic) {
        this.mnemonic = mnemonic;
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
