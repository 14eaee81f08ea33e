package io.github.eutro.rvsdg.ops;

/**
 * A key for operations without intermediates, which share a single {@link Op}.
 */
public class SimpleOpKey extends OpKey {
    private final Op op = new Op(this);

    public SimpleOpKey(String mnemonic) {
        super(mnemonic);
    }

    public Op create() {
        return op;
    }
}
