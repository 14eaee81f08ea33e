package io.github.eutro.rvsdg.passes.misc;

import io.github.eutro.rvsdg.passes.IRPass;

import java.util.ArrayList;
import java.util.List;

/**
 * A pass which runs one pass, then gives its result to another.
 * <p>
 * If a pass in a chain throws, the exception is annotated with the position of the
 * failing pass in the flattened chain.
 *
 * @param <A> The input type.
 * @param <B> The intermediate type.
 * @param <C> The output type.
 */
public class ChainedPass<A, B, C> implements IRPass<A, C> {
    private final IRPass<A, B> firstPass;
    private final IRPass<B, C> nextPass;

    public ChainedPass(IRPass<A, B> firstPass, IRPass<B, C> nextPass) {
        this.firstPass = firstPass;
        this.nextPass = nextPass;
    }

    /**
     * Get the passes of this chain, with nested chains flattened, in the order they run.
     *
     * @return The passes.
     */
    public List<IRPass<?, ?>> getPasses() {
        List<IRPass<?, ?>> passes = new ArrayList<>();
        addPasses(firstPass, passes);
        addPasses(nextPass, passes);
        return passes;
    }

    private static void addPasses(IRPass<?, ?> pass, List<IRPass<?, ?>> passes) {
        if (pass instanceof ChainedPass) {
            passes.addAll(((ChainedPass<?, ?, ?>) pass).getPasses());
        } else {
            passes.add(pass);
        }
    }

    @Override
    public boolean isInPlace() {
        return firstPass.isInPlace() && nextPass.isInPlace();
    }

    @SuppressWarnings("unchecked")
    @Override
    public C run(A a) {
        List<IRPass<?, ?>> passes = getPasses();
        Object acc = a;
        for (int i = 0; i < passes.size(); i++) {
            IRPass<Object, Object> pass = (IRPass<Object, Object>) passes.get(i);
            try {
                acc = pass.run(acc);
            } catch (RuntimeException e) {
                e.addSuppressed(new RuntimeException("running pass " + i + " in chain: " + pass));
                throw e;
            }
        }
        return (C) acc;
    }
}
