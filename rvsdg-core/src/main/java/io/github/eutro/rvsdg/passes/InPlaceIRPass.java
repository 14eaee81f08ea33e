package io.github.eutro.rvsdg.passes;

/**
 * A pass that mutates its input and hands the same object on.
 * <p>
 * The structuring passes are all of this kind: they rewrite the blocks of a
 * {@link io.github.eutro.rvsdg.cfg.Function} and attach their results as exts.
 *
 * @param <T> The type of IR mutated.
 */
public interface InPlaceIRPass<T> extends IRPass<T, T> {
    void runInPlace(T t);

    @Override
    default T run(T t) {
        runInPlace(t);
        return t;
    }

    @Override
    default boolean isInPlace() {
        return true;
    }
}
