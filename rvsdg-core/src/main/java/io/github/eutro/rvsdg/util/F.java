package io.github.eutro.rvsdg.util;

/**
 * A function from {@code A} to {@code B}, named so it does not collide with
 * {@link io.github.eutro.rvsdg.cfg.Function} in files that use both.
 *
 * @param <A> The argument type.
 * @param <B> The result type.
 */
@FunctionalInterface
public interface F<A, B> {
    B apply(A a);
}
