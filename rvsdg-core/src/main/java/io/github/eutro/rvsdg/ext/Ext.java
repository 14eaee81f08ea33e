package io.github.eutro.rvsdg.ext;

import org.jetbrains.annotations.NotNull;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A named, typed key for side data stored on blocks, functions and operations.
 * <p>
 * Keys compare by creation order, so holders iterate them in the same order on every run.
 *
 * @param <T> The type of value stored under this key.
 */
public final class Ext<T> implements Comparable<Ext<?>> {
    private static final AtomicInteger NEXT_ID = new AtomicInteger();

    private final int id;
    private final String name;
    private final Class<?> valueClass;

    private Ext(Class<?> valueClass, String name) {
        this.id = NEXT_ID.getAndIncrement();
        this.valueClass = valueClass;
        this.name = name;
    }

    /**
     * Create a key whose values are instances of {@code valueClass}.
     * <p>
     * {@code R} may be a parameterised subtype of the class, such as {@code List<BasicBlock>}
     * for {@code List.class}.
     *
     * @param valueClass The erased class of the values.
     * @param name       The name used when printing the key.
     * @param <C>        The erased type.
     * @param <R>        The value type.
     * @return The new key.
     */
    public static <C, R extends C> Ext<R> create(Class<C> valueClass, String name) {
        return new Ext<>(valueClass, name);
    }

    /**
     * Look this key up in a container.
     *
     * @param container The container.
     * @return The value, if attached.
     */
    public Optional<T> getIn(ExtContainer container) {
        return container.getExt(this);
    }

    @Override
    public int compareTo(@NotNull Ext<?> o) {
        return Integer.compare(id, o.id);
    }

    @Override
    public int hashCode() {
        return id;
    }

    @Override
    public String toString() {
        return name + " (" + valueClass.getSimpleName() + ")";
    }
}
