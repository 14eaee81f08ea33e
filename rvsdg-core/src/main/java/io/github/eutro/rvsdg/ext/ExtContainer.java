package io.github.eutro.rvsdg.ext;

import org.jetbrains.annotations.Nullable;

import java.util.Optional;

/**
 * Something that side data can be attached to by {@link Ext} key.
 */
public interface ExtContainer {
    /**
     * Attach a value, replacing any previous value for the same key.
     *
     * @param ext   The key.
     * @param value The value.
     * @param <T>   The value type.
     */
    <T> void attachExt(Ext<T> ext, T value);

    /**
     * Remove the value for a key, if there is one.
     *
     * @param ext The key.
     * @param <T> The value type.
     */
    <T> void removeExt(Ext<T> ext);

    /**
     * @param ext The key.
     * @param <T> The value type.
     * @return The attached value, or null.
     */
    <T> @Nullable T getNullable(Ext<T> ext);

    default <T> Optional<T> getExt(Ext<T> ext) {
        return Optional.ofNullable(getNullable(ext));
    }

    /**
     * Get the attached value of a key that must be present, typically
     * because an analysis pass computed it earlier.
     *
     * @param ext The key.
     * @param <T> The value type.
     * @return The attached value.
     * @throws IllegalStateException If nothing is attached.
     */
    default <T> T getExtOrThrow(Ext<T> ext) {
        T value = getNullable(ext);
        if (value == null) {
            throw new IllegalStateException("Missing " + ext + " on " + this);
        }
        return value;
    }
}
