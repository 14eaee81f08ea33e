package io.github.eutro.rvsdg.ext;

import org.jetbrains.annotations.Nullable;

/**
 * An {@link ExtHolder} that falls back to another {@link ExtContainer}
 * for exts it does not hold itself.
 * <p>
 * Instructions delegate to their operation, and operations to their key,
 * so a property such as {@link CommonExts#IS_PURE} is set once per kind of operation.
 */
public abstract class DelegatingExtHolder extends ExtHolder {
    /**
     * Get the container to delegate to.
     *
     * @return The delegate, or null.
     */
    protected abstract @Nullable ExtContainer getDelegate();

    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        T localExt = super.getNullable(ext);
        if (localExt != null) return localExt;
        ExtContainer delegate = getDelegate();
        if (delegate != null) return delegate.getNullable(ext);
        return null;
    }
}
