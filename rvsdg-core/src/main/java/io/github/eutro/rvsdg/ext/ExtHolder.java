package io.github.eutro.rvsdg.ext;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Map;
import java.util.TreeMap;

/**
 * An implementation of {@link ExtContainer} using a {@link Map}.
 */
public class ExtHolder implements ExtContainer {
    @Nullable
    private Map<Ext<?>, Object> map = null; // most blocks and vars never get an ext, so allocate lazily

    @NotNull
    private Map<Ext<?>, Object> getMap() {
        if (map == null) {
            map = new TreeMap<>();
        }
        return map;
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        getMap().put(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (map == null) return;
        Map<Ext<?>, Object> map = this.map;
        map.remove(ext);
        if (map.isEmpty()) {
            this.map = null;
        }
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (map == null) return null;
        return (T) map.get(ext);
    }
}
