package io.github.eutro.stackless.target;

import io.github.eutro.stackless.ext.Ext;
import io.github.eutro.stackless.ext.ExtContainer;
import io.github.eutro.stackless.ext.ExtHolder;

import java.util.Optional;
import java.util.Set;

/**
 * The analysis results attached to one {@link FunctionTargetData snapshot}, one value per
 * analysis kind.
 * <p>
 * An annotation store is filled while its snapshot is being built and becomes read only
 * when the snapshot is built. Nothing is carried over into the next snapshot unless the
 * pass producing it asks for it with {@link #carryForward(ExtContainer, Ext[])}.
 */
public final class Annotations extends ExtHolder {
    private boolean frozen;

    Annotations() {
    }

    /**
     * Set the value of an analysis kind, replacing any value it had in this store.
     *
     * @param kind  The analysis kind.
     * @param value The value.
     * @param <T>   The type of the value.
     * @throws UnsupportedOperationException If the snapshot owning this store has been built.
     */
    public <T> void set(Ext<T> kind, T value) {
        attachExt(kind, value);
    }

    public <T> Optional<T> get(Ext<T> kind) {
        return getExt(kind);
    }

    public boolean has(Ext<?> kind) {
        return getNullable(kind) != null;
    }

    /**
     * Copy the given kinds from another store into this one. Kinds the other store
     * does not have are skipped.
     *
     * @param from  The store to copy from, usually the previous snapshot's.
     * @param kinds The kinds to copy.
     */
    public void carryForward(ExtContainer from, Ext<?>... kinds) {
        for (Ext<?> kind : kinds) {
            copyExt(from, kind);
        }
    }

    public Set<Ext<?>> kinds() {
        return attachedExts();
    }

    public boolean isFrozen() {
        return frozen;
    }

    void freeze() {
        frozen = true;
    }

    private void checkMutable() {
        if (frozen) {
            throw new UnsupportedOperationException("annotations of a built snapshot are read only");
        }
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        checkMutable();
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        checkMutable();
        super.removeExt(ext);
    }

    @Override
    public String toString() {
        return "Annotations" + kinds();
    }
}
