package io.github.eutro.stackless.env;

import org.jetbrains.annotations.NotNull;

/**
 * An interned identifier.
 * <p>
 * Symbols are only ever created by a {@link SymbolPool}, which guarantees that
 * two symbols made from equal strings in the same pool are the same object.
 * They are thus compared by identity.
 */
public final class Symbol implements Comparable<Symbol> {
    private final int id;

    Symbol(int id) {
        this.id = id;
    }

    /**
     * Get the index of this symbol in its pool.
     *
     * @return The index.
     */
    public int id() {
        return id;
    }

    /**
     * Resolve this symbol to the string it was made from.
     *
     * @param pool The pool this symbol was made by.
     * @return The string.
     */
    public String display(SymbolPool pool) {
        return pool.string(this);
    }

    @Override
    public int compareTo(@NotNull Symbol o) {
        return Integer.compare(id, o.id);
    }

    @Override
    public int hashCode() {
        return id;
    }

    @Override
    public String toString() {
        return "Symbol(" + id + ")";
    }
}
