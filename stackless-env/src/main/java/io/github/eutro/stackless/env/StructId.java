package io.github.eutro.stackless.env;

import org.jetbrains.annotations.NotNull;

/**
 * Identifies a struct within its module, by name.
 */
public final class StructId implements Comparable<StructId> {
    private final Symbol symbol;

    public StructId(Symbol symbol) {
        this.symbol = symbol;
    }

    public Symbol symbol() {
        return symbol;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof StructId && ((StructId) o).symbol == symbol;
    }

    @Override
    public int hashCode() {
        return symbol.hashCode();
    }

    @Override
    public int compareTo(@NotNull StructId o) {
        return symbol.compareTo(o.symbol);
    }

    @Override
    public String toString() {
        return "StructId(" + symbol.id() + ")";
    }
}
