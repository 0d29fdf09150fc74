package io.github.eutro.stackless.env;

import org.jetbrains.annotations.NotNull;

/**
 * Identifies a function within its module, by name.
 */
public final class FunId implements Comparable<FunId> {
    private final Symbol symbol;

    public FunId(Symbol symbol) {
        this.symbol = symbol;
    }

    public Symbol symbol() {
        return symbol;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof FunId && ((FunId) o).symbol == symbol;
    }

    @Override
    public int hashCode() {
        return symbol.hashCode();
    }

    @Override
    public int compareTo(@NotNull FunId o) {
        return symbol.compareTo(o.symbol);
    }

    @Override
    public String toString() {
        return "FunId(" + symbol.id() + ")";
    }
}
