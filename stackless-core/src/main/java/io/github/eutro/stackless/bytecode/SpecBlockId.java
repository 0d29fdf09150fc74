package io.github.eutro.stackless.bytecode;

import org.jetbrains.annotations.NotNull;

/**
 * Identifies a specification block within a function.
 */
public final class SpecBlockId implements Comparable<SpecBlockId> {
    private final int id;

    public SpecBlockId(int id) {
        this.id = id;
    }

    public int id() {
        return id;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SpecBlockId && ((SpecBlockId) o).id == id;
    }

    @Override
    public int hashCode() {
        return id;
    }

    @Override
    public int compareTo(@NotNull SpecBlockId o) {
        return Integer.compare(id, o.id);
    }

    @Override
    public String toString() {
        return "spec#" + id;
    }
}
