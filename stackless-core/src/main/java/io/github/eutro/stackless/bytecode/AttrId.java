package io.github.eutro.stackless.bytecode;

import org.jetbrains.annotations.NotNull;

/**
 * A stable identifier of a bytecode instruction.
 * <p>
 * Unlike the instruction's offset, it survives transformations which insert, remove
 * or reorder instructions, so it is what source locations are recorded against.
 */
public final class AttrId implements Comparable<AttrId> {
    private final int id;

    public AttrId(int id) {
        this.id = id;
    }

    public int id() {
        return id;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof AttrId && ((AttrId) o).id == id;
    }

    @Override
    public int hashCode() {
        return id;
    }

    @Override
    public int compareTo(@NotNull AttrId o) {
        return Integer.compare(id, o.id);
    }

    @Override
    public String toString() {
        return "attr#" + id;
    }
}
