package io.github.eutro.stackless.bytecode;

import org.jetbrains.annotations.NotNull;

/**
 * A branch target.
 */
public final class Label implements Comparable<Label> {
    private final int id;

    public Label(int id) {
        this.id = id;
    }

    public int id() {
        return id;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Label && ((Label) o).id == id;
    }

    @Override
    public int hashCode() {
        return id;
    }

    @Override
    public int compareTo(@NotNull Label o) {
        return Integer.compare(id, o.id);
    }

    @Override
    public String toString() {
        return "L" + id;
    }
}
