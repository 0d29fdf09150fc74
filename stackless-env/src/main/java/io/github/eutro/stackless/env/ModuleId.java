package io.github.eutro.stackless.env;

import org.jetbrains.annotations.NotNull;

/**
 * The index of a module in its {@link GlobalEnv}.
 */
public final class ModuleId implements Comparable<ModuleId> {
    private final int index;

    public ModuleId(int index) {
        this.index = index;
    }

    public int toIndex() {
        return index;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ModuleId && ((ModuleId) o).index == index;
    }

    @Override
    public int hashCode() {
        return index;
    }

    @Override
    public int compareTo(@NotNull ModuleId o) {
        return Integer.compare(index, o.index);
    }

    @Override
    public String toString() {
        return "ModuleId(" + index + ")";
    }
}
