package io.github.eutro.stackless.env;

/**
 * A declared type parameter of a function.
 */
public final class TypeParameter {
    public enum Constraint {
        NONE,
        COPYABLE,
        RESOURCE,
    }

    private final Symbol name;
    private final Constraint constraint;

    public TypeParameter(Symbol name, Constraint constraint) {
        this.name = name;
        this.constraint = constraint;
    }

    public Symbol getName() {
        return name;
    }

    public Constraint getConstraint() {
        return constraint;
    }
}
