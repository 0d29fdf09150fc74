package io.github.eutro.stackless.env;

import java.util.Objects;

/**
 * A single specification condition. The condition's expression is opaque here;
 * it is carried as its rendered source text.
 */
public final class Condition {
    public enum Kind {
        ASSERT("assert"),
        ASSUME("assume"),
        REQUIRES("requires"),
        ENSURES("ensures"),
        ABORTS_IF("aborts_if"),
        MODIFIES("modifies"),
        INVARIANT("invariant"),
        ;

        public final String keyword;

        Kind(String keyword) {
            this.keyword = keyword;
        }
    }

    private final Loc loc;
    private final Kind kind;
    private final String expression;

    public Condition(Loc loc, Kind kind, String expression) {
        this.loc = Objects.requireNonNull(loc);
        this.kind = Objects.requireNonNull(kind);
        this.expression = Objects.requireNonNull(expression);
    }

    public Loc getLoc() {
        return loc;
    }

    public Kind getKind() {
        return kind;
    }

    public String getExpression() {
        return expression;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Condition)) return false;
        Condition that = (Condition) o;
        return kind == that.kind && loc.equals(that.loc) && expression.equals(that.expression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(loc, kind, expression);
    }

    @Override
    public String toString() {
        return kind.keyword + " " + expression;
    }
}
