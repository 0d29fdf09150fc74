package io.github.eutro.stackless.annotations;

import io.github.eutro.stackless.bytecode.Constant;
import io.github.eutro.stackless.target.FunctionTarget;
import org.jetbrains.annotations.NotNull;

import java.util.*;
import java.util.stream.Collectors;

/**
 * The definitions of locals reaching each instruction. Only definitions which are
 * copies of another local, or constants, are tracked.
 */
public final class ReachingDefAnnotation {
    private final SortedMap<Integer, SortedMap<Integer, SortedSet<Def>>> reaching;

    public ReachingDefAnnotation(Map<Integer, ? extends Map<Integer, ? extends Collection<Def>>> reaching) {
        SortedMap<Integer, SortedMap<Integer, SortedSet<Def>>> copy = new TreeMap<>();
        reaching.forEach((offset, defs) -> {
            SortedMap<Integer, SortedSet<Def>> defsCopy = new TreeMap<>();
            defs.forEach((local, localDefs) ->
                    defsCopy.put(local, Collections.unmodifiableSortedSet(new TreeSet<>(localDefs))));
            copy.put(offset, Collections.unmodifiableSortedMap(defsCopy));
        });
        this.reaching = Collections.unmodifiableSortedMap(copy);
    }

    /**
     * Get the definitions reaching an instruction.
     *
     * @param offset The code offset of the instruction.
     * @return The definitions, per local.
     */
    public SortedMap<Integer, SortedSet<Def>> get(int offset) {
        SortedMap<Integer, SortedSet<Def>> defs = reaching.get(offset);
        return defs == null ? Collections.emptySortedMap() : defs;
    }

    public static Optional<String> format(FunctionTarget target, int offset) {
        return target.getAnnotations()
                .get(AnnotationKinds.REACHING_DEFS)
                .map(it -> it.get(offset))
                .filter(defs -> !defs.isEmpty())
                .map(defs -> defs.entrySet().stream()
                        .map(e -> target.displayLocal(e.getKey()) + " -> " + e.getValue().stream()
                                .map(def -> def.display(target))
                                .collect(Collectors.joining(", ", "{", "}")))
                        .collect(Collectors.joining(", ", "reach: ", "")));
    }

    /**
     * A definition of a local. Aliases order before constants.
     */
    public static abstract class Def implements Comparable<Def> {
        private Def() {
        }

        public static Def alias(int local) {
            return new Alias(local);
        }

        public static Def constant(Constant constant) {
            return new Const(constant);
        }

        public abstract String display(FunctionTarget target);

        @Override
        public int compareTo(@NotNull Def o) {
            if (this instanceof Alias) {
                if (!(o instanceof Alias)) return -1;
                return Integer.compare(((Alias) this).local, ((Alias) o).local);
            }
            if (o instanceof Alias) return 1;
            Constant l = ((Const) this).constant, r = ((Const) o).constant;
            int c = l.getKind().compareTo(r.getKind());
            return c != 0 ? c : l.toString().compareTo(r.toString());
        }
    }

    static final class Alias extends Def {
        final int local;

        Alias(int local) {
            this.local = local;
        }

        @Override
        public String display(FunctionTarget target) {
            return target.displayLocal(local);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Alias && ((Alias) o).local == local;
        }

        @Override
        public int hashCode() {
            return local;
        }

        @Override
        public String toString() {
            return "Alias(" + local + ")";
        }
    }

    static final class Const extends Def {
        final Constant constant;

        Const(Constant constant) {
            this.constant = Objects.requireNonNull(constant);
        }

        @Override
        public String display(FunctionTarget target) {
            return constant.toString();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Const && ((Const) o).constant.equals(constant);
        }

        @Override
        public int hashCode() {
            return constant.hashCode();
        }

        @Override
        public String toString() {
            return constant.toString();
        }
    }
}
