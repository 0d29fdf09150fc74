package io.github.eutro.stackless.env;

import java.util.*;

/**
 * The specification of a function, or of a block within it.
 * <p>
 * A function level spec carries, in {@link #getOnImpl()}, the specification blocks
 * written inside the function body, keyed by the offset of the original bytecode
 * they are attached to.
 */
public final class Spec {
    public static final Spec EMPTY = new Spec(
            Collections.emptyList(),
            Pragmas.EMPTY,
            Collections.emptySortedMap()
    );

    private final List<Condition> conditions;
    private final Pragmas properties;
    private final SortedMap<Integer, Spec> onImpl;

    private Spec(List<Condition> conditions, Pragmas properties, SortedMap<Integer, Spec> onImpl) {
        this.conditions = conditions;
        this.properties = properties;
        this.onImpl = onImpl;
    }

    public List<Condition> getConditions() {
        return conditions;
    }

    public Pragmas getProperties() {
        return properties;
    }

    public SortedMap<Integer, Spec> getOnImpl() {
        return onImpl;
    }

    public boolean isEmpty() {
        return conditions.isEmpty() && onImpl.isEmpty() && properties.asMap().isEmpty();
    }

    public static Spec of(Condition... conditions) {
        return builder().addConditions(Arrays.asList(conditions)).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "Spec" + conditions + (onImpl.isEmpty() ? "" : " on_impl " + onImpl);
    }

    public static class Builder {
        private final List<Condition> conditions = new ArrayList<>();
        private Pragmas properties = Pragmas.EMPTY;
        private final SortedMap<Integer, Spec> onImpl = new TreeMap<>();

        public Builder addCondition(Condition condition) {
            conditions.add(condition);
            return this;
        }

        public Builder addConditions(Collection<Condition> conditions) {
            this.conditions.addAll(conditions);
            return this;
        }

        public Builder setProperties(Pragmas properties) {
            this.properties = properties;
            return this;
        }

        public Builder addOnImpl(int codeOffset, Spec spec) {
            if (onImpl.putIfAbsent(codeOffset, spec) != null) {
                throw new IllegalArgumentException("spec block already attached at offset " + codeOffset);
            }
            return this;
        }

        public Spec build() {
            if (conditions.isEmpty() && properties == Pragmas.EMPTY && onImpl.isEmpty()) return EMPTY;
            return new Spec(
                    Collections.unmodifiableList(new ArrayList<>(conditions)),
                    properties,
                    Collections.unmodifiableSortedMap(new TreeMap<>(onImpl))
            );
        }
    }
}
