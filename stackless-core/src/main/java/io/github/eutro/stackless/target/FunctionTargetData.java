package io.github.eutro.stackless.target;

import io.github.eutro.stackless.bytecode.AttrId;
import io.github.eutro.stackless.bytecode.Bytecode;
import io.github.eutro.stackless.bytecode.SpecBlockId;
import io.github.eutro.stackless.env.FunctionEnv;
import io.github.eutro.stackless.env.Loc;
import io.github.eutro.stackless.env.Spec;
import io.github.eutro.stackless.env.StructId;
import io.github.eutro.stackless.env.Type;
import io.github.eutro.stackless.ext.Ext;

import java.util.*;

/**
 * One snapshot of the bytecode of a function, and everything the analyses know about it,
 * at one stage of the pipeline.
 * <p>
 * Snapshots are immutable. A pass produces the next snapshot by starting from
 * {@link #toBuilder()} of the current one, which enforces what a pass may change:
 * <ul>
 *     <li>locals and return values can be added but not removed;</li>
 *     <li>the code and its locations can be replaced;</li>
 *     <li>the reference parameter map can grow, but an existing entry never changes;</li>
 *     <li>spec blocks can be generated, but the given spec blocks stay as they are.</li>
 * </ul>
 * Annotations are never inherited; see {@link Annotations}.
 */
public final class FunctionTargetData {
    private final int parameterCount;
    private final List<Bytecode> code;
    private final List<Type> localTypes;
    private final List<Type> returnTypes;
    private final SortedMap<Integer, Integer> refParamMap;
    private final List<StructId> acquiresGlobalResources;
    private final Map<AttrId, Loc> locations;
    private final Annotations annotations;
    private final SortedMap<SpecBlockId, Integer> givenSpecBlocks;
    private final SortedMap<SpecBlockId, Spec> generatedSpecBlocks;

    private FunctionTargetData(Builder builder) {
        this.parameterCount = builder.parameterCount;
        this.code = Collections.unmodifiableList(new ArrayList<>(builder.code));
        this.localTypes = Collections.unmodifiableList(new ArrayList<>(builder.localTypes));
        this.returnTypes = Collections.unmodifiableList(new ArrayList<>(builder.returnTypes));
        this.refParamMap = Collections.unmodifiableSortedMap(new TreeMap<>(builder.refParamMap));
        this.acquiresGlobalResources = builder.acquiresGlobalResources;
        this.locations = Collections.unmodifiableMap(new HashMap<>(builder.locations));
        this.annotations = builder.annotations;
        this.givenSpecBlocks = builder.givenSpecBlocks;
        this.generatedSpecBlocks = Collections.unmodifiableSortedMap(new TreeMap<>(builder.generatedSpecBlocks));
        annotations.freeze();
    }

    /**
     * Build the first snapshot of a function, from its declared code.
     *
     * @param fun             The function.
     * @param code            The code, as translated from the source.
     * @param locations       The source locations of the instructions, may be partial.
     * @param givenSpecBlocks The spec blocks of the code, mapped to the code offset in the source
     *                        their spec is declared at in {@link Spec#getOnImpl()}.
     * @return The snapshot.
     * @throws IllegalArgumentException If a spec block refers to an offset with no declared spec.
     */
    public static FunctionTargetData initial(
            FunctionEnv fun,
            List<Bytecode> code,
            Map<AttrId, Loc> locations,
            Map<SpecBlockId, Integer> givenSpecBlocks
    ) {
        SortedMap<Integer, Spec> onImpl = fun.getSpec().getOnImpl();
        for (Map.Entry<SpecBlockId, Integer> entry : givenSpecBlocks.entrySet()) {
            if (!onImpl.containsKey(entry.getValue())) {
                throw new IllegalArgumentException(String.format(
                        "%s of %s refers to code offset %d, which has no spec",
                        entry.getKey(), fun.getFullName(), entry.getValue()
                ));
            }
        }
        Builder builder = new Builder(
                fun.getParameterCount(),
                fun.getLocalTypes(),
                fun.getReturnTypes(),
                Collections.emptySortedMap(),
                Collections.unmodifiableList(new ArrayList<>(fun.getAcquiresGlobalResources())),
                Collections.unmodifiableSortedMap(new TreeMap<>(givenSpecBlocks)),
                Collections.emptySortedMap(),
                null
        );
        builder.code.addAll(code);
        builder.locations.putAll(locations);
        return builder.build();
    }

    /**
     * Start building the snapshot that will succeed this one. The builder starts with
     * everything this snapshot has, except annotations.
     *
     * @return The builder.
     */
    public Builder toBuilder() {
        Builder builder = new Builder(
                parameterCount,
                localTypes,
                returnTypes,
                refParamMap,
                acquiresGlobalResources,
                givenSpecBlocks,
                generatedSpecBlocks,
                this
        );
        builder.code.addAll(code);
        builder.locations.putAll(locations);
        return builder;
    }

    public int getParameterCount() {
        return parameterCount;
    }

    public List<Bytecode> getCode() {
        return code;
    }

    public List<Type> getLocalTypes() {
        return localTypes;
    }

    public List<Type> getReturnTypes() {
        return returnTypes;
    }

    /**
     * Get the map from {@code &mut} parameters to the return values which carry their
     * final value back to the caller.
     *
     * @return The map, from parameter index to return index.
     */
    public SortedMap<Integer, Integer> getRefParamMap() {
        return refParamMap;
    }

    public List<StructId> getAcquiresGlobalResources() {
        return acquiresGlobalResources;
    }

    public Map<AttrId, Loc> getLocations() {
        return locations;
    }

    public Annotations getAnnotations() {
        return annotations;
    }

    public SortedMap<SpecBlockId, Integer> getGivenSpecBlocks() {
        return givenSpecBlocks;
    }

    public SortedMap<SpecBlockId, Spec> getGeneratedSpecBlocks() {
        return generatedSpecBlocks;
    }

    /**
     * Check that {@code next} is a valid successor of {@code prev}.
     *
     * @param prev The previous snapshot.
     * @param next The snapshot replacing it.
     * @throws IllegalStateException If {@code next} drops or changes something a pass must keep.
     */
    public static void checkSuccessor(FunctionTargetData prev, FunctionTargetData next) {
        if (prev.parameterCount != next.parameterCount) {
            throw new IllegalStateException("parameter count changed from "
                    + prev.parameterCount + " to " + next.parameterCount);
        }
        if (!prev.givenSpecBlocks.equals(next.givenSpecBlocks)) {
            throw new IllegalStateException("given spec blocks changed from "
                    + prev.givenSpecBlocks + " to " + next.givenSpecBlocks);
        }
        for (Map.Entry<Integer, Integer> entry : prev.refParamMap.entrySet()) {
            if (!entry.getValue().equals(next.refParamMap.get(entry.getKey()))) {
                throw new IllegalStateException("reference parameter " + entry.getKey()
                        + " no longer returned as " + entry.getValue());
            }
        }
        for (Map.Entry<SpecBlockId, Spec> entry : prev.generatedSpecBlocks.entrySet()) {
            if (!entry.getValue().equals(next.generatedSpecBlocks.get(entry.getKey()))) {
                throw new IllegalStateException("generated " + entry.getKey() + " was dropped or changed");
            }
        }
        checkPrefix("local", prev.localTypes, next.localTypes);
        checkPrefix("return", prev.returnTypes, next.returnTypes);
    }

    private static void checkPrefix(String what, List<Type> prev, List<Type> next) {
        if (next.size() < prev.size() || !next.subList(0, prev.size()).equals(prev)) {
            throw new IllegalStateException(what + " types " + prev + " not kept by " + next);
        }
    }

    public static class Builder {
        private final int parameterCount;
        private final List<Bytecode> code = new ArrayList<>();
        private final List<Type> localTypes;
        private final List<Type> returnTypes;
        private final SortedMap<Integer, Integer> refParamMap;
        private final List<StructId> acquiresGlobalResources;
        private final Map<AttrId, Loc> locations = new HashMap<>();
        private final Annotations annotations = new Annotations();
        private final SortedMap<SpecBlockId, Integer> givenSpecBlocks;
        private final SortedMap<SpecBlockId, Spec> generatedSpecBlocks;
        private final FunctionTargetData source;
        private int nextSpecBlockId;
        private boolean built;

        private Builder(
                int parameterCount,
                List<Type> localTypes,
                List<Type> returnTypes,
                SortedMap<Integer, Integer> refParamMap,
                List<StructId> acquiresGlobalResources,
                SortedMap<SpecBlockId, Integer> givenSpecBlocks,
                SortedMap<SpecBlockId, Spec> generatedSpecBlocks,
                FunctionTargetData source
        ) {
            this.parameterCount = parameterCount;
            this.localTypes = new ArrayList<>(localTypes);
            this.returnTypes = new ArrayList<>(returnTypes);
            this.refParamMap = new TreeMap<>(refParamMap);
            this.acquiresGlobalResources = acquiresGlobalResources;
            this.givenSpecBlocks = givenSpecBlocks;
            this.generatedSpecBlocks = new TreeMap<>(generatedSpecBlocks);
            this.source = source;
            int maxId = -1;
            if (!givenSpecBlocks.isEmpty()) maxId = givenSpecBlocks.lastKey().id();
            if (!generatedSpecBlocks.isEmpty()) maxId = Math.max(maxId, generatedSpecBlocks.lastKey().id());
            nextSpecBlockId = maxId + 1;
        }

        public Builder setCode(List<Bytecode> code) {
            this.code.clear();
            this.code.addAll(code);
            return this;
        }

        public List<Bytecode> getCode() {
            return Collections.unmodifiableList(code);
        }

        /**
         * Add a new local.
         *
         * @param type The type of the local.
         * @return The index of the new local.
         */
        public int addLocal(Type type) {
            localTypes.add(Objects.requireNonNull(type));
            return localTypes.size() - 1;
        }

        public int getLocalCount() {
            return localTypes.size();
        }

        /**
         * Add a new return value.
         *
         * @param type The type of the return value.
         * @return The index of the new return value.
         */
        public int addReturnType(Type type) {
            returnTypes.add(Objects.requireNonNull(type));
            return returnTypes.size() - 1;
        }

        public Builder setLocations(Map<AttrId, Loc> locations) {
            this.locations.clear();
            this.locations.putAll(locations);
            return this;
        }

        public Builder putLocation(AttrId attrId, Loc loc) {
            locations.put(attrId, loc);
            return this;
        }

        /**
         * Record that the final value of a {@code &mut} parameter is returned at {@code returnIdx}.
         * Recording an existing entry again has no effect.
         *
         * @param paramIdx  The parameter index.
         * @param returnIdx The return index.
         * @return This builder.
         * @throws IndexOutOfBoundsException If either index is out of range.
         * @throws IllegalArgumentException  If the parameter is not a mutable reference.
         * @throws IllegalStateException     If the parameter is already returned elsewhere.
         */
        public Builder putRefParam(int paramIdx, int returnIdx) {
            if (paramIdx < 0 || paramIdx >= parameterCount) {
                throw new IndexOutOfBoundsException("parameter index " + paramIdx
                        + " out of range for " + parameterCount + " parameters");
            }
            if (returnIdx < 0 || returnIdx >= returnTypes.size()) {
                throw new IndexOutOfBoundsException("return index " + returnIdx
                        + " out of range for " + returnTypes.size() + " return values");
            }
            if (!localTypes.get(paramIdx).isMutableReference()) {
                throw new IllegalArgumentException("parameter " + paramIdx + " is not a mutable reference");
            }
            Integer existing = refParamMap.putIfAbsent(paramIdx, returnIdx);
            if (existing != null && existing != returnIdx) {
                throw new IllegalStateException("parameter " + paramIdx + " is already returned at "
                        + existing + ", cannot return it at " + returnIdx);
            }
            return this;
        }

        /**
         * Get a spec block id that is not used in this snapshot yet.
         *
         * @return The id.
         */
        public SpecBlockId newSpecBlockId() {
            return new SpecBlockId(nextSpecBlockId++);
        }

        /**
         * Add a spec block generated by a transformation.
         *
         * @param blockId The id of the block.
         * @param spec    The spec of the block.
         * @return This builder.
         * @throws IllegalStateException If the id is already in use.
         */
        public Builder addGeneratedSpecBlock(SpecBlockId blockId, Spec spec) {
            if (givenSpecBlocks.containsKey(blockId)) {
                throw new IllegalStateException(blockId + " is a given spec block");
            }
            if (generatedSpecBlocks.containsKey(blockId)) {
                throw new IllegalStateException(blockId + " was already generated");
            }
            generatedSpecBlocks.put(blockId, Objects.requireNonNull(spec));
            nextSpecBlockId = Math.max(nextSpecBlockId, blockId.id() + 1);
            return this;
        }

        public Annotations annotations() {
            return annotations;
        }

        /**
         * Copy annotations of the snapshot this builder was created from.
         *
         * @param kinds The annotation kinds to keep.
         * @return This builder.
         * @throws IllegalStateException If this builder is for an initial snapshot.
         */
        public Builder carryForward(Ext<?>... kinds) {
            if (source == null) throw new IllegalStateException("no previous snapshot to carry annotations from");
            annotations.carryForward(source.annotations, kinds);
            return this;
        }

        /**
         * Build the snapshot, freezing its annotations. A builder builds only once.
         *
         * @return The snapshot.
         * @throws IllegalStateException If this builder was already built.
         */
        public FunctionTargetData build() {
            if (built) throw new IllegalStateException("builder was already built");
            built = true;
            return new FunctionTargetData(this);
        }
    }
}
