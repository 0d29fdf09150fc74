package io.github.eutro.stackless.env;

import java.util.*;
import java.util.function.BooleanSupplier;

/**
 * A function as declared in the source: everything the front end knows about it
 * before any bytecode transformation happens.
 * <p>
 * A function env is immutable once {@link Builder#build() built}, and is shared by
 * every snapshot of the function's bytecode.
 */
public final class FunctionEnv {
    private final ModuleEnv module;
    private final FunId id;
    private final Loc loc;
    private final List<TypeParameter> typeParameters;
    private final int parameterCount;
    // one entry per declared local, parameters first; null if the local has no source name
    private final List<Symbol> localNames;
    private final List<Type> localTypes;
    private final List<Type> returnTypes;
    private final boolean isNative;
    private final boolean isPublic;
    private final Spec spec;
    private final List<StructId> acquiresGlobalResources;

    private FunctionEnv(Builder builder) {
        this.module = builder.module;
        this.id = builder.id;
        this.loc = builder.loc;
        this.typeParameters = Collections.unmodifiableList(new ArrayList<>(builder.typeParameters));
        this.parameterCount = builder.parameterCount;
        this.localNames = Collections.unmodifiableList(new ArrayList<>(builder.localNames));
        this.localTypes = Collections.unmodifiableList(new ArrayList<>(builder.localTypes));
        this.returnTypes = Collections.unmodifiableList(new ArrayList<>(builder.returnTypes));
        this.isNative = builder.isNative;
        this.isPublic = builder.isPublic;
        this.spec = builder.spec;
        this.acquiresGlobalResources = Collections.unmodifiableList(new ArrayList<>(builder.acquires));
    }

    public ModuleEnv getModule() {
        return module;
    }

    public GlobalEnv getEnv() {
        return module.getEnv();
    }

    public SymbolPool symbolPool() {
        return module.symbolPool();
    }

    public FunId getId() {
        return id;
    }

    public Symbol getName() {
        return id.symbol();
    }

    public String getFullName() {
        SymbolPool pool = symbolPool();
        return module.getName().display(pool) + "::" + getName().display(pool);
    }

    public Loc getLoc() {
        return loc;
    }

    public boolean isNative() {
        return isNative;
    }

    public boolean isPublic() {
        return isPublic;
    }

    /**
     * Whether this function has at least one {@code &mut} parameter.
     *
     * @return True if the function can mutate through its parameters.
     */
    public boolean isMutating() {
        for (int i = 0; i < parameterCount; i++) {
            if (localTypes.get(i).isMutableReference()) return true;
        }
        return false;
    }

    public List<TypeParameter> getTypeParameters() {
        return typeParameters;
    }

    public int getParameterCount() {
        return parameterCount;
    }

    /**
     * Get the number of locals declared in the source, including parameters.
     *
     * @return The count.
     */
    public int getLocalCount() {
        return localTypes.size();
    }

    public List<Type> getLocalTypes() {
        return localTypes;
    }

    public List<Type> getReturnTypes() {
        return returnTypes;
    }

    /**
     * Whether the local at this index has a name in the source.
     *
     * @param idx The local index.
     * @return True if {@link #getLocalName(int)} returns a source name.
     */
    public boolean hasDeclaredName(int idx) {
        return idx < localNames.size() && localNames.get(idx) != null;
    }

    /**
     * Get the name of a local. Locals named in the source keep their name,
     * all others (including any introduced later by transformations) are named {@code $t<idx>}.
     *
     * @param idx The local index.
     * @return The name.
     */
    public Symbol getLocalName(int idx) {
        if (idx < 0) throw new IndexOutOfBoundsException("local index " + idx);
        if (hasDeclaredName(idx)) return localNames.get(idx);
        return symbolPool().make(generatedLocalName(idx));
    }

    public static String generatedLocalName(int idx) {
        return "$t" + idx;
    }

    public Spec getSpec() {
        return spec;
    }

    public List<StructId> getAcquiresGlobalResources() {
        return acquiresGlobalResources;
    }

    /**
     * Look up a boolean pragma, first in this function's spec, then in the module,
     * and finally falling back to {@code dflt}.
     *
     * @param name The pragma name.
     * @param dflt The default, only invoked when neither scope sets a boolean.
     * @return The value.
     */
    public boolean isPragmaTrue(String name, BooleanSupplier dflt) {
        Optional<Boolean> value = spec.getProperties().getBool(name);
        if (!value.isPresent()) value = module.getPragmas().getBool(name);
        return value.isPresent() ? value.get() : dflt.getAsBoolean();
    }

    @Override
    public String toString() {
        return getFullName();
    }

    public static class Builder {
        private final ModuleEnv module;
        private final FunId id;
        private Loc loc;
        private final List<TypeParameter> typeParameters = new ArrayList<>();
        private int parameterCount = 0;
        private final List<Symbol> localNames = new ArrayList<>();
        private final List<Type> localTypes = new ArrayList<>();
        private final List<Type> returnTypes = new ArrayList<>();
        private boolean isNative;
        private boolean isPublic;
        private Spec spec = Spec.EMPTY;
        private final List<StructId> acquires = new ArrayList<>();

        Builder(ModuleEnv module, FunId id) {
            this.module = module;
            this.id = id;
            this.loc = new Loc(module.getName().display(module.symbolPool()), 0, 0);
        }

        public Builder setLoc(Loc loc) {
            this.loc = loc;
            return this;
        }

        public Builder setNative(boolean isNative) {
            this.isNative = isNative;
            return this;
        }

        public Builder setPublic(boolean isPublic) {
            this.isPublic = isPublic;
            return this;
        }

        public Builder addTypeParameter(String name, TypeParameter.Constraint constraint) {
            typeParameters.add(new TypeParameter(module.symbolPool().make(name), constraint));
            return this;
        }

        public Builder addParameter(String name, Type type) {
            if (localTypes.size() != parameterCount) {
                throw new IllegalStateException("parameters must be declared before locals");
            }
            localNames.add(module.symbolPool().make(name));
            localTypes.add(type);
            parameterCount++;
            return this;
        }

        public Builder addLocal(String name, Type type) {
            localNames.add(module.symbolPool().make(name));
            localTypes.add(type);
            return this;
        }

        /**
         * Declare a local that has no name in the source, such as a compiler temporary.
         *
         * @param type The type of the local.
         * @return This builder.
         */
        public Builder addLocal(Type type) {
            localNames.add(null);
            localTypes.add(type);
            return this;
        }

        public Builder addReturn(Type type) {
            returnTypes.add(type);
            return this;
        }

        public Builder setSpec(Spec spec) {
            this.spec = Objects.requireNonNull(spec);
            return this;
        }

        public Builder addAcquires(StructId struct) {
            module.getStruct(struct);
            acquires.add(struct);
            return this;
        }

        public FunctionEnv build() {
            FunctionEnv function = new FunctionEnv(this);
            module.register(function);
            return function;
        }
    }
}
