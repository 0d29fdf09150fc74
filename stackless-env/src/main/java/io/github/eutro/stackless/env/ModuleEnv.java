package io.github.eutro.stackless.env;

import java.util.*;

/**
 * A module of the source environment: its structs, its functions and its pragmas.
 */
public final class ModuleEnv {
    final GlobalEnv env;
    private final ModuleId id;
    private final Symbol name;
    private final Pragmas pragmas;
    private final Map<StructId, StructEnv> structs = new LinkedHashMap<>();
    private final Map<FunId, FunctionEnv> functions = new LinkedHashMap<>();

    ModuleEnv(GlobalEnv env, ModuleId id, Symbol name, Pragmas pragmas) {
        this.env = env;
        this.id = id;
        this.name = name;
        this.pragmas = pragmas;
    }

    public GlobalEnv getEnv() {
        return env;
    }

    public ModuleId getId() {
        return id;
    }

    public Symbol getName() {
        return name;
    }

    public SymbolPool symbolPool() {
        return env.symbolPool();
    }

    public Pragmas getPragmas() {
        return pragmas;
    }

    public StructEnv addStruct(String name, boolean resource) {
        StructId sid = new StructId(symbolPool().make(name));
        StructEnv struct = new StructEnv(this, sid, resource);
        if (structs.putIfAbsent(sid, struct) != null) {
            throw new IllegalArgumentException("struct " + name + " already declared in " + this.name.display(symbolPool()));
        }
        return struct;
    }

    public StructEnv getStruct(StructId id) {
        StructEnv struct = structs.get(id);
        if (struct == null) {
            throw new NoSuchElementException("no struct " + id.symbol().display(symbolPool())
                    + " in module " + name.display(symbolPool()));
        }
        return struct;
    }

    public Collection<StructEnv> getStructs() {
        return Collections.unmodifiableCollection(structs.values());
    }

    /**
     * Start declaring a function of this module. The function is registered when
     * {@link FunctionEnv.Builder#build()} is called.
     *
     * @param name The name of the function.
     * @return The builder.
     */
    public FunctionEnv.Builder newFunction(String name) {
        return new FunctionEnv.Builder(this, new FunId(symbolPool().make(name)));
    }

    void register(FunctionEnv function) {
        if (functions.putIfAbsent(function.getId(), function) != null) {
            throw new IllegalArgumentException("function " + function.getName().display(symbolPool())
                    + " already declared");
        }
    }

    public FunctionEnv getFunction(FunId id) {
        FunctionEnv function = functions.get(id);
        if (function == null) {
            throw new NoSuchElementException("no function " + id.symbol().display(symbolPool()));
        }
        return function;
    }

    public Optional<FunctionEnv> findFunction(String name) {
        return Optional.ofNullable(functions.get(new FunId(symbolPool().make(name))));
    }

    public Collection<FunctionEnv> getFunctions() {
        return Collections.unmodifiableCollection(functions.values());
    }
}
