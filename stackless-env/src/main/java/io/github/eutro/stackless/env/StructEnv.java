package io.github.eutro.stackless.env;

/**
 * A struct declared in a module. Only what is needed to name and classify it.
 */
public final class StructEnv {
    private final ModuleEnv module;
    private final StructId id;
    private final boolean resource;

    StructEnv(ModuleEnv module, StructId id, boolean resource) {
        this.module = module;
        this.id = id;
        this.resource = resource;
    }

    public ModuleEnv getModule() {
        return module;
    }

    public StructId getId() {
        return id;
    }

    public Symbol getName() {
        return id.symbol();
    }

    public boolean isResource() {
        return resource;
    }

    /**
     * Get the module-qualified name of this struct, e.g. {@code Coin::T}.
     *
     * @return The name.
     */
    public String getFullName() {
        SymbolPool pool = module.symbolPool();
        return module.getName().display(pool) + "::" + getName().display(pool);
    }
}
