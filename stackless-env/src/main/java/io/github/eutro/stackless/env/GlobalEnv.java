package io.github.eutro.stackless.env;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The root of the source environment: all modules of a program, and the symbol pool they share.
 * <p>
 * Modules are added while the front end populates the environment. After that it is only read,
 * and may be shared between threads.
 */
public final class GlobalEnv {
    private final SymbolPool symbolPool = new SymbolPool();
    private final List<ModuleEnv> modules = new ArrayList<>();

    public SymbolPool symbolPool() {
        return symbolPool;
    }

    public ModuleEnv addModule(String name) {
        return addModule(name, Pragmas.EMPTY);
    }

    public ModuleEnv addModule(String name, Pragmas pragmas) {
        Symbol sym = symbolPool.make(name);
        if (findModule(sym).isPresent()) {
            throw new IllegalArgumentException("module " + name + " already declared");
        }
        ModuleEnv module = new ModuleEnv(this, new ModuleId(modules.size()), sym, pragmas);
        modules.add(module);
        return module;
    }

    public ModuleEnv getModule(ModuleId id) {
        return modules.get(id.toIndex());
    }

    public Optional<ModuleEnv> findModule(Symbol name) {
        for (ModuleEnv module : modules) {
            if (module.getName() == name) return Optional.of(module);
        }
        return Optional.empty();
    }

    public List<ModuleEnv> getModules() {
        return Collections.unmodifiableList(modules);
    }
}
