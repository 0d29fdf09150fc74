package io.github.eutro.stackless.env;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A pool of {@link Symbol}s.
 * <p>
 * The pool is shared by every function of a {@link GlobalEnv}, and passes over
 * different functions may run in parallel, so interning is synchronized.
 */
public final class SymbolPool {
    private final Map<String, Symbol> symbols = new HashMap<>();
    private final List<String> strings = new ArrayList<>();

    /**
     * Intern a string, returning the unique symbol for it.
     *
     * @param s The string.
     * @return The symbol.
     */
    public synchronized Symbol make(String s) {
        Symbol sym = symbols.get(s);
        if (sym == null) {
            sym = new Symbol(strings.size());
            strings.add(s);
            symbols.put(s, sym);
        }
        return sym;
    }

    /**
     * Get the string a symbol was made from.
     *
     * @param sym The symbol.
     * @return The string.
     * @throws IllegalArgumentException If the symbol does not belong to this pool.
     */
    public synchronized String string(Symbol sym) {
        if (sym.id() >= strings.size() || symbols.get(strings.get(sym.id())) != sym) {
            throw new IllegalArgumentException(sym + " does not belong to this pool");
        }
        return strings.get(sym.id());
    }

    public synchronized int size() {
        return strings.size();
    }
}
