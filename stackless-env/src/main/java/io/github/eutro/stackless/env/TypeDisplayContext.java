package io.github.eutro.stackless.env;

import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Optional;

/**
 * Everything needed to print a {@link Type}: the environment structs are resolved in,
 * and optionally the names of the type parameters in scope.
 */
public final class TypeDisplayContext {
    private final GlobalEnv env;
    @Nullable
    private final List<Symbol> typeParamNames;

    private TypeDisplayContext(GlobalEnv env, @Nullable List<Symbol> typeParamNames) {
        this.env = env;
        this.typeParamNames = typeParamNames;
    }

    public static TypeDisplayContext withEnv(GlobalEnv env) {
        return new TypeDisplayContext(env, null);
    }

    public TypeDisplayContext withTypeParamNames(List<Symbol> names) {
        return new TypeDisplayContext(env, names);
    }

    public GlobalEnv getEnv() {
        return env;
    }

    public Optional<Symbol> getTypeParamName(int index) {
        if (typeParamNames == null || index >= typeParamNames.size()) return Optional.empty();
        return Optional.of(typeParamNames.get(index));
    }
}
