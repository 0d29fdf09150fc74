package io.github.eutro.stackless.passes;

import io.github.eutro.stackless.target.FunctionTarget;
import io.github.eutro.stackless.target.FunctionTargetData;

import java.util.function.Function;

/**
 * A pass over a single function, producing the next snapshot of its bytecode.
 * <p>
 * Processors read the current snapshot through the {@link FunctionTarget} they are given,
 * and build their result from {@link FunctionTargetData#toBuilder()}.
 */
public interface FunctionTargetProcessor {
    FunctionTargetData process(FunctionTarget target);

    default String getName() {
        return getClass().getSimpleName();
    }

    default FunctionTargetProcessor then(FunctionTargetProcessor next) {
        return new ChainedProcessor(this, next);
    }

    static FunctionTargetProcessor named(String name, Function<FunctionTarget, FunctionTargetData> process) {
        return new FunctionTargetProcessor() {
            @Override
            public FunctionTargetData process(FunctionTarget target) {
                return process.apply(target);
            }

            @Override
            public String getName() {
                return name;
            }
        };
    }
}
