package io.github.eutro.stackless.target;

import io.github.eutro.stackless.bytecode.SpecBlockId;
import io.github.eutro.stackless.env.FunctionEnv;
import io.github.eutro.stackless.env.Spec;

/**
 * Resolves spec block ids to the specification they stand for.
 * <p>
 * Given blocks are looked up at their code offset in the function's declared
 * {@link Spec#getOnImpl() spec}; generated blocks carry their spec directly.
 */
public final class SpecBlockResolver {
    private SpecBlockResolver() {
    }

    /**
     * Resolve a spec block in a snapshot.
     *
     * @param fun     The function the snapshot belongs to.
     * @param data    The snapshot.
     * @param blockId The block id.
     * @return The spec of the block.
     * @throws SpecBlockNotFoundException If the snapshot knows no such block.
     */
    public static Spec resolve(FunctionEnv fun, FunctionTargetData data, SpecBlockId blockId) {
        Integer offset = data.getGivenSpecBlocks().get(blockId);
        if (offset != null) {
            Spec spec = fun.getSpec().getOnImpl().get(offset);
            if (spec != null) return spec;
            throw new SpecBlockNotFoundException(blockId, fun.getFullName());
        }
        Spec generated = data.getGeneratedSpecBlocks().get(blockId);
        if (generated != null) return generated;
        throw new SpecBlockNotFoundException(blockId, fun.getFullName());
    }
}
