package io.github.eutro.stackless.target;

import io.github.eutro.stackless.bytecode.SpecBlockId;

/**
 * Thrown when a spec block id is neither anchored to the source nor generated
 * in the snapshot it was looked up in.
 */
public class SpecBlockNotFoundException extends RuntimeException {
    private final SpecBlockId blockId;

    public SpecBlockNotFoundException(SpecBlockId blockId, String function) {
        super("spec block " + blockId + " not found in " + function);
        this.blockId = blockId;
    }

    public SpecBlockId getBlockId() {
        return blockId;
    }
}
