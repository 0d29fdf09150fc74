package io.github.eutro.stackless.target;

import java.util.Optional;

/**
 * Contributes comment text to the debug rendering of a function, per code offset.
 */
@FunctionalInterface
public interface AnnotationFormatter {
    /**
     * Format whatever this formatter knows about the instruction at {@code offset}.
     *
     * @param target The function being rendered.
     * @param offset The code offset of the instruction.
     * @return The text, or empty to print nothing for this offset.
     */
    Optional<String> format(FunctionTarget target, int offset);
}
