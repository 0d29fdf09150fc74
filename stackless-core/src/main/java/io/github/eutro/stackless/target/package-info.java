/**
 * Per-function views of stackless bytecode.
 * <p>
 * A function's bytecode goes through a sequence of passes. Each pass sees the function
 * through a {@link io.github.eutro.stackless.target.FunctionTarget}, which joins the
 * function's declaration in the source environment with the current
 * {@link io.github.eutro.stackless.target.FunctionTargetData snapshot}, and returns the
 * next snapshot. Snapshots never change once built; the targets viewing them are
 * created for a single pass and then dropped.
 * <p>
 * Analyses hand their results to later passes through the snapshot's
 * {@link io.github.eutro.stackless.target.Annotations}.
 */
package io.github.eutro.stackless.target;
