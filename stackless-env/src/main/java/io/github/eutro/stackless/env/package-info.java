/**
 * The source environment, as the bytecode pipeline sees it.
 * <p>
 * A {@link io.github.eutro.stackless.env.GlobalEnv} holds the
 * {@link io.github.eutro.stackless.env.ModuleEnv modules} of a program, which in turn hold
 * {@link io.github.eutro.stackless.env.FunctionEnv function declarations}. These are filled
 * in by the front end and never change afterwards: every transformation of a function's
 * bytecode reads the same function env.
 * <p>
 * Names are {@link io.github.eutro.stackless.env.Symbol}s interned in the environment's
 * {@link io.github.eutro.stackless.env.SymbolPool}, and types are printed with a
 * {@link io.github.eutro.stackless.env.TypeDisplayContext}.
 */
package io.github.eutro.stackless.env;
