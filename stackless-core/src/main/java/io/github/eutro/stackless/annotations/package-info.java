/**
 * The results of the dataflow analyses, as stored in {@link io.github.eutro.stackless.target.Annotations}.
 */
package io.github.eutro.stackless.annotations;
