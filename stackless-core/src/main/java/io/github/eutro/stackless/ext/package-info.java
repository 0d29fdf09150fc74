/**
 * The ext API allows for associating arbitrary, typed data with
 * instances of {@link io.github.eutro.stackless.ext.ExtContainer}.
 *
 * <pre>{@code
 * class LiveVarExts {
 *   public static final Ext<LiveVarAnnotation> LIVE_VARS = Ext.create(LiveVarAnnotation.class, "live_vars");
 * }
 *
 * ExtHolder holder = new ExtHolder();
 * holder.attachExt(LIVE_VARS, annotation);
 *
 * holder.getExtOrThrow(LIVE_VARS); // => annotation
 * }</pre>
 * <p>
 * Each ext is created once, as a constant, by the code that owns that kind of data.
 * Other code can then read the data without depending on how it was computed, which
 * is how analysis passes hand their results to each other through
 * {@link io.github.eutro.stackless.target.Annotations}.
 * <p>
 * A container holds at most one value per ext. Values are checked against the
 * ext's class when they are attached, so reading them back is always type safe.
 */
package io.github.eutro.stackless.ext;
