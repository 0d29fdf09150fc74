package io.github.eutro.stackless.annotations;

import io.github.eutro.stackless.ext.Ext;

/**
 * The kinds of annotation the analyses of the pipeline produce. Each kind has exactly
 * one analysis writing it.
 */
public final class AnnotationKinds {
    private AnnotationKinds() {
    }

    public static final Ext<LiveVarAnnotation> LIVE_VARS = Ext.create(LiveVarAnnotation.class, "live_vars");
    public static final Ext<BorrowAnnotation> BORROW = Ext.create(BorrowAnnotation.class, "borrow");
    public static final Ext<WriteBackAnnotation> WRITE_BACK = Ext.create(WriteBackAnnotation.class, "write_back");
    public static final Ext<PackRefAnnotation> PACK_REF = Ext.create(PackRefAnnotation.class, "pack_ref");
    public static final Ext<LifetimeAnnotation> LIFETIME = Ext.create(LifetimeAnnotation.class, "lifetime");
    public static final Ext<ReachingDefAnnotation> REACHING_DEFS = Ext.create(ReachingDefAnnotation.class, "reaching_defs");
}
