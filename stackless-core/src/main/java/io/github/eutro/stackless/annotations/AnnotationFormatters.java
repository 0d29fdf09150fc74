package io.github.eutro.stackless.annotations;

import io.github.eutro.stackless.target.FunctionTarget;

import java.util.Collection;
import java.util.stream.Collectors;

public final class AnnotationFormatters {
    private AnnotationFormatters() {
    }

    /**
     * Register the formatter of every annotation kind on a target, in the order
     * test expectations are written in.
     *
     * @param target The target.
     */
    public static void registerForTest(FunctionTarget target) {
        target.registerAnnotationFormatter(LiveVarAnnotation::format);
        target.registerAnnotationFormatter(BorrowAnnotation::format);
        target.registerAnnotationFormatter(WriteBackAnnotation::format);
        target.registerAnnotationFormatter(PackRefAnnotation::format);
        target.registerAnnotationFormatter(LifetimeAnnotation::format);
        target.registerAnnotationFormatter(ReachingDefAnnotation::format);
    }

    static String locals(FunctionTarget target, Collection<Integer> locals) {
        return locals.stream().map(target::displayLocal).collect(Collectors.joining(", "));
    }
}
