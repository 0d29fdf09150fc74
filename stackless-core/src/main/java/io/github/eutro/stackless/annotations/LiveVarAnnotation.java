package io.github.eutro.stackless.annotations;

import io.github.eutro.stackless.target.FunctionTarget;

import java.util.*;

/**
 * The locals live before and after each instruction.
 */
public final class LiveVarAnnotation {
    private final SortedMap<Integer, LiveVarInfo> infos;

    public LiveVarAnnotation(Map<Integer, LiveVarInfo> infos) {
        this.infos = Collections.unmodifiableSortedMap(new TreeMap<>(infos));
    }

    public Optional<LiveVarInfo> get(int offset) {
        return Optional.ofNullable(infos.get(offset));
    }

    public static Optional<String> format(FunctionTarget target, int offset) {
        return target.getAnnotations()
                .get(AnnotationKinds.LIVE_VARS)
                .flatMap(it -> it.get(offset))
                .map(info -> "live vars: " + AnnotationFormatters.locals(target, info.getAfter()));
    }

    public static final class LiveVarInfo {
        private final SortedSet<Integer> before;
        private final SortedSet<Integer> after;

        public LiveVarInfo(Collection<Integer> before, Collection<Integer> after) {
            this.before = Collections.unmodifiableSortedSet(new TreeSet<>(before));
            this.after = Collections.unmodifiableSortedSet(new TreeSet<>(after));
        }

        public SortedSet<Integer> getBefore() {
            return before;
        }

        public SortedSet<Integer> getAfter() {
            return after;
        }
    }
}
