package io.github.eutro.stackless.annotations;

import io.github.eutro.stackless.target.FunctionTarget;

import java.util.*;

/**
 * The lifetime of each reference local, as the interval of code offsets it is alive in.
 */
public final class LifetimeAnnotation {
    private final SortedMap<Integer, Interval> lifetimes;

    public LifetimeAnnotation(Map<Integer, Interval> lifetimes) {
        this.lifetimes = Collections.unmodifiableSortedMap(new TreeMap<>(lifetimes));
    }

    public Optional<Interval> get(int local) {
        return Optional.ofNullable(lifetimes.get(local));
    }

    public SortedMap<Integer, Interval> getLifetimes() {
        return lifetimes;
    }

    public static Optional<String> format(FunctionTarget target, int offset) {
        Optional<LifetimeAnnotation> annotation = target.getAnnotations().get(AnnotationKinds.LIFETIME);
        if (!annotation.isPresent()) return Optional.empty();
        List<Integer> begin = new ArrayList<>();
        List<Integer> end = new ArrayList<>();
        for (Map.Entry<Integer, Interval> entry : annotation.get().lifetimes.entrySet()) {
            if (entry.getValue().getStart() == offset) begin.add(entry.getKey());
            if (entry.getValue().getEnd() == offset) end.add(entry.getKey());
        }
        StringJoiner sj = new StringJoiner("; ");
        if (!begin.isEmpty()) sj.add("lifetime begins: " + AnnotationFormatters.locals(target, begin));
        if (!end.isEmpty()) sj.add("lifetime ends: " + AnnotationFormatters.locals(target, end));
        return sj.length() == 0 ? Optional.empty() : Optional.of(sj.toString());
    }

    /**
     * An inclusive interval of code offsets.
     */
    public static final class Interval {
        private final int start;
        private final int end;

        public Interval(int start, int end) {
            if (start > end) throw new IllegalArgumentException("interval [" + start + ", " + end + "]");
            this.start = start;
            this.end = end;
        }

        public int getStart() {
            return start;
        }

        public int getEnd() {
            return end;
        }

        public boolean contains(int offset) {
            return start <= offset && offset <= end;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Interval)) return false;
            Interval that = (Interval) o;
            return start == that.start && end == that.end;
        }

        @Override
        public int hashCode() {
            return 31 * start + end;
        }

        @Override
        public String toString() {
            return "[" + start + ", " + end + "]";
        }
    }
}
