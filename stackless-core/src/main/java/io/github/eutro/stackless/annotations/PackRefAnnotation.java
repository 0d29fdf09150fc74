package io.github.eutro.stackless.annotations;

import io.github.eutro.stackless.target.FunctionTarget;

import java.util.*;

/**
 * The references which have to be unpacked before, and packed after, each instruction.
 */
public final class PackRefAnnotation {
    private final SortedMap<Integer, PackRefInfo> infos;

    public PackRefAnnotation(Map<Integer, PackRefInfo> infos) {
        this.infos = Collections.unmodifiableSortedMap(new TreeMap<>(infos));
    }

    public Optional<PackRefInfo> get(int offset) {
        return Optional.ofNullable(infos.get(offset));
    }

    public static Optional<String> format(FunctionTarget target, int offset) {
        Optional<PackRefInfo> info = target.getAnnotations()
                .get(AnnotationKinds.PACK_REF)
                .flatMap(it -> it.get(offset));
        if (!info.isPresent()) return Optional.empty();
        StringJoiner sj = new StringJoiner("; ");
        if (!info.get().getPackRefs().isEmpty()) {
            sj.add("pack_refs: " + AnnotationFormatters.locals(target, info.get().getPackRefs()));
        }
        if (!info.get().getUnpackRefs().isEmpty()) {
            sj.add("unpack_refs: " + AnnotationFormatters.locals(target, info.get().getUnpackRefs()));
        }
        return sj.length() == 0 ? Optional.empty() : Optional.of(sj.toString());
    }

    public static final class PackRefInfo {
        private final SortedSet<Integer> packRefs;
        private final SortedSet<Integer> unpackRefs;

        public PackRefInfo(Collection<Integer> packRefs, Collection<Integer> unpackRefs) {
            this.packRefs = Collections.unmodifiableSortedSet(new TreeSet<>(packRefs));
            this.unpackRefs = Collections.unmodifiableSortedSet(new TreeSet<>(unpackRefs));
        }

        public SortedSet<Integer> getPackRefs() {
            return packRefs;
        }

        public SortedSet<Integer> getUnpackRefs() {
            return unpackRefs;
        }
    }
}
