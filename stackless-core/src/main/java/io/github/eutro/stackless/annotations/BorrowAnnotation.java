package io.github.eutro.stackless.annotations;

import io.github.eutro.stackless.bytecode.BorrowNode;
import io.github.eutro.stackless.target.FunctionTarget;

import java.util.*;
import java.util.stream.Collectors;

/**
 * The borrow graph after each instruction: which nodes are live, and which references
 * borrow from which nodes.
 */
public final class BorrowAnnotation {
    private final SortedMap<Integer, BorrowInfo> infos;

    public BorrowAnnotation(Map<Integer, BorrowInfo> infos) {
        this.infos = Collections.unmodifiableSortedMap(new TreeMap<>(infos));
    }

    public Optional<BorrowInfo> get(int offset) {
        return Optional.ofNullable(infos.get(offset));
    }

    public static Optional<String> format(FunctionTarget target, int offset) {
        Optional<BorrowInfo> info = target.getAnnotations()
                .get(AnnotationKinds.BORROW)
                .flatMap(it -> it.get(offset));
        if (!info.isPresent()) return Optional.empty();
        StringJoiner sj = new StringJoiner("; ");
        if (!info.get().getLiveNodes().isEmpty()) {
            sj.add(nodes(target, info.get().getLiveNodes(), "live_nodes: ", ""));
        }
        if (!info.get().getBorrowedBy().isEmpty()) {
            sj.add(info.get().getBorrowedBy().entrySet().stream()
                    .map(e -> e.getKey().display(target) + " -> " + nodes(target, e.getValue(), "{", "}"))
                    .collect(Collectors.joining(", ", "borrowed_by: ", "")));
        }
        return sj.length() == 0 ? Optional.empty() : Optional.of(sj.toString());
    }

    private static String nodes(FunctionTarget target, Collection<BorrowNode> nodes, String prefix, String suffix) {
        return nodes.stream().map(node -> node.display(target)).collect(Collectors.joining(", ", prefix, suffix));
    }

    public static final class BorrowInfo {
        private final SortedSet<BorrowNode> liveNodes;
        private final SortedMap<BorrowNode, SortedSet<BorrowNode>> borrowedBy;

        public BorrowInfo(Collection<BorrowNode> liveNodes, Map<BorrowNode, ? extends Collection<BorrowNode>> borrowedBy) {
            this.liveNodes = Collections.unmodifiableSortedSet(new TreeSet<>(liveNodes));
            SortedMap<BorrowNode, SortedSet<BorrowNode>> copy = new TreeMap<>();
            borrowedBy.forEach((node, borrowers) ->
                    copy.put(node, Collections.unmodifiableSortedSet(new TreeSet<>(borrowers))));
            this.borrowedBy = Collections.unmodifiableSortedMap(copy);
        }

        public SortedSet<BorrowNode> getLiveNodes() {
            return liveNodes;
        }

        /**
         * Get the borrow edges, from each borrowed node to the references borrowing it.
         *
         * @return The edges.
         */
        public SortedMap<BorrowNode, SortedSet<BorrowNode>> getBorrowedBy() {
            return borrowedBy;
        }
    }
}
