package io.github.eutro.stackless.annotations;

import io.github.eutro.stackless.bytecode.BorrowNode;
import io.github.eutro.stackless.target.FunctionTarget;

import java.util.*;
import java.util.stream.Collectors;

/**
 * The borrow nodes whose value has to be written back after each instruction.
 */
public final class WriteBackAnnotation {
    private final SortedMap<Integer, SortedSet<BorrowNode>> writeBacks;

    public WriteBackAnnotation(Map<Integer, ? extends Collection<BorrowNode>> writeBacks) {
        SortedMap<Integer, SortedSet<BorrowNode>> copy = new TreeMap<>();
        writeBacks.forEach((offset, nodes) -> copy.put(offset, Collections.unmodifiableSortedSet(new TreeSet<>(nodes))));
        this.writeBacks = Collections.unmodifiableSortedMap(copy);
    }

    public SortedSet<BorrowNode> get(int offset) {
        SortedSet<BorrowNode> nodes = writeBacks.get(offset);
        return nodes == null ? Collections.emptySortedSet() : nodes;
    }

    public static Optional<String> format(FunctionTarget target, int offset) {
        return target.getAnnotations()
                .get(AnnotationKinds.WRITE_BACK)
                .map(it -> it.get(offset))
                .filter(nodes -> !nodes.isEmpty())
                .map(nodes -> nodes.stream()
                        .map(node -> node.display(target))
                        .collect(Collectors.joining(", ", "write_back: ", "")));
    }
}
