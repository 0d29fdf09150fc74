package io.github.eutro.stackless.bytecode;

import io.github.eutro.stackless.env.Condition;
import io.github.eutro.stackless.env.Spec;
import io.github.eutro.stackless.env.Type;
import io.github.eutro.stackless.target.FunctionTarget;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * A stackless bytecode instruction. Operands are local indices of the function the
 * instruction belongs to.
 * <p>
 * Instructions are immutable. A transformation which changes an instruction replaces it,
 * usually keeping its {@link AttrId} so that its source location is kept too.
 */
public abstract class Bytecode {
    private final AttrId attrId;

    private Bytecode(AttrId attrId) {
        this.attrId = Objects.requireNonNull(attrId);
    }

    public AttrId getAttrId() {
        return attrId;
    }

    /**
     * Get the locals this instruction reads.
     *
     * @return The local indices.
     */
    public List<Integer> sources() {
        return Collections.emptyList();
    }

    /**
     * Get the locals this instruction writes.
     *
     * @return The local indices.
     */
    public List<Integer> dests() {
        return Collections.emptyList();
    }

    public boolean isBranch() {
        return false;
    }

    /**
     * Render this instruction, resolving locals in the given target.
     *
     * @param target The function this instruction belongs to.
     * @return The rendered instruction.
     */
    public String display(FunctionTarget target) {
        return display(target, Type::isReference);
    }

    /**
     * Render this instruction, resolving locals in the given target.
     *
     * @param target      The function this instruction belongs to.
     * @param isReference Decides which operand types are references.
     * @return The rendered instruction.
     */
    public abstract String display(FunctionTarget target, Predicate<Type> isReference);

    @Override
    public String toString() {
        return getClass().getSimpleName() + "@" + attrId;
    }

    static String locals(FunctionTarget target, List<Integer> locals) {
        return locals.stream().map(target::displayLocal).collect(Collectors.joining(", "));
    }

    private static List<Integer> copyOf(List<Integer> locals) {
        return Collections.unmodifiableList(new ArrayList<>(locals));
    }

    public static final class Assign extends Bytecode {
        private final int dest;
        private final int src;
        private final AssignKind kind;

        public Assign(AttrId attrId, int dest, int src, AssignKind kind) {
            super(attrId);
            this.dest = dest;
            this.src = src;
            this.kind = kind;
        }

        public AssignKind getKind() {
            return kind;
        }

        @Override
        public List<Integer> sources() {
            return Collections.singletonList(src);
        }

        @Override
        public List<Integer> dests() {
            return Collections.singletonList(dest);
        }

        @Override
        public String display(FunctionTarget target, Predicate<Type> isReference) {
            String lhs = target.displayLocal(dest) + " := ";
            String rhs = target.displayLocal(src);
            switch (kind) {
                case COPY:
                    return lhs + "copy(" + rhs + ")";
                case MOVE:
                    return lhs + "move(" + rhs + ")";
                default:
                    return lhs + rhs;
            }
        }
    }

    public static final class Call extends Bytecode {
        private final List<Integer> dests;
        private final Operation operation;
        private final List<Integer> srcs;

        public Call(AttrId attrId, List<Integer> dests, Operation operation, List<Integer> srcs) {
            super(attrId);
            this.dests = copyOf(dests);
            this.operation = Objects.requireNonNull(operation);
            this.srcs = copyOf(srcs);
        }

        public Operation getOperation() {
            return operation;
        }

        @Override
        public List<Integer> sources() {
            return srcs;
        }

        @Override
        public List<Integer> dests() {
            return dests;
        }

        @Override
        public String display(FunctionTarget target, Predicate<Type> isReference) {
            StringBuilder sb = new StringBuilder();
            switch (dests.size()) {
                case 0:
                    break;
                case 1:
                    sb.append(target.displayLocal(dests.get(0))).append(" := ");
                    break;
                default:
                    sb.append('(').append(locals(target, dests)).append(") := ");
                    break;
            }
            // destroying a reference ends a borrow rather than dropping a value
            if (operation.getKind() == Operation.Kind.DESTROY
                    && srcs.stream().map(target::getLocalType).anyMatch(isReference)) {
                sb.append("release");
            } else {
                sb.append(operation.display(target));
            }
            return sb.append('(').append(locals(target, srcs)).append(')').toString();
        }
    }

    public static final class Ret extends Bytecode {
        private final List<Integer> srcs;

        public Ret(AttrId attrId, List<Integer> srcs) {
            super(attrId);
            this.srcs = copyOf(srcs);
        }

        public Ret(AttrId attrId, Integer... srcs) {
            this(attrId, Arrays.asList(srcs));
        }

        @Override
        public List<Integer> sources() {
            return srcs;
        }

        @Override
        public boolean isBranch() {
            return true;
        }

        @Override
        public String display(FunctionTarget target, Predicate<Type> isReference) {
            if (srcs.size() == 1) return "return " + target.displayLocal(srcs.get(0));
            return "return (" + locals(target, srcs) + ")";
        }
    }

    public static final class Load extends Bytecode {
        private final int dest;
        private final Constant constant;

        public Load(AttrId attrId, int dest, Constant constant) {
            super(attrId);
            this.dest = dest;
            this.constant = Objects.requireNonNull(constant);
        }

        public Constant getConstant() {
            return constant;
        }

        @Override
        public List<Integer> dests() {
            return Collections.singletonList(dest);
        }

        @Override
        public String display(FunctionTarget target, Predicate<Type> isReference) {
            return target.displayLocal(dest) + " := " + constant;
        }
    }

    public static final class Branch extends Bytecode {
        private final Label thenLabel;
        private final Label elseLabel;
        private final int cond;

        public Branch(AttrId attrId, Label thenLabel, Label elseLabel, int cond) {
            super(attrId);
            this.thenLabel = thenLabel;
            this.elseLabel = elseLabel;
            this.cond = cond;
        }

        @Override
        public List<Integer> sources() {
            return Collections.singletonList(cond);
        }

        @Override
        public boolean isBranch() {
            return true;
        }

        @Override
        public String display(FunctionTarget target, Predicate<Type> isReference) {
            return "if (" + target.displayLocal(cond) + ") goto " + thenLabel + " else goto " + elseLabel;
        }
    }

    public static final class Jump extends Bytecode {
        private final Label label;

        public Jump(AttrId attrId, Label label) {
            super(attrId);
            this.label = label;
        }

        @Override
        public boolean isBranch() {
            return true;
        }

        @Override
        public String display(FunctionTarget target, Predicate<Type> isReference) {
            return "goto " + label;
        }
    }

    public static final class LabelDef extends Bytecode {
        private final Label label;

        public LabelDef(AttrId attrId, Label label) {
            super(attrId);
            this.label = label;
        }

        public Label getLabel() {
            return label;
        }

        @Override
        public String display(FunctionTarget target, Predicate<Type> isReference) {
            return label + ":";
        }
    }

    public static final class Abort extends Bytecode {
        private final int src;

        public Abort(AttrId attrId, int src) {
            super(attrId);
            this.src = src;
        }

        @Override
        public List<Integer> sources() {
            return Collections.singletonList(src);
        }

        @Override
        public boolean isBranch() {
            return true;
        }

        @Override
        public String display(FunctionTarget target, Predicate<Type> isReference) {
            return "abort(" + target.displayLocal(src) + ")";
        }
    }

    public static final class Nop extends Bytecode {
        public Nop(AttrId attrId) {
            super(attrId);
        }

        @Override
        public String display(FunctionTarget target, Predicate<Type> isReference) {
            return "nop";
        }
    }

    /**
     * A position in the code where a specification block applies. The block's conditions
     * are found with {@link FunctionTarget#getSpecOnImpl(SpecBlockId)}.
     */
    public static final class SpecBlock extends Bytecode {
        private final SpecBlockId blockId;

        public SpecBlock(AttrId attrId, SpecBlockId blockId) {
            super(attrId);
            this.blockId = blockId;
        }

        public SpecBlockId getBlockId() {
            return blockId;
        }

        @Override
        public String display(FunctionTarget target, Predicate<Type> isReference) {
            Spec spec = target.getSpecOnImpl(blockId);
            return spec.getConditions().stream()
                    .map(Condition::toString)
                    .collect(Collectors.joining("; ", "spec {", "}"));
        }
    }
}
