package io.github.eutro.stackless.bytecode;

import io.github.eutro.stackless.env.ModuleId;
import io.github.eutro.stackless.env.StructId;
import io.github.eutro.stackless.target.FunctionTarget;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A node of the borrow graph: something which can be borrowed from, or a reference
 * which borrows.
 */
public abstract class BorrowNode implements Comparable<BorrowNode> {
    private BorrowNode() {
    }

    /**
     * A local which is the root of a borrow, i.e. a value that has been borrowed.
     *
     * @param idx The local index.
     * @return The node.
     */
    public static BorrowNode localRoot(int idx) {
        return new LocalRoot(idx);
    }

    /**
     * A global resource which is the root of a borrow.
     *
     * @param module The module declaring the resource.
     * @param struct The resource.
     * @return The node.
     */
    public static BorrowNode globalRoot(ModuleId module, StructId struct) {
        return new GlobalRoot(module, struct);
    }

    /**
     * A local holding a reference.
     *
     * @param idx The local index.
     * @return The node.
     */
    public static BorrowNode reference(int idx) {
        return new Reference(idx);
    }

    abstract int rank();

    public abstract String display(FunctionTarget target);

    static final class LocalRoot extends BorrowNode {
        final int idx;

        LocalRoot(int idx) {
            this.idx = idx;
        }

        @Override
        int rank() {
            return 0;
        }

        @Override
        public String display(FunctionTarget target) {
            return "LocalRoot(" + target.displayLocal(idx) + ")";
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof LocalRoot && ((LocalRoot) o).idx == idx;
        }

        @Override
        public int hashCode() {
            return idx;
        }
    }

    static final class GlobalRoot extends BorrowNode {
        final ModuleId module;
        final StructId struct;

        GlobalRoot(ModuleId module, StructId struct) {
            this.module = module;
            this.struct = struct;
        }

        @Override
        int rank() {
            return 1;
        }

        @Override
        public String display(FunctionTarget target) {
            return "GlobalRoot(" + target.globalEnv().getModule(module).getStruct(struct).getFullName() + ")";
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof GlobalRoot)) return false;
            GlobalRoot that = (GlobalRoot) o;
            return module.equals(that.module) && struct.equals(that.struct);
        }

        @Override
        public int hashCode() {
            return Objects.hash(module, struct);
        }
    }

    static final class Reference extends BorrowNode {
        final int idx;

        Reference(int idx) {
            this.idx = idx;
        }

        @Override
        int rank() {
            return 2;
        }

        @Override
        public String display(FunctionTarget target) {
            return "Reference(" + target.displayLocal(idx) + ")";
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Reference && ((Reference) o).idx == idx;
        }

        @Override
        public int hashCode() {
            return 31 * idx + 7;
        }
    }

    @Override
    public int compareTo(@NotNull BorrowNode o) {
        int c = Integer.compare(rank(), o.rank());
        if (c != 0) return c;
        if (this instanceof LocalRoot) return Integer.compare(((LocalRoot) this).idx, ((LocalRoot) o).idx);
        if (this instanceof Reference) return Integer.compare(((Reference) this).idx, ((Reference) o).idx);
        GlobalRoot l = (GlobalRoot) this, r = (GlobalRoot) o;
        c = l.module.compareTo(r.module);
        return c != 0 ? c : l.struct.compareTo(r.struct);
    }
}
