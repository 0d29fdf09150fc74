package io.github.eutro.stackless.bytecode;

import io.github.eutro.stackless.env.FunId;
import io.github.eutro.stackless.env.ModuleId;
import io.github.eutro.stackless.env.StructId;
import io.github.eutro.stackless.env.Type;
import io.github.eutro.stackless.env.TypeDisplayContext;
import io.github.eutro.stackless.target.FunctionTarget;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The operation performed by a {@link Bytecode.Call}: a function call, a struct or
 * reference operation, or a builtin.
 */
public final class Operation {
    public enum Kind {
        FUNCTION(""),

        PACK("pack"),
        UNPACK("unpack"),
        MOVE_TO("move_to"),
        MOVE_FROM("move_from"),
        EXISTS("exists"),
        BORROW_FIELD("borrow_field"),
        BORROW_GLOBAL("borrow_global"),
        GET_FIELD("get_field"),
        GET_GLOBAL("get_global"),

        BORROW_LOC("borrow_local"),
        READ_REF("read_ref"),
        WRITE_REF("write_ref"),
        FREEZE_REF("freeze_ref"),

        // introduced by the memory model transformations
        WRITE_BACK("write_back"),
        UNPACK_REF("unpack_ref"),
        PACK_REF("pack_ref"),

        DESTROY("destroy"),

        CAST_U8("(u8)"),
        CAST_U64("(u64)"),
        CAST_U128("(u128)"),
        NOT("!"),
        ADD("+"),
        SUB("-"),
        MUL("*"),
        DIV("/"),
        MOD("%"),
        BIT_OR("|"),
        BIT_AND("&"),
        XOR("^"),
        SHL("<<"),
        SHR(">>"),
        LT("<"),
        GT(">"),
        LE("<="),
        GE(">="),
        OR("||"),
        AND("&&"),
        EQ("=="),
        NEQ("!="),
        ;

        public final String mnemonic;

        Kind(String mnemonic) {
            this.mnemonic = mnemonic;
        }

        boolean takesStruct() {
            return compareTo(PACK) >= 0 && compareTo(GET_GLOBAL) <= 0;
        }

        boolean takesField() {
            return this == BORROW_FIELD || this == GET_FIELD;
        }
    }

    private final Kind kind;
    @Nullable
    private final ModuleId module;
    @Nullable
    private final FunId function;
    @Nullable
    private final StructId struct;
    private final List<Type> typeArgs;
    private final int field;
    @Nullable
    private final BorrowNode borrowNode;

    private Operation(
            Kind kind,
            @Nullable ModuleId module,
            @Nullable FunId function,
            @Nullable StructId struct,
            List<Type> typeArgs,
            int field,
            @Nullable BorrowNode borrowNode
    ) {
        this.kind = kind;
        this.module = module;
        this.function = function;
        this.struct = struct;
        this.typeArgs = Collections.unmodifiableList(new ArrayList<>(typeArgs));
        this.field = field;
        this.borrowNode = borrowNode;
    }

    public static Operation function(ModuleId module, FunId function, Type... typeArgs) {
        return new Operation(Kind.FUNCTION, module, function, null, Arrays.asList(typeArgs), -1, null);
    }

    public static Operation struct(Kind kind, ModuleId module, StructId struct, Type... typeArgs) {
        if (!kind.takesStruct() || kind.takesField()) {
            throw new IllegalArgumentException(kind + " is not a struct operation");
        }
        return new Operation(kind, module, null, struct, Arrays.asList(typeArgs), -1, null);
    }

    public static Operation field(Kind kind, ModuleId module, StructId struct, int field, Type... typeArgs) {
        if (!kind.takesField()) {
            throw new IllegalArgumentException(kind + " is not a field operation");
        }
        if (field < 0) throw new IllegalArgumentException("field offset " + field);
        return new Operation(kind, module, null, struct, Arrays.asList(typeArgs), field, null);
    }

    public static Operation writeBack(BorrowNode node) {
        return new Operation(Kind.WRITE_BACK, null, null, null, Collections.emptyList(), -1, node);
    }

    /**
     * An operation which takes no struct, function or borrow node, such as a builtin.
     *
     * @param kind The kind of operation.
     * @return The operation.
     */
    public static Operation of(Kind kind) {
        if (kind == Kind.FUNCTION || kind == Kind.WRITE_BACK || kind.takesStruct()) {
            throw new IllegalArgumentException(kind + " needs operands");
        }
        return new Operation(kind, null, null, null, Collections.emptyList(), -1, null);
    }

    public Kind getKind() {
        return kind;
    }

    public List<Type> getTypeArgs() {
        return typeArgs;
    }

    public @Nullable BorrowNode getBorrowNode() {
        return borrowNode;
    }

    public String display(FunctionTarget target) {
        TypeDisplayContext ctx = target.typeDisplayContext();
        String typeArgs = this.typeArgs.isEmpty()
                ? ""
                : this.typeArgs.stream().map(ty -> ty.display(ctx)).collect(Collectors.joining(", ", "<", ">"));
        switch (kind) {
            case FUNCTION:
                return moduleName(target) + "::"
                        + Objects.requireNonNull(function).symbol().display(target.symbolPool())
                        + typeArgs;
            case WRITE_BACK:
                return kind.mnemonic + "[" + Objects.requireNonNull(borrowNode).display(target) + "]";
            default:
                if (!kind.takesStruct()) return kind.mnemonic;
                String structName = moduleName(target) + "::"
                        + Objects.requireNonNull(struct).symbol().display(target.symbolPool());
                String base = kind.mnemonic + "<" + structName + typeArgs + ">";
                return kind.takesField() ? base + "." + field : base;
        }
    }

    private String moduleName(FunctionTarget target) {
        return target.globalEnv()
                .getModule(Objects.requireNonNull(module))
                .getName()
                .display(target.symbolPool());
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Operation)) return false;
        Operation that = (Operation) o;
        return kind == that.kind
                && field == that.field
                && Objects.equals(module, that.module)
                && Objects.equals(function, that.function)
                && Objects.equals(struct, that.struct)
                && typeArgs.equals(that.typeArgs)
                && Objects.equals(borrowNode, that.borrowNode);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, module, function, struct, typeArgs, field, borrowNode);
    }

    @Override
    public String toString() {
        return kind.name();
    }
}
