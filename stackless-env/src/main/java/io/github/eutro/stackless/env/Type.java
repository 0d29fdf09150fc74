package io.github.eutro.stackless.env;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A type of the source language, as seen by the bytecode.
 * <p>
 * Types are immutable values, compared structurally.
 */
public abstract class Type {
    public static final Primitive BOOL = new Primitive("bool");
    public static final Primitive U8 = new Primitive("u8");
    public static final Primitive U64 = new Primitive("u64");
    public static final Primitive U128 = new Primitive("u128");
    public static final Primitive ADDRESS = new Primitive("address");
    public static final Primitive SIGNER = new Primitive("signer");

    Type() {
    }

    public static Vector vector(Type element) {
        return new Vector(element);
    }

    public static Struct struct(ModuleId module, StructId struct, Type... typeArgs) {
        return new Struct(module, struct, Arrays.asList(typeArgs));
    }

    public static Struct struct(ModuleId module, StructId struct, List<Type> typeArgs) {
        return new Struct(module, struct, typeArgs);
    }

    public static TypeParam typeParam(int index) {
        return new TypeParam(index);
    }

    public static Reference reference(boolean mutable, Type referent) {
        return new Reference(mutable, referent);
    }

    public static Reference ref(Type referent) {
        return reference(false, referent);
    }

    public static Reference mutRef(Type referent) {
        return reference(true, referent);
    }

    public static Tuple tuple(Type... elements) {
        return new Tuple(Arrays.asList(elements));
    }

    public boolean isReference() {
        return false;
    }

    public boolean isMutableReference() {
        return false;
    }

    /**
     * Render this type for humans.
     *
     * @param ctx The context to resolve struct and type parameter names in.
     * @return The rendered type.
     */
    public abstract String display(TypeDisplayContext ctx);

    static String displayArgs(List<Type> args, TypeDisplayContext ctx) {
        if (args.isEmpty()) return "";
        return args.stream().map(it -> it.display(ctx)).collect(Collectors.joining(", ", "<", ">"));
    }

    public static final class Primitive extends Type {
        private final String name;

        private Primitive(String name) {
            this.name = name;
        }

        @Override
        public String display(TypeDisplayContext ctx) {
            return name;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    public static final class Vector extends Type {
        private final Type element;

        private Vector(Type element) {
            this.element = Objects.requireNonNull(element);
        }

        public Type getElement() {
            return element;
        }

        @Override
        public String display(TypeDisplayContext ctx) {
            return "vector<" + element.display(ctx) + ">";
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Vector && ((Vector) o).element.equals(element);
        }

        @Override
        public int hashCode() {
            return 31 * element.hashCode() + 1;
        }

        @Override
        public String toString() {
            return "vector<" + element + ">";
        }
    }

    public static final class Struct extends Type {
        private final ModuleId module;
        private final StructId struct;
        private final List<Type> typeArgs;

        private Struct(ModuleId module, StructId struct, List<Type> typeArgs) {
            this.module = Objects.requireNonNull(module);
            this.struct = Objects.requireNonNull(struct);
            this.typeArgs = Collections.unmodifiableList(new ArrayList<>(typeArgs));
        }

        public ModuleId getModule() {
            return module;
        }

        public StructId getStruct() {
            return struct;
        }

        public List<Type> getTypeArgs() {
            return typeArgs;
        }

        @Override
        public String display(TypeDisplayContext ctx) {
            StructEnv env = ctx.getEnv().getModule(module).getStruct(struct);
            return env.getFullName() + displayArgs(typeArgs, ctx);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Struct)) return false;
            Struct that = (Struct) o;
            return module.equals(that.module) && struct.equals(that.struct) && typeArgs.equals(that.typeArgs);
        }

        @Override
        public int hashCode() {
            return Objects.hash(module, struct, typeArgs);
        }

        @Override
        public String toString() {
            return "struct(" + module.toIndex() + ", " + struct.symbol().id() + ")" + typeArgs;
        }
    }

    public static final class TypeParam extends Type {
        private final int index;

        private TypeParam(int index) {
            this.index = index;
        }

        public int getIndex() {
            return index;
        }

        @Override
        public String display(TypeDisplayContext ctx) {
            return ctx.getTypeParamName(index)
                    .map(name -> name.display(ctx.getEnv().symbolPool()))
                    .orElse("#" + index);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof TypeParam && ((TypeParam) o).index == index;
        }

        @Override
        public int hashCode() {
            return 17 + index;
        }

        @Override
        public String toString() {
            return "#" + index;
        }
    }

    public static final class Reference extends Type {
        private final boolean mutable;
        private final Type referent;

        private Reference(boolean mutable, Type referent) {
            if (referent.isReference()) {
                throw new IllegalArgumentException("reference to reference: " + referent);
            }
            this.mutable = mutable;
            this.referent = referent;
        }

        public Type getReferent() {
            return referent;
        }

        @Override
        public boolean isReference() {
            return true;
        }

        @Override
        public boolean isMutableReference() {
            return mutable;
        }

        @Override
        public String display(TypeDisplayContext ctx) {
            return (mutable ? "&mut " : "&") + referent.display(ctx);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Reference)) return false;
            Reference that = (Reference) o;
            return mutable == that.mutable && referent.equals(that.referent);
        }

        @Override
        public int hashCode() {
            return 31 * referent.hashCode() + (mutable ? 2 : 3);
        }

        @Override
        public String toString() {
            return (mutable ? "&mut " : "&") + referent;
        }
    }

    public static final class Tuple extends Type {
        private final List<Type> elements;

        private Tuple(List<Type> elements) {
            this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
        }

        public List<Type> getElements() {
            return elements;
        }

        @Override
        public String display(TypeDisplayContext ctx) {
            return elements.stream().map(it -> it.display(ctx)).collect(Collectors.joining(", ", "(", ")"));
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Tuple && ((Tuple) o).elements.equals(elements);
        }

        @Override
        public int hashCode() {
            return elements.hashCode();
        }

        @Override
        public String toString() {
            return elements.toString();
        }
    }
}
