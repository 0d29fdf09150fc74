package io.github.eutro.stackless.target;

import io.github.eutro.stackless.annotations.AnnotationFormatters;
import io.github.eutro.stackless.bytecode.AttrId;
import io.github.eutro.stackless.bytecode.Bytecode;
import io.github.eutro.stackless.bytecode.SpecBlockId;
import io.github.eutro.stackless.display.FunctionTargetDisplay;
import io.github.eutro.stackless.env.*;

import java.util.*;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;

/**
 * A view of a function at one stage of the pipeline, combining what the source declares
 * about it ({@link FunctionEnv}) with its current {@link FunctionTargetData snapshot}.
 * <p>
 * A target is created for one snapshot, used by one pass or one rendering, then dropped.
 * Nothing in it can change the snapshot. The only state of its own is the list of
 * {@link AnnotationFormatter}s used when it is rendered.
 */
public final class FunctionTarget {
    private final FunctionEnv fun;
    private final FunctionTargetData data;
    private final Map<Symbol, Integer> nameToIndex = new HashMap<>();
    private final List<AnnotationFormatter> formatters = new ArrayList<>();

    /**
     * Bind a snapshot to its function.
     *
     * @param fun  The function.
     * @param data The snapshot.
     * @throws IllegalArgumentException If the snapshot was not made for a function of this shape.
     * @throws IllegalStateException    If a generated local name is also the name of another local.
     */
    public FunctionTarget(FunctionEnv fun, FunctionTargetData data) {
        this.fun = Objects.requireNonNull(fun);
        this.data = Objects.requireNonNull(data);
        if (data.getParameterCount() != fun.getParameterCount()
                || data.getLocalTypes().size() < fun.getLocalCount()) {
            throw new IllegalArgumentException("snapshot does not belong to " + fun.getFullName());
        }
        for (int i = 0; i < getLocalCount(); i++) {
            Symbol name = getLocalName(i);
            Integer prev = nameToIndex.putIfAbsent(name, i);
            // source names may repeat, in which case the first declaration wins
            if (prev != null && (!isDeclaredName(prev) || !isDeclaredName(i))) {
                throw new IllegalStateException(String.format(
                        "local %d of %s is named %s, which is already the name of local %d",
                        i, fun.getFullName(), name.display(symbolPool()), prev
                ));
            }
        }
    }

    private boolean isDeclaredName(int idx) {
        return idx < getUserLocalCount() && fun.hasDeclaredName(idx);
    }

    public FunctionEnv getFunctionEnv() {
        return fun;
    }

    public FunctionTargetData getData() {
        return data;
    }

    public Symbol getName() {
        return fun.getName();
    }

    public FunId getId() {
        return fun.getId();
    }

    public String getFullName() {
        return fun.getFullName();
    }

    public ModuleEnv getModule() {
        return fun.getModule();
    }

    public GlobalEnv globalEnv() {
        return fun.getEnv();
    }

    public SymbolPool symbolPool() {
        return fun.symbolPool();
    }

    public Loc getLoc() {
        return fun.getLoc();
    }

    /**
     * Get the source location of an instruction, or of the whole function if the
     * instruction has none.
     *
     * @param attrId The instruction's attribute id.
     * @return The location.
     */
    public Loc getBytecodeLoc(AttrId attrId) {
        Loc loc = data.getLocations().get(attrId);
        return loc == null ? getLoc() : loc;
    }

    public boolean isNative() {
        return fun.isNative();
    }

    public boolean isPublic() {
        return fun.isPublic();
    }

    public boolean isMutating() {
        return fun.isMutating();
    }

    public List<TypeParameter> getTypeParameters() {
        return fun.getTypeParameters();
    }

    public int getParameterCount() {
        return fun.getParameterCount();
    }

    /**
     * Get the number of locals, including parameters and any locals added by transformations.
     *
     * @return The local count.
     */
    public int getLocalCount() {
        return data.getLocalTypes().size();
    }

    /**
     * Get the number of locals declared in the source, including parameters.
     *
     * @return The user local count.
     */
    public int getUserLocalCount() {
        return fun.getLocalCount();
    }

    public Type getLocalType(int idx) {
        checkLocal(idx);
        return data.getLocalTypes().get(idx);
    }

    public List<Type> getLocalTypes() {
        return data.getLocalTypes();
    }

    /**
     * Get the name of a local: its source name if it has one, or a generated name.
     *
     * @param idx The local index.
     * @return The name.
     * @throws IndexOutOfBoundsException If there is no such local.
     */
    public Symbol getLocalName(int idx) {
        checkLocal(idx);
        if (idx < getUserLocalCount()) return fun.getLocalName(idx);
        return symbolPool().make(FunctionEnv.generatedLocalName(idx));
    }

    public String displayLocal(int idx) {
        return getLocalName(idx).display(symbolPool());
    }

    public Optional<Integer> getLocalIndex(Symbol name) {
        return Optional.ofNullable(nameToIndex.get(name));
    }

    public Optional<Integer> getLocalIndex(String name) {
        return getLocalIndex(symbolPool().make(name));
    }

    private void checkLocal(int idx) {
        if (idx < 0 || idx >= getLocalCount()) {
            throw new IndexOutOfBoundsException("local " + idx + " out of range for "
                    + getLocalCount() + " locals of " + getFullName());
        }
    }

    public Type getReturnType(int idx) {
        if (idx < 0 || idx >= getReturnCount()) {
            throw new IndexOutOfBoundsException("return " + idx + " out of range for "
                    + getReturnCount() + " return values of " + getFullName());
        }
        return data.getReturnTypes().get(idx);
    }

    public List<Type> getReturnTypes() {
        return data.getReturnTypes();
    }

    public int getReturnCount() {
        return data.getReturnTypes().size();
    }

    public Spec getSpec() {
        return fun.getSpec();
    }

    /**
     * Get the spec of a spec block in this target's code.
     *
     * @param blockId The block id.
     * @return The spec.
     * @throws SpecBlockNotFoundException If the snapshot has no such block.
     */
    public Spec getSpecOnImpl(SpecBlockId blockId) {
        return SpecBlockResolver.resolve(fun, data, blockId);
    }

    public boolean isPragmaTrue(String name, BooleanSupplier dflt) {
        return fun.isPragmaTrue(name, dflt);
    }

    public List<Bytecode> getBytecode() {
        return data.getCode();
    }

    public Annotations getAnnotations() {
        return data.getAnnotations();
    }

    public List<StructId> getAcquiresGlobalResources() {
        return data.getAcquiresGlobalResources();
    }

    /**
     * Get the return value which carries the final value of a {@code &mut} parameter.
     *
     * @param paramIdx The parameter index.
     * @return The return index, if the parameter has been mapped to one.
     */
    public Optional<Integer> getReturnIndex(int paramIdx) {
        return Optional.ofNullable(data.getRefParamMap().get(paramIdx));
    }

    /**
     * Whether a call to this function ends the lifetime of the references passed to it.
     * <p>
     * This holds for public functions that return no references, since then nothing
     * the caller gets back can still borrow from the arguments.
     *
     * @return True if the call ends the lifetime of its reference arguments.
     */
    public boolean callEndsLifetime() {
        if (!isPublic()) return false;
        for (Type type : getReturnTypes()) {
            if (type.isReference()) return false;
        }
        return true;
    }

    public TypeDisplayContext typeDisplayContext() {
        return TypeDisplayContext.withEnv(globalEnv())
                .withTypeParamNames(getTypeParameters()
                        .stream()
                        .map(TypeParameter::getName)
                        .collect(Collectors.toList()));
    }

    /**
     * Add a formatter to use when rendering this target. Formatters print in the order
     * they are registered, and a formatter registered twice prints twice.
     *
     * @param formatter The formatter.
     */
    public void registerAnnotationFormatter(AnnotationFormatter formatter) {
        formatters.add(Objects.requireNonNull(formatter));
    }

    /**
     * Register the formatters of all annotation kinds, as tests expect them.
     *
     * @see AnnotationFormatters#registerForTest(FunctionTarget)
     */
    public void registerAnnotationFormattersForTest() {
        AnnotationFormatters.registerForTest(this);
    }

    public List<AnnotationFormatter> getAnnotationFormatters() {
        return Collections.unmodifiableList(formatters);
    }

    @Override
    public String toString() {
        return FunctionTargetDisplay.display(this);
    }
}
