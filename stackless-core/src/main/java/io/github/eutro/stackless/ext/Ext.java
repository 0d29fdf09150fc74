package io.github.eutro.stackless.ext;

import org.jetbrains.annotations.NotNull;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A key, naming one kind of data (of type {@code T}) that can be stored
 * in an {@link ExtContainer}.
 * <p>
 * Exts are ordered by creation. Containers iterate in this order, so anything
 * derived from iterating a container is deterministic within one program execution.
 *
 * @param <T> The type of the ext.
 */
public final class Ext<T> implements Comparable<Ext<?>> {
    private static final AtomicInteger ID_COUNTER = new AtomicInteger(0);

    private final Class<? super T> type;
    private final int id = ID_COUNTER.getAndIncrement();
    private final String name;

    private Ext(Class<? super T> type, String name) {
        this.type = type;
        this.name = name;
    }

    /**
     * Creates a new ext, whose values are instances of the given class.
     * <p>
     * {@code T} may be a parameterised subtype of {@code type}, which is why it is declared
     * separately. Values are checked against {@code type} when attached, so only the
     * erasure is verified.
     *
     * @param type The class of the values of the ext.
     * @param name The name of the ext, for debugging.
     * @param <T>  The type of the ext.
     * @return The new ext.
     */
    public static <T> Ext<T> create(Class<? super T> type, String name) {
        return new Ext<>(type, name);
    }

    public String getName() {
        return name;
    }

    /**
     * Check that a value may be associated with this ext.
     *
     * @param value The value.
     * @return The value.
     * @throws ClassCastException If the value is not an instance of this ext's class.
     */
    @SuppressWarnings("unchecked")
    public T cast(Object value) {
        return (T) type.cast(value);
    }

    /**
     * Get the association of this in the given container.
     *
     * @param ec The container.
     * @return The association.
     * @see ExtContainer#getExt(Ext)
     */
    public Optional<T> getIn(ExtContainer ec) {
        return ec.getExt(this);
    }

    @Override
    public int compareTo(@NotNull Ext<?> o) {
        return Integer.compare(id, o.id);
    }

    @Override
    public int hashCode() {
        return id;
    }

    @Override
    public String toString() {
        return name + ": " + type.getName();
    }
}
