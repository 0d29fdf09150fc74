package io.github.eutro.stackless.ext;

import org.jetbrains.annotations.Nullable;

import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;

/**
 * A container for {@link Ext}s. See the {@link io.github.eutro.stackless.ext package-level documentation} for more info.
 */
public interface ExtContainer {
    /**
     * Associate {@code ext} with {@code value} in this container, replacing any previous value.
     *
     * @param ext   The ext.
     * @param value The value the ext has in this container.
     * @param <T>   The type of the ext.
     */
    <T> void attachExt(Ext<T> ext, T value);

    /**
     * Disassociate the value of {@code ext} (if any) in this container.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     */
    <T> void removeExt(Ext<T> ext);

    /**
     * Get the value associated with {@code ext} in this container, or null if not present.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     * @return The value associated with ext in this container.
     */
    <T> @Nullable T getNullable(Ext<T> ext);

    /**
     * Get the exts which currently have a value in this container, in ext order.
     *
     * @return The exts.
     */
    Set<Ext<?>> attachedExts();

    /**
     * Get the value associated with {@code ext} in this container, if any.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     * @return The value associated with the ext in this container.
     * @see #getNullable(Ext)
     */
    default <T> Optional<T> getExt(Ext<T> ext) {
        return Optional.ofNullable(getNullable(ext));
    }

    /**
     * Get the value associated with {@code ext} in this container, or throw an exception if not present.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     * @return The value associated with the ext in this container.
     * @throws NoSuchElementException If the ext is not present.
     */
    default <T> T getExtOrThrow(Ext<T> ext) {
        T nullable = getNullable(ext);
        if (nullable != null) return nullable;
        throw new NoSuchElementException("Ext not present: " + ext.getName());
    }

    /**
     * Copy the value of {@code ext} from another container into this one, if it has one there.
     *
     * @param from The container to copy from.
     * @param ext  The ext.
     * @param <T>  The type of the ext.
     * @return Whether a value was copied.
     */
    default <T> boolean copyExt(ExtContainer from, Ext<T> ext) {
        T value = from.getNullable(ext);
        if (value == null) return false;
        attachExt(ext, value);
        return true;
    }
}
