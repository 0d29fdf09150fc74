package io.github.eutro.stackless.bytecode;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

/**
 * A constant loaded by a {@link Bytecode.Load}.
 */
public final class Constant {
    public enum Kind {
        BOOL,
        U8,
        U64,
        U128,
        ADDRESS,
        BYTE_ARRAY,
    }

    private final Kind kind;
    private final Object value;

    private Constant(Kind kind, Object value) {
        this.kind = kind;
        this.value = value;
    }

    public static Constant bool(boolean b) {
        return new Constant(Kind.BOOL, b);
    }

    public static Constant u8(int v) {
        if (v < 0 || v > 0xFF) throw new IllegalArgumentException("u8 out of range: " + v);
        return new Constant(Kind.U8, BigInteger.valueOf(v));
    }

    public static Constant u64(long v) {
        if (v < 0) throw new IllegalArgumentException("u64 out of range: " + v);
        return new Constant(Kind.U64, BigInteger.valueOf(v));
    }

    public static Constant u128(BigInteger v) {
        if (v.signum() < 0 || v.bitLength() > 128) throw new IllegalArgumentException("u128 out of range: " + v);
        return new Constant(Kind.U128, v);
    }

    public static Constant address(BigInteger v) {
        if (v.signum() < 0) throw new IllegalArgumentException("negative address: " + v);
        return new Constant(Kind.ADDRESS, v);
    }

    public static Constant byteArray(byte... bytes) {
        return new Constant(Kind.BYTE_ARRAY, bytes.clone());
    }

    public Kind getKind() {
        return kind;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Constant)) return false;
        Constant that = (Constant) o;
        if (kind != that.kind) return false;
        if (kind == Kind.BYTE_ARRAY) return Arrays.equals((byte[]) value, (byte[]) that.value);
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return kind == Kind.BYTE_ARRAY
                ? Arrays.hashCode((byte[]) value)
                : Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        switch (kind) {
            case ADDRESS:
                return "0x" + ((BigInteger) value).toString(16);
            case BYTE_ARRAY: {
                StringBuilder sb = new StringBuilder("[");
                byte[] bytes = (byte[]) value;
                for (int i = 0; i < bytes.length; i++) {
                    if (i > 0) sb.append(", ");
                    sb.append(bytes[i] & 0xFF);
                }
                return sb.append(']').toString();
            }
            default:
                return value.toString();
        }
    }
}
