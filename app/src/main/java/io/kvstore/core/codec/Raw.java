package io.kvstore.core.codec;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable byte string. Equality is by content and ordering is unsigned
 * bytewise, the same order the engine keeps keys in.
 */
public final class Raw implements Comparable<Raw> {
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private final byte[] bytes;
    private final int hash; // cache hashCode

    private Raw(byte[] bytes) {
        this.bytes = bytes;
        this.hash = Arrays.hashCode(bytes);
    }

    public static Raw of(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        return new Raw(bytes.clone());
    }

    /** UTF-8 bytes of {@code text}. */
    public static Raw of(String text) {
        Objects.requireNonNull(text, "text");
        return new Raw(text.getBytes(StandardCharsets.UTF_8));
    }

    static Raw wrap(byte[] bytes) {
        return new Raw(bytes);
    }

    public byte[] bytes() {
        return bytes.clone();
    }

    public int length() {
        return bytes.length;
    }

    public boolean startsWith(Raw prefix) {
        if (prefix.bytes.length > bytes.length) {
            return false;
        }
        return Arrays.equals(bytes, 0, prefix.bytes.length, prefix.bytes, 0, prefix.bytes.length);
    }

    /** Decode as UTF-8, replacing malformed input. */
    public String asString() {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    public String toHex() {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(HEX[(b >> 4) & 0x0f]).append(HEX[b & 0x0f]);
        }
        return sb.toString();
    }

    @Override
    public int compareTo(Raw other) {
        return Arrays.compareUnsigned(bytes, other.bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Raw)) return false;
        return Arrays.equals(bytes, ((Raw) o).bytes);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return "Raw[" + toHex() + "]";
    }
}
