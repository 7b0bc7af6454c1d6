package io.kvstore.core.storage.engine;

import java.util.Arrays;
import java.util.Objects;

/**
 * One step of an atomic multi-key write: put a value, delete a key, or
 * delete every key in {@code [key, value)}. For a range delete the
 * {@code value} slot carries the exclusive upper bound.
 */
public record WriteOp(Kind kind, byte[] key, byte[] value) {

    public enum Kind { PUT, DELETE, DELETE_RANGE }

    public WriteOp {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(key, "key");
        switch (kind) {
            case PUT:
                Objects.requireNonNull(value, "value");
                break;
            case DELETE_RANGE:
                Objects.requireNonNull(value, "toExclusive");
                if (Arrays.compareUnsigned(key, value) > 0) {
                    throw new IllegalArgumentException("range start after its end");
                }
                break;
            default:
                if (value != null) {
                    throw new IllegalArgumentException("delete carries no value");
                }
        }
    }

    public static WriteOp put(byte[] key, byte[] value) {
        return new WriteOp(Kind.PUT, key, value);
    }

    public static WriteOp delete(byte[] key) {
        return new WriteOp(Kind.DELETE, key, null);
    }

    public static WriteOp deleteRange(byte[] from, byte[] toExclusive) {
        return new WriteOp(Kind.DELETE_RANGE, from, toExclusive);
    }

    public boolean isPut() {
        return kind == Kind.PUT;
    }
}
