package io.kvstore.core.codec;

import io.kvstore.core.error.DecodeException;

/**
 * Converts a typed value to raw bytes and back.
 * Encoding is deterministic: equal values always produce equal bytes, and
 * {@code fromBytes(toBytes(v))} equals {@code v}.
 */
public interface Codec<T> {

    byte[] toBytes(T value);

    /** @throws DecodeException if {@code bytes} is not a valid encoding for {@code T} */
    T fromBytes(byte[] bytes);
}
