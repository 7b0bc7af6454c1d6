package io.kvstore.core.storage;

import io.kvstore.core.codec.KeyCodec;
import io.kvstore.core.codec.Raw;
import io.kvstore.core.codec.ValueCodec;

/**
 * One key/value pair produced by an {@link Iter}. Nothing is decoded until
 * {@link #key()} or {@link #value()} is called, and each decodes on its own,
 * so a key-only scan never pays for value decoding.
 */
public final class Item<K, V> {
    private final byte[] key;
    private final byte[] value;
    private final KeyCodec<K> keyCodec;
    private final ValueCodec<V> valueCodec;

    Item(byte[] key, byte[] value, KeyCodec<K> keyCodec, ValueCodec<V> valueCodec) {
        this.key = key;
        this.value = value;
        this.keyCodec = keyCodec;
        this.valueCodec = valueCodec;
    }

    /** @throws io.kvstore.core.error.DecodeException if the stored key is not a valid {@code K} */
    public K key() {
        return keyCodec.fromBytes(key.clone());
    }

    /** @throws io.kvstore.core.error.DecodeException if the stored value is not a valid {@code V} */
    public V value() {
        return valueCodec.fromBytes(value.clone());
    }

    public Raw rawKey() {
        return Raw.of(key);
    }

    public Raw rawValue() {
        return Raw.of(value);
    }

    @Override
    public String toString() {
        return "Item{key=" + rawKey() + ", value=" + rawValue() + "}";
    }
}
