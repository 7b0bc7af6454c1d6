package io.kvstore.core.storage;

import io.kvstore.core.codec.KeyCodec;
import io.kvstore.core.codec.ValueCodec;
import io.kvstore.core.storage.engine.WriteOp;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Pending writes for one bucket, applied all-or-nothing by
 * {@link Bucket#apply(Batch)}. Keys and values are encoded as they are
 * added; nothing reaches the store before the batch is applied. When the
 * same key appears more than once the last operation wins.
 */
public final class Batch<K, V> {
    private final KeyCodec<K> keyCodec;
    private final ValueCodec<V> valueCodec;
    private final List<WriteOp> ops = new ArrayList<>();

    public Batch(KeyCodec<K> keyCodec, ValueCodec<V> valueCodec) {
        this.keyCodec = Objects.requireNonNull(keyCodec, "keyCodec");
        this.valueCodec = Objects.requireNonNull(valueCodec, "valueCodec");
    }

    public Batch<K, V> set(K key, V value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        ops.add(WriteOp.put(keyCodec.toBytes(key), valueCodec.toBytes(value)));
        return this;
    }

    public Batch<K, V> remove(K key) {
        Objects.requireNonNull(key, "key");
        ops.add(WriteOp.delete(keyCodec.toBytes(key)));
        return this;
    }

    public int size() {
        return ops.size();
    }

    public boolean isEmpty() {
        return ops.isEmpty();
    }

    public void clear() {
        ops.clear();
    }

    /** Operations in submission order, keys relative to the bucket. */
    List<WriteOp> operations() {
        return Collections.unmodifiableList(ops);
    }
}
