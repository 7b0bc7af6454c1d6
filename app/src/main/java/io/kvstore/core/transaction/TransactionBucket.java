package io.kvstore.core.transaction;

import io.kvstore.core.storage.Bucket;

import java.util.Objects;
import java.util.Optional;

/** Typed view of a bucket inside a running {@link Transaction}. */
public final class TransactionBucket<K, V> {
    private final Transaction tx;
    private final Bucket<K, V> bucket;

    TransactionBucket(Transaction tx, Bucket<K, V> bucket) {
        this.tx = tx;
        this.bucket = bucket;
    }

    public Optional<V> get(K key) {
        return decode(tx.get(pack(key)));
    }

    /** Writes {@code value} and returns the previous value, if any. */
    public Optional<V> set(K key, V value) {
        Objects.requireNonNull(value, "value");
        byte[] packed = pack(key);
        Optional<V> previous = decode(tx.get(packed));
        tx.put(packed, bucket.valueCodec().toBytes(value));
        return previous;
    }

    /** Deletes {@code key} and returns the previous value, if any. */
    public Optional<V> remove(K key) {
        byte[] packed = pack(key);
        byte[] raw = tx.get(packed);
        Optional<V> previous = decode(raw);
        if (raw != null) {
            tx.delete(packed);
        }
        return previous;
    }

    public boolean contains(K key) {
        return tx.get(pack(key)) != null;
    }

    public Bucket<K, V> bucket() {
        return bucket;
    }

    private byte[] pack(K key) {
        Objects.requireNonNull(key, "key");
        return bucket.subspace().pack(bucket.keyCodec().toBytes(key));
    }

    private Optional<V> decode(byte[] raw) {
        return raw == null ? Optional.empty() : Optional.of(bucket.valueCodec().fromBytes(raw));
    }
}
