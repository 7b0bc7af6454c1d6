package io.kvstore.core.storage;

import io.kvstore.core.codec.KeyCodec;
import io.kvstore.core.codec.ValueCodec;
import io.kvstore.core.metrics.StoreMetrics;
import io.kvstore.core.storage.engine.RawCursor;
import io.kvstore.core.storage.engine.StorageEngine;
import io.kvstore.core.storage.engine.WriteOp;
import io.kvstore.core.transaction.BucketTransactionBody;
import io.kvstore.core.transaction.TransactionBucket;
import io.kvstore.core.transaction.TransactionResult;
import io.kvstore.core.transaction.TransactionStep;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Typed view of one subspace of a {@link Store}.
 *
 * Keys go through {@code K}'s codec, values through {@code V}'s, and every
 * call maps onto raw engine operations under the bucket's prefix. Writes are
 * passed straight to the engine. A bucket holds no lock and no data; any
 * number of handles over the same name may be used concurrently.
 *
 * Engine failures surface as {@link io.kvstore.core.error.EngineException},
 * stored data that does not decode as {@link io.kvstore.core.error.DecodeException}.
 */
public final class Bucket<K, V> {
    private final Store store;
    private final Subspace subspace;
    private final KeyCodec<K> keyCodec;
    private final ValueCodec<V> valueCodec;

    Bucket(Store store, Subspace subspace, KeyCodec<K> keyCodec, ValueCodec<V> valueCodec) {
        this.store = store;
        this.subspace = subspace;
        this.keyCodec = keyCodec;
        this.valueCodec = valueCodec;
    }

    public Optional<V> get(K key) {
        return decode(engine().get(pack(key)));
    }

    /**
     * Stores {@code value} and returns the value it replaced. If the replaced
     * bytes do not decode, the write has still happened and the
     * {@link io.kvstore.core.error.DecodeException} reports the old contents.
     */
    public Optional<V> set(K key, V value) {
        Objects.requireNonNull(value, "value");
        return decode(engine().swap(pack(key), valueCodec.toBytes(value)));
    }

    /** Deletes {@code key} and returns the value it held. */
    public Optional<V> remove(K key) {
        return decode(engine().swap(pack(key), null));
    }

    public boolean contains(K key) {
        return engine().get(pack(key)) != null;
    }

    /** Every entry in ascending key order. */
    public Iter<K, V> iter() {
        return open(subspace.start(), subspace.end(), false);
    }

    /** Entries with {@code from <= key < to}, ascending. */
    public Iter<K, V> iterRange(K from, K to) {
        return open(pack(from), pack(to), false);
    }

    /** Entries whose encoded key starts with the encoding of {@code prefix}, ascending. */
    public Iter<K, V> iterPrefix(K prefix) {
        byte[] start = pack(prefix);
        byte[] end = Subspace.successor(start);
        return open(start, end == null ? subspace.end() : end, false);
    }

    public Optional<Item<K, V>> first() {
        return edge(false);
    }

    public Optional<Item<K, V>> last() {
        return edge(true);
    }

    /** Number of entries; walks the whole bucket. */
    public long len() {
        long n = 0;
        try (RawCursor cursor = engine().scan(subspace.start(), subspace.end(), false)) {
            while (cursor.hasNext()) {
                cursor.next();
                n++;
            }
        }
        return n;
    }

    public boolean isEmpty() {
        try (RawCursor cursor = engine().scan(subspace.start(), subspace.end(), false)) {
            return !cursor.hasNext();
        }
    }

    /** Removes every entry in one atomic range delete. */
    public void clear() {
        engine().deleteRange(subspace.start(), subspace.end());
    }

    public Batch<K, V> batch() {
        return new Batch<>(keyCodec, valueCodec);
    }

    /** Applies every operation of {@code batch}, in order, as one atomic write. */
    public void apply(Batch<K, V> batch) {
        List<WriteOp> ops = batch.operations();
        if (ops.isEmpty()) {
            return;
        }
        List<WriteOp> packed = new ArrayList<>(ops.size());
        for (WriteOp op : ops) {
            packed.add(op.isPut()
                    ? WriteOp.put(subspace.pack(op.key()), op.value())
                    : WriteOp.delete(subspace.pack(op.key())));
        }
        engine().write(packed);
        StoreMetrics.recordBatch(packed.size());
    }

    /**
     * Replaces the value under {@code key} only if it currently equals
     * {@code expected} (empty meaning absent). An empty {@code replacement}
     * deletes the key.
     *
     * @return whether the swap happened
     */
    public boolean compareAndSwap(K key, Optional<V> expected, Optional<V> replacement) {
        Objects.requireNonNull(expected, "expected");
        Objects.requireNonNull(replacement, "replacement");
        TransactionResult<Boolean> result = transaction(b -> {
            if (!sameEncoding(b.get(key), expected)) {
                return TransactionStep.commit(false);
            }
            if (replacement.isPresent()) {
                b.set(key, replacement.get());
            } else {
                b.remove(key);
            }
            return TransactionStep.commit(true);
        });
        return Boolean.TRUE.equals(result.orElseThrow());
    }

    /** Runs {@code body} in a transaction scoped to this bucket. */
    public <R> TransactionResult<R> transaction(BucketTransactionBody<K, V, R> body) {
        Objects.requireNonNull(body, "body");
        return store.transaction(tx -> {
            TransactionBucket<K, V> b = tx.bucket(this);
            return body.run(b);
        });
    }

    public void flush() {
        engine().flush();
    }

    public Optional<String> name() {
        return subspace.name();
    }

    public Store store() {
        return store;
    }

    public Subspace subspace() {
        return subspace;
    }

    public KeyCodec<K> keyCodec() {
        return keyCodec;
    }

    public ValueCodec<V> valueCodec() {
        return valueCodec;
    }

    private StorageEngine engine() {
        return store.engine();
    }

    private byte[] pack(K key) {
        Objects.requireNonNull(key, "key");
        return subspace.pack(keyCodec.toBytes(key));
    }

    private Optional<V> decode(byte[] raw) {
        return raw == null ? Optional.empty() : Optional.of(valueCodec.fromBytes(raw));
    }

    private Iter<K, V> open(byte[] from, byte[] to, boolean reverse) {
        return new Iter<>(engine().scan(from, to, reverse), subspace, keyCodec, valueCodec);
    }

    private Optional<Item<K, V>> edge(boolean reverse) {
        try (Iter<K, V> it = open(subspace.start(), subspace.end(), reverse)) {
            return it.hasNext() ? Optional.of(it.next()) : Optional.empty();
        }
    }

    private boolean sameEncoding(Optional<V> a, Optional<V> b) {
        if (a.isEmpty() || b.isEmpty()) {
            return a.isEmpty() && b.isEmpty();
        }
        return Arrays.equals(valueCodec.toBytes(a.get()), valueCodec.toBytes(b.get()));
    }

    @Override
    public String toString() {
        return "Bucket[" + subspace.name().orElse("<default>") + "]";
    }
}
