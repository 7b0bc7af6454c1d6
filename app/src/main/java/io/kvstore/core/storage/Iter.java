package io.kvstore.core.storage;

import io.kvstore.core.codec.KeyCodec;
import io.kvstore.core.codec.ValueCodec;
import io.kvstore.core.storage.engine.RawCursor;
import io.kvstore.core.storage.engine.RawEntry;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Lazy ordered pass over (part of) a bucket, in encoded-key byte order.
 *
 * The view is a snapshot taken when the iterator is created: writes made
 * afterwards, by anyone, are not observed. An iterator runs once; call
 * {@link Bucket#iter()} again for a fresh pass. Engine resources are
 * released when the iterator is exhausted or closed.
 */
public final class Iter<K, V> implements Iterator<Item<K, V>>, AutoCloseable {
    private final RawCursor cursor;
    private final Subspace subspace;
    private final KeyCodec<K> keyCodec;
    private final ValueCodec<V> valueCodec;

    Iter(RawCursor cursor, Subspace subspace, KeyCodec<K> keyCodec, ValueCodec<V> valueCodec) {
        this.cursor = cursor;
        this.subspace = subspace;
        this.keyCodec = keyCodec;
        this.valueCodec = valueCodec;
    }

    @Override
    public boolean hasNext() {
        return cursor.hasNext();
    }

    @Override
    public Item<K, V> next() {
        if (!cursor.hasNext()) {
            throw new NoSuchElementException();
        }
        RawEntry entry = cursor.next();
        return new Item<>(subspace.unpack(entry.key()), entry.value(), keyCodec, valueCodec);
    }

    @Override
    public void close() {
        cursor.close();
    }
}
