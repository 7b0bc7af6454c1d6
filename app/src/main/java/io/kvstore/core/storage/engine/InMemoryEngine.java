package io.kvstore.core.storage.engine;

import io.kvstore.core.error.ConflictException;
import io.kvstore.core.error.EngineException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NoSuchElementException;
import java.util.TreeMap;

/**
 * Simple in-memory engine.
 * Good for tests and throw-away stores; nothing survives {@link #close()}.
 *
 * Every write bumps a global sequence number and stamps the written keys with
 * it. Transactions remember the stamp of each key they touch and refuse to
 * commit if any stamp moved, which is how the RocksDB optimistic engine
 * behaves as well.
 */
public final class InMemoryEngine implements StorageEngine {

    /** Marks a key deleted inside a transaction's write set. */
    private static final byte[] TOMBSTONE = new byte[0];

    private final TreeMap<byte[], byte[]> data = new TreeMap<>(Arrays::compareUnsigned);

    /** Map: key -> sequence of its last write (kept after deletes) */
    private final TreeMap<byte[], Long> stamps = new TreeMap<>(Arrays::compareUnsigned);

    private long sequence;
    private boolean closed;

    @Override
    public synchronized byte[] get(byte[] key) {
        ensureOpen();
        return copy(data.get(key));
    }

    @Override
    public synchronized byte[] swap(byte[] key, byte[] value) {
        ensureOpen();
        byte[] previous = data.get(key);
        apply(key, value == null ? null : value.clone(), ++sequence);
        return copy(previous);
    }

    @Override
    public synchronized void write(List<WriteOp> ops) {
        ensureOpen();
        long seq = ++sequence;
        for (WriteOp op : ops) {
            switch (op.kind()) {
                case PUT:
                    apply(op.key(), op.value().clone(), seq);
                    break;
                case DELETE:
                    apply(op.key(), null, seq);
                    break;
                case DELETE_RANGE:
                    removeRange(op.key(), op.value(), seq);
                    break;
                default:
                    throw new IllegalStateException("Unknown write " + op.kind());
            }
        }
    }

    @Override
    public synchronized void deleteRange(byte[] from, byte[] toExclusive) {
        write(List.of(WriteOp.deleteRange(from, toExclusive)));
    }

    @Override
    public synchronized RawCursor scan(byte[] from, byte[] toExclusive, boolean reverse) {
        ensureOpen();
        NavigableMap<byte[], byte[]> range;
        if (from != null && toExclusive != null) {
            if (Arrays.compareUnsigned(from, toExclusive) >= 0) {
                return new ListCursor(Collections.emptyList());
            }
            range = data.subMap(from, true, toExclusive, false);
        } else if (from != null) {
            range = data.tailMap(from, true);
        } else if (toExclusive != null) {
            range = data.headMap(toExclusive, false);
        } else {
            range = data;
        }
        if (reverse) {
            range = range.descendingMap();
        }
        // copy so later writes do not show up in an open cursor
        List<RawEntry> snapshot = new ArrayList<>(range.size());
        for (Map.Entry<byte[], byte[]> e : range.entrySet()) {
            snapshot.add(new RawEntry(e.getKey().clone(), e.getValue().clone()));
        }
        return new ListCursor(snapshot);
    }

    @Override
    public synchronized EngineTransaction beginTransaction() {
        ensureOpen();
        return new InMemoryTransaction();
    }

    @Override
    public void flush() {
        // nothing buffered
    }

    @Override
    public synchronized void close() {
        closed = true;
        data.clear();
        stamps.clear();
    }

    /** Number of live keys (debug/tests). */
    public synchronized int size() {
        return data.size();
    }

    private void apply(byte[] key, byte[] value, long seq) {
        byte[] k = key.clone();
        if (value == null) {
            data.remove(k);
        } else {
            data.put(k, value);
        }
        stamps.put(k, seq);
    }

    private void removeRange(byte[] from, byte[] toExclusive, long seq) {
        NavigableMap<byte[], byte[]> range = data.subMap(from, true, toExclusive, false);
        for (byte[] key : range.keySet()) {
            stamps.put(key, seq);
        }
        range.clear();
    }

    private long stampOf(byte[] key) {
        Long s = stamps.get(key);
        return s == null ? 0L : s;
    }

    private void ensureOpen() {
        if (closed) {
            throw new EngineException("Engine is closed");
        }
    }

    private static byte[] copy(byte[] value) {
        return value == null ? null : value.clone();
    }

    private final class InMemoryTransaction implements EngineTransaction {
        private final TreeMap<byte[], byte[]> writes = new TreeMap<>(Arrays::compareUnsigned);
        private final TreeMap<byte[], Long> seen = new TreeMap<>(Arrays::compareUnsigned);
        private boolean finished;

        @Override
        public byte[] get(byte[] key) {
            ensureActive();
            byte[] pending = writes.get(key);
            if (pending != null) {
                return pending == TOMBSTONE ? null : pending.clone();
            }
            synchronized (InMemoryEngine.this) {
                ensureOpen();
                track(key);
                return copy(data.get(key));
            }
        }

        @Override
        public void put(byte[] key, byte[] value) {
            ensureActive();
            trackLocked(key);
            writes.put(key.clone(), value.clone());
        }

        @Override
        public void delete(byte[] key) {
            ensureActive();
            trackLocked(key);
            writes.put(key.clone(), TOMBSTONE);
        }

        @Override
        public void commit() {
            ensureActive();
            synchronized (InMemoryEngine.this) {
                ensureOpen();
                for (Map.Entry<byte[], Long> e : seen.entrySet()) {
                    if (stampOf(e.getKey()) != e.getValue()) {
                        throw new ConflictException("Write conflict: a key read by this transaction was changed");
                    }
                }
                if (!writes.isEmpty()) {
                    long seq = ++sequence;
                    for (Map.Entry<byte[], byte[]> e : writes.entrySet()) {
                        byte[] value = e.getValue();
                        apply(e.getKey(), value == TOMBSTONE ? null : value, seq);
                    }
                }
            }
            finished = true;
        }

        @Override
        public void rollback() {
            writes.clear();
            seen.clear();
            finished = true;
        }

        @Override
        public void close() {
            if (!finished) {
                rollback();
            }
        }

        private void track(byte[] key) {
            if (!seen.containsKey(key)) {
                seen.put(key.clone(), stampOf(key));
            }
        }

        private void trackLocked(byte[] key) {
            synchronized (InMemoryEngine.this) {
                track(key);
            }
        }

        private void ensureActive() {
            if (finished) {
                throw new IllegalStateException("Transaction already finished");
            }
        }
    }

    private static final class ListCursor implements RawCursor {
        private final Iterator<RawEntry> it;

        ListCursor(List<RawEntry> entries) {
            this.it = entries.iterator();
        }

        @Override
        public boolean hasNext() {
            return it.hasNext();
        }

        @Override
        public RawEntry next() {
            if (!it.hasNext()) {
                throw new NoSuchElementException();
            }
            return it.next();
        }

        @Override
        public void close() {
            // nothing to release
        }
    }
}
