package io.kvstore.core.storage.engine;

import java.util.List;

/**
 * An ordered store of raw byte keys to raw byte values. Keys sort unsigned
 * bytewise. Every method may throw {@link io.kvstore.core.error.EngineException}.
 */
public interface StorageEngine extends AutoCloseable {

    /** Point lookup; {@code null} if absent. */
    byte[] get(byte[] key);

    /**
     * Atomically replaces the value under {@code key} ({@code null} deletes it)
     * and returns what was there before, or {@code null}.
     */
    byte[] swap(byte[] key, byte[] value);

    /** Applies all operations in order as one atomic write. */
    void write(List<WriteOp> ops);

    /** Atomically deletes every key in {@code [from, toExclusive)}. */
    void deleteRange(byte[] from, byte[] toExclusive);

    /**
     * Iterates {@code [from, toExclusive)} over a point-in-time view taken when
     * the cursor is opened. A {@code null} bound is open.
     */
    RawCursor scan(byte[] from, byte[] toExclusive, boolean reverse);

    EngineTransaction beginTransaction();

    void flush();

    @Override
    void close();
}
