package io.kvstore.core.storage.engine;

import io.kvstore.core.error.ConflictException;

/**
 * Optimistic transactional context. Reads see the transaction's own writes
 * and are tracked so that {@link #commit()} can detect a concurrent writer.
 */
public interface EngineTransaction extends AutoCloseable {

    byte[] get(byte[] key);

    void put(byte[] key, byte[] value);

    void delete(byte[] key);

    /** @throws ConflictException if a tracked key changed since it was read */
    void commit();

    void rollback();

    /** Releases native resources. Does not commit. */
    @Override
    void close();
}
