package io.kvstore.core.transaction;

import io.kvstore.core.storage.Bucket;
import io.kvstore.core.storage.Store;
import io.kvstore.core.storage.engine.EngineTransaction;

import java.util.Objects;

/**
 * One attempt at running a {@link TransactionBody}. Typed access to any
 * number of buckets of the same store goes through {@link #bucket(Bucket)};
 * the writes stay invisible to everyone else until the attempt commits, and
 * commit together or not at all.
 */
public final class Transaction {
    private final Store store;
    private final EngineTransaction context;
    private final int attempt;
    private TransactionState state = TransactionState.RUNNING;

    Transaction(Store store, EngineTransaction context, int attempt) {
        this.store = store;
        this.context = context;
        this.attempt = attempt;
    }

    public <K, V> TransactionBucket<K, V> bucket(Bucket<K, V> bucket) {
        Objects.requireNonNull(bucket, "bucket");
        ensureRunning();
        if (bucket.store() != store) {
            throw new IllegalArgumentException("Bucket " + bucket + " belongs to a different store");
        }
        return new TransactionBucket<>(this, bucket);
    }

    public TransactionState state() {
        return state;
    }

    /** 1 for the first run of the body, incremented on every retry. */
    public int attempt() {
        return attempt;
    }

    byte[] get(byte[] key) {
        ensureRunning();
        return context.get(key);
    }

    void put(byte[] key, byte[] value) {
        ensureRunning();
        context.put(key, value);
    }

    void delete(byte[] key) {
        ensureRunning();
        context.delete(key);
    }

    void commit() {
        ensureRunning();
        context.commit();
        state = TransactionState.COMMITTED;
    }

    void conflict() {
        finish(TransactionState.CONFLICT_RETRY);
    }

    void abort() {
        finish(TransactionState.ABORTED);
    }

    /**
     * Ends the attempt; rolls back if it never got past {@code RUNNING}.
     * A rollback failure is attached to {@code pending} (the exception already
     * leaving the attempt) instead of replacing it; with no pending exception
     * it propagates.
     */
    void release(Throwable pending) {
        try {
            if (state == TransactionState.RUNNING) {
                abort();
            }
        } catch (RuntimeException rollbackFailure) {
            if (pending == null) {
                throw rollbackFailure;
            }
            pending.addSuppressed(rollbackFailure);
        } finally {
            context.close();
        }
    }

    private void finish(TransactionState next) {
        ensureRunning();
        state = next;
        context.rollback();
    }

    private void ensureRunning() {
        if (state != TransactionState.RUNNING) {
            throw new IllegalStateException("Transaction is " + state);
        }
    }
}
