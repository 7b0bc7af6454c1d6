package io.kvstore.core.transaction;

import io.kvstore.core.error.ConflictException;
import io.kvstore.core.metrics.StoreMetrics;
import io.kvstore.core.storage.Store;
import io.kvstore.core.storage.engine.StorageEngine;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drives a {@link TransactionBody} to completion.
 *
 * Each attempt opens a fresh engine transaction and runs the body from the
 * start. {@code COMMIT} commits; a conflict (reported by an operation or by
 * the commit itself) or a {@code RETRY} step rolls back and starts the next
 * attempt; {@code ABORT} rolls back and ends the loop. Any other exception
 * rolls back and propagates unchanged.
 */
public final class TransactionRunner {
    private static final Logger LOG = Logger.getLogger(TransactionRunner.class.getName());

    private final Store store;
    private final StorageEngine engine;
    private final int maxAttempts;

    public TransactionRunner(Store store, StorageEngine engine, int maxAttempts) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive: " + maxAttempts);
        }
        this.store = store;
        this.engine = engine;
        this.maxAttempts = maxAttempts;
    }

    /**
     * @throws ConflictException when every one of the allowed attempts ended in a conflict
     */
    public <R> TransactionResult<R> run(TransactionBody<R> body) {
        return StoreMetrics.recordTransaction(() -> loop(body));
    }

    private <R> TransactionResult<R> loop(TransactionBody<R> body) {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Transaction tx = new Transaction(store, engine.beginTransaction(), attempt);
            Throwable failure = null;
            try {
                TransactionStep<R> step;
                try {
                    step = body.run(tx);
                } catch (ConflictException e) {
                    retry(tx, e);
                    continue;
                } catch (RuntimeException e) {
                    rollbackAfter(tx, e);
                    throw e;
                }
                if (step == null) {
                    throw new IllegalStateException("Transaction body returned no step");
                }
                switch (step.kind()) {
                    case ABORT:
                        tx.abort();
                        StoreMetrics.incrementAborted();
                        return TransactionResult.aborted(step.reason(), step.cause(), attempt);
                    case RETRY:
                        retry(tx, null);
                        continue;
                    case COMMIT:
                    default:
                        try {
                            tx.commit();
                        } catch (ConflictException e) {
                            retry(tx, e);
                            continue;
                        }
                        StoreMetrics.incrementCommitted();
                        return TransactionResult.committed(step.value(), attempt);
                }
            } catch (RuntimeException | Error e) {
                failure = e;
                throw e;
            } finally {
                tx.release(failure);
            }
        }
        throw new ConflictException("Transaction gave up after " + maxAttempts + " attempts");
    }

    private static void retry(Transaction tx, ConflictException conflict) {
        StoreMetrics.incrementConflicts();
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Transaction attempt " + tx.attempt() + " will be retried"
                    + (conflict == null ? " on request" : ": " + conflict.getMessage()));
        }
        tx.conflict();
    }

    private static void rollbackAfter(Transaction tx, RuntimeException failure) {
        try {
            tx.abort();
        } catch (RuntimeException rollbackFailure) {
            failure.addSuppressed(rollbackFailure);
        }
    }
}
