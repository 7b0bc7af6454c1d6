package io.kvstore.core.transaction;

import io.kvstore.core.codec.Codecs;
import io.kvstore.core.config.StoreConfig;
import io.kvstore.core.error.EngineException;
import io.kvstore.core.storage.Bucket;
import io.kvstore.core.storage.Store;
import io.kvstore.core.storage.engine.EngineTransaction;
import io.kvstore.core.storage.engine.ForwardingEngine;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TransactionRunnerTest {

    @Test
    void commitFailureSurvivesFailingRollback() {
        BrokenCommitEngine engine = new BrokenCommitEngine();
        try (Store store = new Store(engine, StoreConfig.defaults(Path.of("memory")))) {
            Bucket<String, String> bucket = store.bucket("b", Codecs.string(), Codecs.string());

            EngineException thrown = assertThrows(EngineException.class, () -> store.transaction(tx -> {
                tx.bucket(bucket).set("k", "v");
                return TransactionStep.commit(null);
            }));

            assertEquals("disk full", thrown.getMessage());
            assertEquals(1, thrown.getSuppressed().length);
            assertEquals("rollback failed", thrown.getSuppressed()[0].getMessage());
            assertTrue(engine.closed, "engine transaction must still be closed");
            assertEquals(Optional.empty(), bucket.get("k"));
        }
    }

    @Test
    void rollbackFailureAloneStillSurfaces() {
        BrokenCommitEngine engine = new BrokenCommitEngine();
        try (Store store = new Store(engine, StoreConfig.defaults(Path.of("memory")))) {
            EngineException thrown = assertThrows(EngineException.class,
                    () -> store.transaction(tx -> TransactionStep.abort("stop")));
            assertEquals("rollback failed", thrown.getMessage());
            assertTrue(engine.closed);
        }
    }

    @Test
    void rejectsNonPositiveAttemptLimit() {
        assertThrows(IllegalArgumentException.class, () -> new TransactionRunner(null, null, 0));
    }

    /** Engine whose transactions cannot commit or roll back. */
    private static final class BrokenCommitEngine extends ForwardingEngine {
        volatile boolean closed;

        @Override
        public EngineTransaction beginTransaction() {
            EngineTransaction inner = delegate.beginTransaction();
            return new EngineTransaction() {
                @Override
                public byte[] get(byte[] key) {
                    return inner.get(key);
                }

                @Override
                public void put(byte[] key, byte[] value) {
                    inner.put(key, value);
                }

                @Override
                public void delete(byte[] key) {
                    inner.delete(key);
                }

                @Override
                public void commit() {
                    throw new EngineException("disk full");
                }

                @Override
                public void rollback() {
                    throw new EngineException("rollback failed");
                }

                @Override
                public void close() {
                    closed = true;
                    inner.close();
                }
            };
        }
    }
}
