package io.kvstore.core.transaction;

import io.kvstore.core.codec.Codecs;
import io.kvstore.core.codec.Raw;
import io.kvstore.core.error.ConflictException;
import io.kvstore.core.error.DecodeException;
import io.kvstore.core.error.TransactionAbortedException;
import io.kvstore.core.storage.Bucket;
import io.kvstore.core.storage.Store;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

abstract class TransactionContract {
    static final int RETRY_LIMIT = 5;

    protected Store store;
    private Bucket<String, Long> accounts;
    private Bucket<String, String> log;

    /** Store whose transactions give up after {@code retryLimit} attempts. */
    protected abstract Store openStore(int retryLimit) throws Exception;

    @BeforeEach
    void open() throws Exception {
        store = openStore(RETRY_LIMIT);
        accounts = store.bucket("accounts", Codecs.string(), Codecs.int64());
        log = store.bucket("log", Codecs.string(), Codecs.string());
    }

    @AfterEach
    void close() {
        store.close();
    }

    @Test
    void commitsAcrossTwoBuckets() {
        accounts.set("alice", 100L);

        TransactionResult<Long> result = store.transaction(tx -> {
            TransactionBucket<String, Long> a = tx.bucket(accounts);
            TransactionBucket<String, String> l = tx.bucket(log);
            long balance = a.get("alice").orElse(0L);
            a.set("alice", balance - 30);
            a.set("bob", 30L);
            l.set("1", "alice->bob 30");
            return TransactionStep.commit(balance - 30);
        });

        assertTrue(result.isCommitted());
        assertEquals(TransactionState.COMMITTED, result.state());
        assertEquals(Optional.of(70L), result.value());
        assertEquals(1, result.attempts());
        assertEquals(Optional.of(70L), accounts.get("alice"));
        assertEquals(Optional.of(30L), accounts.get("bob"));
        assertEquals(Optional.of("alice->bob 30"), log.get("1"));
    }

    @Test
    void writesAreInvisibleUntilCommit() {
        store.transaction(tx -> {
            TransactionBucket<String, Long> a = tx.bucket(accounts);
            a.set("carol", 5L);
            assertEquals(Optional.of(5L), a.get("carol"));
            assertTrue(accounts.get("carol").isEmpty());
            return TransactionStep.commit();
        });
        assertEquals(Optional.of(5L), accounts.get("carol"));
    }

    @Test
    void abortDiscardsEveryWrite() {
        accounts.set("alice", 100L);
        IllegalStateException why = new IllegalStateException("insufficient funds");

        TransactionResult<Void> result = store.transaction(tx -> {
            tx.bucket(accounts).set("alice", 0L);
            tx.bucket(log).set("1", "drained");
            return TransactionStep.abort("insufficient funds", why);
        });

        assertTrue(result.isAborted());
        assertEquals(Optional.of("insufficient funds"), result.abortReason());
        assertSame(why, result.cause().orElseThrow());
        assertEquals(Optional.of(100L), accounts.get("alice"));
        assertTrue(log.isEmpty());

        TransactionAbortedException e = assertThrows(TransactionAbortedException.class, result::orElseThrow);
        assertEquals("insufficient funds", e.reason());
    }

    @Test
    void conflictingWriteForcesRetryAndBothBucketsCommitOnce() {
        accounts.set("alice", 100L);
        List<Integer> attempts = new ArrayList<>();

        TransactionResult<Long> result = store.transaction(tx -> {
            attempts.add(tx.attempt());
            TransactionBucket<String, Long> a = tx.bucket(accounts);
            long balance = a.get("alice").orElseThrow();
            if (tx.attempt() == 1) {
                // someone else changes the key after we read it
                accounts.set("alice", balance + 1);
            }
            a.set("alice", balance - 10);
            tx.bucket(log).set("entry-" + tx.attempt(), "debit 10");
            return TransactionStep.commit(balance - 10);
        });

        assertEquals(List.of(1, 2), attempts);
        assertEquals(2, result.attempts());
        assertEquals(Optional.of(91L), result.value());
        assertEquals(Optional.of(91L), accounts.get("alice"));
        // the first attempt's log write was rolled back
        assertFalse(log.contains("entry-1"));
        assertEquals(Optional.of("debit 10"), log.get("entry-2"));
    }

    @Test
    void retryStepReRunsBody() {
        AtomicInteger runs = new AtomicInteger();
        TransactionResult<Integer> result = store.transaction(tx -> {
            tx.bucket(log).set("run", "" + tx.attempt());
            return runs.incrementAndGet() < 3 ? TransactionStep.retry() : TransactionStep.commit(runs.get());
        });
        assertEquals(3, result.attempts());
        assertEquals(Optional.of(3), result.value());
        assertEquals(Optional.of("3"), log.get("run"));
    }

    @Test
    void givesUpAfterRetryLimit() {
        AtomicInteger runs = new AtomicInteger();
        ConflictException e = assertThrows(ConflictException.class, () -> store.transaction(tx -> {
            runs.incrementAndGet();
            tx.bucket(log).set("never", "x");
            return TransactionStep.retry();
        }));
        assertEquals(RETRY_LIMIT, runs.get());
        assertTrue(e.getMessage().contains(String.valueOf(RETRY_LIMIT)));
        assertFalse(log.contains("never"));
    }

    @Test
    void bodyExceptionRollsBackAndPropagates() {
        Bucket<String, Raw> raw = store.bucket("accounts", Codecs.string(), Codecs.raw());
        raw.set("broken", Raw.of("abc"));

        assertThrows(DecodeException.class, () -> store.transaction(tx -> {
            tx.bucket(log).set("before", "x");
            tx.bucket(accounts).get("broken");
            return TransactionStep.commit();
        }));
        assertFalse(log.contains("before"));
    }

    @Test
    void finishedTransactionRejectsUse() {
        List<Transaction> leaked = new ArrayList<>();
        List<TransactionBucket<String, String>> leakedBuckets = new ArrayList<>();
        store.transaction(tx -> {
            leaked.add(tx);
            leakedBuckets.add(tx.bucket(log));
            assertEquals(TransactionState.RUNNING, tx.state());
            return TransactionStep.commit();
        });
        assertEquals(TransactionState.COMMITTED, leaked.get(0).state());
        assertThrows(IllegalStateException.class, () -> leakedBuckets.get(0).get("x"));
        assertThrows(IllegalStateException.class, () -> leaked.get(0).bucket(log));
    }

    @Test
    void rejectsBucketOfAnotherStore() {
        try (Store other = Store.inMemory()) {
            Bucket<String, String> foreign = other.bucket("log", Codecs.string(), Codecs.string());
            assertThrows(IllegalArgumentException.class, () -> store.transaction(tx -> {
                tx.bucket(foreign);
                return TransactionStep.commit();
            }));
        }
    }

    @Test
    void bucketScopedTransaction() {
        accounts.set("x", 1L);
        TransactionResult<Long> result = accounts.transaction(b -> {
            long v = b.get("x").orElse(0L);
            b.set("x", v * 10);
            b.remove("y");
            return TransactionStep.commit(v * 10);
        });
        assertEquals(10L, result.orElseThrow());
        assertEquals(Optional.of(10L), accounts.get("x"));
    }
}
