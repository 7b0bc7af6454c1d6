package io.kvstore.core.storage;

import io.kvstore.core.codec.KeyCodec;
import io.kvstore.core.codec.ValueCodec;
import io.kvstore.core.config.StoreConfig;
import io.kvstore.core.storage.engine.InMemoryEngine;
import io.kvstore.core.storage.engine.RawCursor;
import io.kvstore.core.storage.engine.RocksDBEngine;
import io.kvstore.core.storage.engine.StorageEngine;
import io.kvstore.core.storage.engine.WriteOp;
import io.kvstore.core.transaction.TransactionBody;
import io.kvstore.core.transaction.TransactionResult;
import io.kvstore.core.transaction.TransactionRunner;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * Owns an engine handle and hands out typed {@link Bucket}s over it.
 * Safe to share between threads; close it once when done.
 */
public final class Store implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(Store.class.getName());
    private static final long FLUSH_SHUTDOWN_SECONDS = 10;

    private final StorageEngine engine;
    private final StoreConfig config;
    private final TransactionRunner runner;
    private final ScheduledExecutorService flusher;
    private boolean closed;

    public Store(StorageEngine engine, StoreConfig config) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.config = Objects.requireNonNull(config, "config");
        this.runner = new TransactionRunner(this, engine, config.transactionRetryLimit);
        this.flusher = (config.flushEveryMs != null && !config.readOnly) ? startFlusher(config.flushEveryMs) : null;
    }

    /** Opens (creating if needed) a RocksDB-backed store. */
    public static Store open(StoreConfig config) {
        return new Store(RocksDBEngine.open(config), config);
    }

    public static Store open(Path path) {
        return open(StoreConfig.defaults(path));
    }

    /** A store that lives in memory only. */
    public static Store inMemory() {
        return new Store(new InMemoryEngine(), StoreConfig.defaults(Path.of("memory")));
    }

    /**
     * Typed handle for the bucket called {@code name}, or for the default
     * bucket when {@code name} is {@code null}. Named buckets are recorded in
     * the store's registry the first time they are requested.
     */
    public <K, V> Bucket<K, V> bucket(String name, KeyCodec<K> keyCodec, ValueCodec<V> valueCodec) {
        Objects.requireNonNull(keyCodec, "keyCodec");
        Objects.requireNonNull(valueCodec, "valueCodec");
        Subspace subspace = Subspace.of(name);
        if (name != null && !config.readOnly) {
            register(name);
        }
        return new Bucket<>(this, subspace, keyCodec, valueCodec);
    }

    /** Names of all registered buckets, sorted by their UTF-8 bytes. */
    public List<String> buckets() {
        List<String> names = new ArrayList<>();
        try (RawCursor cursor = engine.scan(Subspace.registryStart(), null, false)) {
            while (cursor.hasNext()) {
                names.add(Subspace.registryName(cursor.next().key()));
            }
        }
        return names;
    }

    /**
     * Deletes every entry of the named bucket and forgets the name, in one
     * atomic write.
     *
     * @return {@code false} if no such bucket was registered
     */
    public boolean dropBucket(String name) {
        Objects.requireNonNull(name, "name");
        byte[] registryKey = Subspace.registryKey(name);
        if (engine.get(registryKey) == null) {
            return false;
        }
        Subspace subspace = Subspace.of(name);
        engine.write(List.of(
                WriteOp.deleteRange(subspace.start(), subspace.end()),
                WriteOp.delete(registryKey)));
        LOG.info("Dropped bucket '" + name + "'");
        return true;
    }

    /**
     * Runs {@code body} atomically across any buckets of this store,
     * re-running it after conflicts.
     *
     * @throws io.kvstore.core.error.ConflictException if the retry limit is exhausted
     */
    public <R> TransactionResult<R> transaction(TransactionBody<R> body) {
        Objects.requireNonNull(body, "body");
        return runner.run(body);
    }

    public void flush() {
        engine.flush();
    }

    public StoreConfig config() {
        return config;
    }

    public StorageEngine engine() {
        return engine;
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (flusher != null) {
            stopFlusher();
        }
        engine.close();
        if (config.temporary) {
            deleteDirectory(config.path);
        }
    }

    private void register(String name) {
        byte[] key = Subspace.registryKey(name);
        if (engine.get(key) == null) {
            engine.write(List.of(WriteOp.put(key, new byte[0])));
        }
    }

    private ScheduledExecutorService startFlusher(long periodMs) {
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "kvstore-flush");
            t.setDaemon(true);
            return t;
        });
        Runnable task = () -> {
            try {
                engine.flush();
            } catch (Exception e) {
                LOG.log(Level.WARNING, "Background flush failed", e);
            }
        };
        executor.scheduleAtFixedRate(task, periodMs, periodMs, TimeUnit.MILLISECONDS);
        return executor;
    }

    private void stopFlusher() {
        flusher.shutdown();
        try {
            if (!flusher.awaitTermination(FLUSH_SHUTDOWN_SECONDS, TimeUnit.SECONDS)) {
                LOG.warning("Background flush still running after " + FLUSH_SHUTDOWN_SECONDS + "s, closing anyway");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void deleteDirectory(Path dir) {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> stream = Files.walk(dir)) {
            stream.sorted(Comparator.reverseOrder())
                    .forEach(path -> {
                        try {
                            Files.deleteIfExists(path);
                        } catch (IOException e) {
                            throw new IllegalStateException("Failed to delete " + path, e);
                        }
                    });
        } catch (IOException | IllegalStateException e) {
            LOG.log(Level.WARNING, "Failed to remove temporary store at " + dir, e);
            return;
        }
        LOG.info("Removed temporary store at " + dir);
    }
}
