package io.kvstore.core.storage.engine;

import io.kvstore.core.config.StoreConfig;
import io.kvstore.core.error.ConflictException;
import io.kvstore.core.error.EngineException;
import org.rocksdb.BlockBasedTableConfig;
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.ColumnFamilyOptions;
import org.rocksdb.CompressionType;
import org.rocksdb.DBOptions;
import org.rocksdb.FlushOptions;
import org.rocksdb.LRUCache;
import org.rocksdb.OptimisticTransactionDB;
import org.rocksdb.ReadOptions;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.Snapshot;
import org.rocksdb.Status;
import org.rocksdb.Transaction;
import org.rocksdb.WriteBatch;
import org.rocksdb.WriteOptions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.logging.Logger;

/**
 * Persistent engine on RocksDB.
 *
 * Writable stores are opened as an {@link OptimisticTransactionDB} so that
 * transactions detect conflicts at commit time instead of taking locks.
 * Read-only stores use {@link RocksDB#openReadOnly}; writes on them fail.
 * All buckets share the default column family, separated by key prefix;
 * its handle is passed explicitly to every call.
 */
public final class RocksDBEngine implements StorageEngine {
    private static final Logger LOG = Logger.getLogger(RocksDBEngine.class.getName());

    /** Attempts for a single-key {@link #swap} before giving up. */
    private static final int SWAP_ATTEMPTS = 64;

    static {
        RocksDB.loadLibrary();
    }

    private final RocksDB db;
    private final OptimisticTransactionDB txDb; // null when read-only
    private final ColumnFamilyHandle cf;
    private final DBOptions dbOptions;
    private final ColumnFamilyOptions cfOptions;
    private final LRUCache blockCache;
    private final WriteOptions writeOptions;
    private final Path path;
    private volatile boolean closed;

    private RocksDBEngine(RocksDB db,
                          OptimisticTransactionDB txDb,
                          ColumnFamilyHandle cf,
                          DBOptions dbOptions,
                          ColumnFamilyOptions cfOptions,
                          LRUCache blockCache,
                          Path path) {
        this.db = db;
        this.txDb = txDb;
        this.cf = cf;
        this.dbOptions = dbOptions;
        this.cfOptions = cfOptions;
        this.blockCache = blockCache;
        this.writeOptions = new WriteOptions().setSync(false);
        this.path = path;
    }

    /** Factory: open/create a database in {@code config.path}. */
    public static RocksDBEngine open(StoreConfig config) {
        Path dir = config.path.toAbsolutePath().normalize();
        DBOptions dbOpts = new DBOptions().setCreateIfMissing(!config.readOnly);
        ColumnFamilyOptions cfOpts = new ColumnFamilyOptions()
                .setCompressionType(config.useCompression
                        ? CompressionType.LZ4_COMPRESSION
                        : CompressionType.NO_COMPRESSION);
        LRUCache cache = null;
        if (config.cacheCapacity != null) {
            cache = new LRUCache(config.cacheCapacity);
            cfOpts.setTableFormatConfig(new BlockBasedTableConfig().setBlockCache(cache));
        }
        List<ColumnFamilyDescriptor> cfDescs =
                List.of(new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY, cfOpts));
        List<ColumnFamilyHandle> cfHandles = new ArrayList<>();
        try {
            RocksDBEngine engine;
            if (config.readOnly) {
                RocksDB ro = RocksDB.openReadOnly(dbOpts, dir.toString(), cfDescs, cfHandles);
                engine = new RocksDBEngine(ro, null, cfHandles.get(0), dbOpts, cfOpts, cache, dir);
            } else {
                Files.createDirectories(dir);
                OptimisticTransactionDB txDb = OptimisticTransactionDB.open(dbOpts, dir.toString(), cfDescs, cfHandles);
                engine = new RocksDBEngine(txDb, txDb, cfHandles.get(0), dbOpts, cfOpts, cache, dir);
            }
            LOG.info("Opened RocksDB at " + dir + (config.readOnly ? " (read-only)" : ""));
            return engine;
        } catch (RocksDBException | IOException e) {
            for (ColumnFamilyHandle h : cfHandles) {
                h.close();
            }
            dbOpts.close();
            cfOpts.close();
            if (cache != null) {
                cache.close();
            }
            throw new EngineException("Failed to open RocksDB at " + dir, e);
        }
    }

    @Override
    public byte[] get(byte[] key) {
        ensureOpen();
        try {
            return db.get(cf, key);
        } catch (RocksDBException e) {
            throw new EngineException("get failed", e);
        }
    }

    @Override
    public byte[] swap(byte[] key, byte[] value) {
        ensureWritable();
        for (int attempt = 1; attempt <= SWAP_ATTEMPTS; attempt++) {
            try (Transaction txn = txDb.beginTransaction(writeOptions);
                 ReadOptions ro = new ReadOptions()) {
                byte[] previous = txn.getForUpdate(ro, cf, key, true);
                if (value == null) {
                    txn.delete(cf, key);
                } else {
                    txn.put(cf, key, value);
                }
                txn.commit();
                return previous;
            } catch (RocksDBException e) {
                if (!isConflict(e)) {
                    throw new EngineException("swap failed", e);
                }
            }
        }
        throw new ConflictException("swap gave up after " + SWAP_ATTEMPTS + " conflicting attempts");
    }

    @Override
    public void write(List<WriteOp> ops) {
        ensureWritable();
        // batch for atomicity
        try (WriteBatch batch = new WriteBatch()) {
            for (WriteOp op : ops) {
                switch (op.kind()) {
                    case PUT:
                        batch.put(cf, op.key(), op.value());
                        break;
                    case DELETE:
                        batch.delete(cf, op.key());
                        break;
                    case DELETE_RANGE:
                        batch.deleteRange(cf, op.key(), op.value());
                        break;
                    default:
                        throw new IllegalStateException("Unknown write " + op.kind());
                }
            }
            db.write(writeOptions, batch);
        } catch (RocksDBException e) {
            throw new EngineException("batch write failed", e);
        }
    }

    @Override
    public void deleteRange(byte[] from, byte[] toExclusive) {
        write(List.of(WriteOp.deleteRange(from, toExclusive)));
    }

    @Override
    public RawCursor scan(byte[] from, byte[] toExclusive, boolean reverse) {
        ensureOpen();
        Snapshot snapshot = db.getSnapshot();
        ReadOptions ro = new ReadOptions().setSnapshot(snapshot);
        RocksIterator it = db.newIterator(cf, ro);
        if (!reverse) {
            if (from == null) {
                it.seekToFirst();
            } else {
                it.seek(from);
            }
        } else if (toExclusive == null) {
            it.seekToLast();
        } else {
            it.seekForPrev(toExclusive);
            if (it.isValid() && Arrays.equals(it.key(), toExclusive)) {
                it.prev();
            }
        }
        return new RocksCursor(it, ro, snapshot, from, toExclusive, reverse);
    }

    @Override
    public EngineTransaction beginTransaction() {
        ensureWritable();
        return new RocksTransaction(txDb.beginTransaction(writeOptions));
    }

    /** Shares the monitor with {@link #close()} so the handle cannot be freed mid-flush. */
    @Override
    public synchronized void flush() {
        ensureOpen();
        if (txDb == null) {
            return;
        }
        try (FlushOptions fo = new FlushOptions().setWaitForFlush(true)) {
            db.flush(fo, cf);
        } catch (RocksDBException e) {
            throw new EngineException("flush failed", e);
        }
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        // Close handles first, then options
        writeOptions.close();
        cf.close();
        db.close();
        dbOptions.close();
        cfOptions.close();
        if (blockCache != null) {
            blockCache.close();
        }
        LOG.info("Closed RocksDB at " + path);
    }

    public Path path() {
        return path;
    }

    static boolean isConflict(RocksDBException e) {
        Status status = e.getStatus();
        if (status == null) {
            return false;
        }
        Status.Code code = status.getCode();
        return code == Status.Code.Busy || code == Status.Code.TryAgain;
    }

    private void ensureOpen() {
        if (closed) {
            throw new EngineException("RocksDB at " + path + " is closed");
        }
    }

    private void ensureWritable() {
        ensureOpen();
        if (txDb == null) {
            throw new EngineException("RocksDB at " + path + " is open read-only");
        }
    }

    private final class RocksTransaction implements EngineTransaction {
        private final Transaction txn;
        private final ReadOptions readOptions = new ReadOptions();

        RocksTransaction(Transaction txn) {
            this.txn = txn;
        }

        @Override
        public byte[] get(byte[] key) {
            ensureOpen();
            try {
                // getForUpdate registers the key for validation at commit
                return txn.getForUpdate(readOptions, cf, key, true);
            } catch (RocksDBException e) {
                throw translate("transactional get failed", e);
            }
        }

        @Override
        public void put(byte[] key, byte[] value) {
            ensureOpen();
            try {
                txn.put(cf, key, value);
            } catch (RocksDBException e) {
                throw translate("transactional put failed", e);
            }
        }

        @Override
        public void delete(byte[] key) {
            ensureOpen();
            try {
                txn.delete(cf, key);
            } catch (RocksDBException e) {
                throw translate("transactional delete failed", e);
            }
        }

        @Override
        public void commit() {
            ensureOpen();
            try {
                txn.commit();
            } catch (RocksDBException e) {
                throw translate("commit failed", e);
            }
        }

        @Override
        public void rollback() {
            ensureOpen();
            try {
                txn.rollback();
            } catch (RocksDBException e) {
                throw new EngineException("rollback failed", e);
            }
        }

        @Override
        public void close() {
            txn.close();
            readOptions.close();
        }

        private RuntimeException translate(String what, RocksDBException e) {
            if (isConflict(e)) {
                return new ConflictException(what + ": " + e.getMessage(), e);
            }
            return new EngineException(what, e);
        }
    }

    private final class RocksCursor implements RawCursor {
        private final RocksIterator it;
        private final ReadOptions readOptions;
        private final Snapshot snapshot;
        private final byte[] from;
        private final byte[] to;
        private final boolean reverse;
        private boolean done;

        RocksCursor(RocksIterator it, ReadOptions readOptions, Snapshot snapshot,
                    byte[] from, byte[] to, boolean reverse) {
            this.it = it;
            this.readOptions = readOptions;
            this.snapshot = snapshot;
            this.from = from;
            this.to = to;
            this.reverse = reverse;
        }

        @Override
        public boolean hasNext() {
            if (done) {
                return false;
            }
            if (closed) {
                throw new EngineException("RocksDB at " + path + " is closed");
            }
            if (it.isValid() && inRange(it.key())) {
                return true;
            }
            try {
                it.status();
            } catch (RocksDBException e) {
                close();
                throw new EngineException("iteration failed", e);
            }
            close();
            return false;
        }

        @Override
        public RawEntry next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            RawEntry entry = new RawEntry(it.key(), it.value());
            if (reverse) {
                it.prev();
            } else {
                it.next();
            }
            return entry;
        }

        @Override
        public void close() {
            if (done) {
                return;
            }
            done = true;
            it.close();
            if (!closed) {
                db.releaseSnapshot(snapshot);
            }
            readOptions.close();
        }

        private boolean inRange(byte[] key) {
            if (reverse) {
                return from == null || Arrays.compareUnsigned(key, from) >= 0;
            }
            return to == null || Arrays.compareUnsigned(key, to) < 0;
        }
    }
}
