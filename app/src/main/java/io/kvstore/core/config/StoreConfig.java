package io.kvstore.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/** Settings used to open a store. Immutable; use the {@code with*} methods to derive variants. */
public final class StoreConfig {
    public static final int DEFAULT_TRANSACTION_RETRY_LIMIT = 100;

    private static final ObjectMapper JSON = new ObjectMapper();

    /** Directory holding the database files. */
    public final Path path;
    /** Open without write access. */
    public final boolean readOnly;
    /** Delete {@link #path} when the store is closed. */
    public final boolean temporary;
    public final boolean useCompression;
    /** Period of the background flush, or {@code null} for none. */
    public final Long flushEveryMs;
    /** Block cache size in bytes, or {@code null} for the engine default. */
    public final Long cacheCapacity;
    /** Upper bound on attempts of one transaction body. */
    public final int transactionRetryLimit;

    public StoreConfig(Path path,
                       boolean readOnly,
                       boolean temporary,
                       boolean useCompression,
                       Long flushEveryMs,
                       Long cacheCapacity,
                       int transactionRetryLimit) {
        this.path = Objects.requireNonNull(path, "path");
        if (flushEveryMs != null && flushEveryMs <= 0) {
            throw new IllegalArgumentException("flushEveryMs must be positive: " + flushEveryMs);
        }
        if (cacheCapacity != null && cacheCapacity <= 0) {
            throw new IllegalArgumentException("cacheCapacity must be positive: " + cacheCapacity);
        }
        if (transactionRetryLimit <= 0) {
            throw new IllegalArgumentException("transactionRetryLimit must be positive: " + transactionRetryLimit);
        }
        this.readOnly = readOnly;
        this.temporary = temporary;
        this.useCompression = useCompression;
        this.flushEveryMs = flushEveryMs;
        this.cacheCapacity = cacheCapacity;
        this.transactionRetryLimit = transactionRetryLimit;
    }

    public static StoreConfig defaults(Path path) {
        return new StoreConfig(
                path,
                false,   // writable
                false,   // keep files on close
                false,   // no compression
                null,    // no background flush
                null,    // engine default cache
                DEFAULT_TRANSACTION_RETRY_LIMIT
        );
    }

    public StoreConfig withReadOnly(boolean readOnly) {
        return new StoreConfig(path, readOnly, temporary, useCompression, flushEveryMs, cacheCapacity, transactionRetryLimit);
    }

    public StoreConfig withTemporary(boolean temporary) {
        return new StoreConfig(path, readOnly, temporary, useCompression, flushEveryMs, cacheCapacity, transactionRetryLimit);
    }

    public StoreConfig withCompression(boolean useCompression) {
        return new StoreConfig(path, readOnly, temporary, useCompression, flushEveryMs, cacheCapacity, transactionRetryLimit);
    }

    public StoreConfig withFlushEveryMs(long ms) {
        return new StoreConfig(path, readOnly, temporary, useCompression, ms, cacheCapacity, transactionRetryLimit);
    }

    public StoreConfig withCacheCapacity(long bytes) {
        return new StoreConfig(path, readOnly, temporary, useCompression, flushEveryMs, bytes, transactionRetryLimit);
    }

    public StoreConfig withTransactionRetryLimit(int limit) {
        return new StoreConfig(path, readOnly, temporary, useCompression, flushEveryMs, cacheCapacity, limit);
    }

    public void save(Path file) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream out = Files.newOutputStream(file)) {
                saveTo(out);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to persist store config to " + file, e);
        }
    }

    public void saveTo(OutputStream out) throws IOException {
        JSON.writerWithDefaultPrettyPrinter().writeValue(out, Document.of(this));
    }

    public static StoreConfig load(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return loadFrom(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read store config from " + file, e);
        }
    }

    public static StoreConfig loadFrom(InputStream in) {
        Document doc;
        try {
            doc = JSON.readValue(in, Document.class);
        } catch (IOException e) {
            throw new IllegalStateException("Invalid store configuration", e);
        }
        if (doc == null || doc.path() == null || doc.path().isBlank()) {
            throw new IllegalStateException("Invalid store configuration: missing path");
        }
        try {
            return doc.toConfig();
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid store configuration: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StoreConfig)) return false;
        StoreConfig other = (StoreConfig) o;
        return readOnly == other.readOnly
                && temporary == other.temporary
                && useCompression == other.useCompression
                && transactionRetryLimit == other.transactionRetryLimit
                && path.equals(other.path)
                && Objects.equals(flushEveryMs, other.flushEveryMs)
                && Objects.equals(cacheCapacity, other.cacheCapacity);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, readOnly, temporary, useCompression, flushEveryMs, cacheCapacity, transactionRetryLimit);
    }

    @Override
    public String toString() {
        return "StoreConfig{path=" + path
                + ", readOnly=" + readOnly
                + ", temporary=" + temporary
                + ", useCompression=" + useCompression
                + ", flushEveryMs=" + flushEveryMs
                + ", cacheCapacity=" + cacheCapacity
                + ", transactionRetryLimit=" + transactionRetryLimit + "}";
    }

    /** On-disk JSON shape. Missing flags fall back to the defaults. */
    record Document(String path,
                    Boolean readOnly,
                    Boolean temporary,
                    Boolean useCompression,
                    Long flushEveryMs,
                    Long cacheCapacity,
                    Integer transactionRetryLimit) {

        static Document of(StoreConfig c) {
            return new Document(c.path.toString(), c.readOnly, c.temporary, c.useCompression,
                    c.flushEveryMs, c.cacheCapacity, c.transactionRetryLimit);
        }

        StoreConfig toConfig() {
            return new StoreConfig(
                    Path.of(path),
                    Boolean.TRUE.equals(readOnly),
                    Boolean.TRUE.equals(temporary),
                    Boolean.TRUE.equals(useCompression),
                    flushEveryMs,
                    cacheCapacity,
                    transactionRetryLimit == null ? DEFAULT_TRANSACTION_RETRY_LIMIT : transactionRetryLimit
            );
        }
    }
}
