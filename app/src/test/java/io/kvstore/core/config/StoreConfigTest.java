package io.kvstore.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class StoreConfigTest {

    @TempDir
    Path dir;

    @Test
    void defaults() {
        StoreConfig config = StoreConfig.defaults(Path.of("data"));
        assertFalse(config.readOnly);
        assertFalse(config.temporary);
        assertFalse(config.useCompression);
        assertNull(config.flushEveryMs);
        assertNull(config.cacheCapacity);
        assertEquals(StoreConfig.DEFAULT_TRANSACTION_RETRY_LIMIT, config.transactionRetryLimit);
    }

    @Test
    void withersCopy() {
        StoreConfig base = StoreConfig.defaults(Path.of("data"));
        StoreConfig tuned = base.withCompression(true).withCacheCapacity(1 << 20).withFlushEveryMs(500);
        assertFalse(base.useCompression);
        assertTrue(tuned.useCompression);
        assertEquals(1L << 20, tuned.cacheCapacity);
        assertEquals(500L, tuned.flushEveryMs);
        assertEquals(base.path, tuned.path);
    }

    @Test
    void rejectsNonPositiveLimits() {
        StoreConfig base = StoreConfig.defaults(Path.of("data"));
        assertThrows(IllegalArgumentException.class, () -> base.withTransactionRetryLimit(0));
        assertThrows(IllegalArgumentException.class, () -> base.withFlushEveryMs(0));
        assertThrows(IllegalArgumentException.class, () -> base.withCacheCapacity(-1));
    }

    @Test
    void savesAndLoadsJson() {
        StoreConfig config = StoreConfig.defaults(dir.resolve("db"))
                .withReadOnly(true)
                .withCompression(true)
                .withFlushEveryMs(1_000)
                .withTransactionRetryLimit(7);
        Path file = dir.resolve("conf/store.json");
        config.save(file);
        assertEquals(config, StoreConfig.load(file));
    }

    @Test
    void missingOptionalFieldsFallBackToDefaults() {
        StoreConfig config = StoreConfig.loadFrom(stream("{\"path\":\"/var/kv\"}"));
        assertEquals(StoreConfig.defaults(Path.of("/var/kv")), config);
    }

    @Test
    void invalidDocumentsAreRejected() {
        IllegalStateException unknown = assertThrows(IllegalStateException.class,
                () -> StoreConfig.loadFrom(stream("{\"path\":\"x\",\"colour\":\"blue\"}")));
        assertTrue(unknown.getMessage().startsWith("Invalid store configuration"));
        assertThrows(IllegalStateException.class, () -> StoreConfig.loadFrom(stream("{\"readOnly\":true}")));
        assertThrows(IllegalStateException.class, () -> StoreConfig.loadFrom(stream("{\"path\":")));
        assertThrows(IllegalStateException.class,
                () -> StoreConfig.loadFrom(stream("{\"path\":\"x\",\"transactionRetryLimit\":0}")));
    }

    private static ByteArrayInputStream stream(String json) {
        return new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8));
    }
}
