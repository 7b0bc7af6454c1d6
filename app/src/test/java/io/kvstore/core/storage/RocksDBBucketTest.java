package io.kvstore.core.storage;

import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

class RocksDBBucketTest extends BucketContract {

    @TempDir
    Path dir;

    @Override
    protected Store openStore() {
        return Store.open(dir.resolve("db"));
    }
}
