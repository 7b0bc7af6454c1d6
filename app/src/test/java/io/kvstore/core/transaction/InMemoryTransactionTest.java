package io.kvstore.core.transaction;

import io.kvstore.core.config.StoreConfig;
import io.kvstore.core.storage.Store;
import io.kvstore.core.storage.engine.InMemoryEngine;

import java.nio.file.Path;

class InMemoryTransactionTest extends TransactionContract {

    @Override
    protected Store openStore(int retryLimit) {
        StoreConfig config = StoreConfig.defaults(Path.of("memory")).withTransactionRetryLimit(retryLimit);
        return new Store(new InMemoryEngine(), config);
    }
}
