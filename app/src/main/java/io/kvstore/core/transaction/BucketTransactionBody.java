package io.kvstore.core.transaction;

/** {@link TransactionBody} over a single bucket. */
@FunctionalInterface
public interface BucketTransactionBody<K, V, R> {
    TransactionStep<R> run(TransactionBucket<K, V> bucket);
}
