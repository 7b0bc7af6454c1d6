package io.kvstore.core.transaction;

/**
 * Unit of work run inside a transaction. May run several times, so it must
 * not have side effects outside the transaction.
 */
@FunctionalInterface
public interface TransactionBody<R> {
    TransactionStep<R> run(Transaction tx);
}
