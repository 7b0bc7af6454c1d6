package io.kvstore.core.transaction;

/**
 * Lifecycle of one transaction attempt.
 * {@code RUNNING} moves to exactly one of the other three.
 */
public enum TransactionState {
    RUNNING,
    COMMITTED,
    ABORTED,
    /** Rolled back after a conflict; the body runs again in a new attempt. */
    CONFLICT_RETRY
}
