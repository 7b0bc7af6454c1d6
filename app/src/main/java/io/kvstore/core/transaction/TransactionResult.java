package io.kvstore.core.transaction;

import io.kvstore.core.error.TransactionAbortedException;

import java.util.Optional;

/** Final outcome of a transaction: committed with a value, or aborted with a reason. */
public final class TransactionResult<R> {
    private final TransactionState state;
    private final R value;
    private final String reason;
    private final Throwable cause;
    private final int attempts;

    private TransactionResult(TransactionState state, R value, String reason, Throwable cause, int attempts) {
        this.state = state;
        this.value = value;
        this.reason = reason;
        this.cause = cause;
        this.attempts = attempts;
    }

    static <R> TransactionResult<R> committed(R value, int attempts) {
        return new TransactionResult<>(TransactionState.COMMITTED, value, null, null, attempts);
    }

    static <R> TransactionResult<R> aborted(String reason, Throwable cause, int attempts) {
        return new TransactionResult<>(TransactionState.ABORTED, null, reason, cause, attempts);
    }

    public TransactionState state() {
        return state;
    }

    public boolean isCommitted() {
        return state == TransactionState.COMMITTED;
    }

    public boolean isAborted() {
        return state == TransactionState.ABORTED;
    }

    /** Value passed to {@link TransactionStep#commit(Object)}; empty if aborted or committed without one. */
    public Optional<R> value() {
        return Optional.ofNullable(value);
    }

    public Optional<String> abortReason() {
        return Optional.ofNullable(reason);
    }

    public Optional<Throwable> cause() {
        return Optional.ofNullable(cause);
    }

    /** How many times the body ran, including the final run. */
    public int attempts() {
        return attempts;
    }

    /** The committed value (may be {@code null}). */
    public R orElseThrow() {
        if (isAborted()) {
            throw new TransactionAbortedException(reason, cause);
        }
        return value;
    }

    @Override
    public String toString() {
        return isCommitted()
                ? "TransactionResult{committed, attempts=" + attempts + "}"
                : "TransactionResult{aborted: " + reason + ", attempts=" + attempts + "}";
    }
}
