package io.kvstore.core.transaction;

import java.util.Objects;

/**
 * What a transaction body wants to happen next: commit with a value, abort
 * with a reason, or run again from the start.
 */
public final class TransactionStep<R> {

    public enum Kind { COMMIT, ABORT, RETRY }

    private final Kind kind;
    private final R value;
    private final String reason;
    private final Throwable cause;

    private TransactionStep(Kind kind, R value, String reason, Throwable cause) {
        this.kind = kind;
        this.value = value;
        this.reason = reason;
        this.cause = cause;
    }

    public static <R> TransactionStep<R> commit(R value) {
        return new TransactionStep<>(Kind.COMMIT, value, null, null);
    }

    public static <R> TransactionStep<R> commit() {
        return new TransactionStep<>(Kind.COMMIT, null, null, null);
    }

    public static <R> TransactionStep<R> abort(String reason) {
        return new TransactionStep<>(Kind.ABORT, null, Objects.requireNonNull(reason, "reason"), null);
    }

    public static <R> TransactionStep<R> abort(String reason, Throwable cause) {
        return new TransactionStep<>(Kind.ABORT, null, Objects.requireNonNull(reason, "reason"), cause);
    }

    /** Discard this attempt and run the body again, as after a conflict. */
    public static <R> TransactionStep<R> retry() {
        return new TransactionStep<>(Kind.RETRY, null, null, null);
    }

    public Kind kind() {
        return kind;
    }

    public R value() {
        return value;
    }

    public String reason() {
        return reason;
    }

    public Throwable cause() {
        return cause;
    }
}
