package io.kvstore.core.error;

public class TransactionAbortedException extends KvException {
    private static final long serialVersionUID = 1L;

    private final String reason;

    public TransactionAbortedException(String reason, Throwable cause) {
        super("Transaction aborted: " + reason, cause);
        this.reason = reason;
    }

    public String reason() {
        return reason;
    }
}
