package io.kvstore.core.error;

/**
 * A transactional write collided with a concurrent writer. The transaction
 * runner retries on this; callers only see it once the retry limit is hit.
 */
public class ConflictException extends KvException {
    private static final long serialVersionUID = 1L;

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
