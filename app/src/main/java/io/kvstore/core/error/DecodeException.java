package io.kvstore.core.error;

/**
 * Stored bytes could not be turned back into the requested type.
 * The bytes themselves are left untouched.
 */
public class DecodeException extends KvException {
    private static final long serialVersionUID = 1L;

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
