package io.kvstore.core.error;

/**
 * I/O, lock or corruption failure reported by the storage engine.
 */
public class EngineException extends KvException {
    private static final long serialVersionUID = 1L;

    public EngineException(String message) {
        super(message);
    }

    public EngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
