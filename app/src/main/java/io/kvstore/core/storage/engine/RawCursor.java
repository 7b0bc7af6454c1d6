package io.kvstore.core.storage.engine;

import java.util.Iterator;

/**
 * Ordered pass over a key range. Holds engine resources until exhausted or
 * closed; {@link #close()} is idempotent.
 */
public interface RawCursor extends Iterator<RawEntry>, AutoCloseable {

    @Override
    void close();
}
