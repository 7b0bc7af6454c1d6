package io.kvstore.core.storage.engine;

import java.util.List;

/** Passes every call to an {@link InMemoryEngine}; tests override the calls they want to disturb. */
public class ForwardingEngine implements StorageEngine {
    protected final InMemoryEngine delegate = new InMemoryEngine();

    @Override
    public byte[] get(byte[] key) {
        return delegate.get(key);
    }

    @Override
    public byte[] swap(byte[] key, byte[] value) {
        return delegate.swap(key, value);
    }

    @Override
    public void write(List<WriteOp> ops) {
        delegate.write(ops);
    }

    @Override
    public void deleteRange(byte[] from, byte[] toExclusive) {
        delegate.deleteRange(from, toExclusive);
    }

    @Override
    public RawCursor scan(byte[] from, byte[] toExclusive, boolean reverse) {
        return delegate.scan(from, toExclusive, reverse);
    }

    @Override
    public EngineTransaction beginTransaction() {
        return delegate.beginTransaction();
    }

    @Override
    public void flush() {
        delegate.flush();
    }

    @Override
    public void close() {
        delegate.close();
    }
}
