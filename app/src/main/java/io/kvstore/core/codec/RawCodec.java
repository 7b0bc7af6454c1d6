package io.kvstore.core.codec;

/** Identity codec: the stored bytes are the value. */
public final class RawCodec implements KeyCodec<Raw>, ValueCodec<Raw> {
    public static final RawCodec INSTANCE = new RawCodec();

    private RawCodec() {}

    @Override
    public byte[] toBytes(Raw value) {
        return value.bytes();
    }

    @Override
    public Raw fromBytes(byte[] bytes) {
        return Raw.wrap(bytes);
    }
}
