package io.kvstore.core.codec;

/** A codec for stored values. No ordering is implied. */
public interface ValueCodec<T> extends Codec<T> {
}
