package io.kvstore.core.codec;

/**
 * A codec whose encodings sort, under unsigned bytewise comparison, in the
 * logical order of the type. Buckets iterate in this order.
 */
public interface KeyCodec<T> extends Codec<T> {
}
