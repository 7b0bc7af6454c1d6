package io.kvstore.core.codec;

import com.fasterxml.jackson.core.type.TypeReference;

import java.math.BigInteger;

/** Shorthand for the built-in codecs. */
public final class Codecs {
    private Codecs() {}

    public static RawCodec raw() {
        return RawCodec.INSTANCE;
    }

    public static StringCodec string() {
        return StringCodec.INSTANCE;
    }

    public static IntegerCodec<Integer> int32() {
        return IntegerCodec.INT;
    }

    public static IntegerCodec<Long> int64() {
        return IntegerCodec.LONG;
    }

    public static IntegerCodec<Long> uint64() {
        return IntegerCodec.UNSIGNED_LONG;
    }

    public static IntegerCodec<BigInteger> uint128() {
        return IntegerCodec.UNSIGNED_128;
    }

    public static <T> JsonCodec<T> json(Class<T> type) {
        return JsonCodec.of(type);
    }

    public static <T> JsonCodec<T> json(TypeReference<T> type) {
        return JsonCodec.of(type);
    }

    public static <T> CborCodec<T> cbor(Class<T> type) {
        return CborCodec.of(type);
    }

    public static <T> CborCodec<T> cbor(TypeReference<T> type) {
        return CborCodec.of(type);
    }
}
