package io.kvstore.core.codec;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.cbor.CBORFactory;

/** Compact binary (CBOR) values via Jackson. */
public final class CborCodec<T> extends JacksonCodec<T> {
    private static final ObjectMapper CBOR = new ObjectMapper(new CBORFactory())
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private CborCodec(JavaType type) {
        super(CBOR, type, "CBOR");
    }

    public static <T> CborCodec<T> of(Class<T> type) {
        return new CborCodec<>(CBOR.constructType(type));
    }

    public static <T> CborCodec<T> of(TypeReference<T> type) {
        return new CborCodec<>(CBOR.constructType(type));
    }
}
