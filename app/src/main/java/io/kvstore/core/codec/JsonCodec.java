package io.kvstore.core.codec;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * JSON values via Jackson. Decoding rejects malformed or truncated input,
 * trailing tokens and properties the target type does not declare.
 */
public final class JsonCodec<T> extends JacksonCodec<T> {
    private static final ObjectMapper JSON = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private JsonCodec(JavaType type) {
        super(JSON, type, "JSON");
    }

    public static <T> JsonCodec<T> of(Class<T> type) {
        return new JsonCodec<>(JSON.constructType(type));
    }

    public static <T> JsonCodec<T> of(TypeReference<T> type) {
        return new JsonCodec<>(JSON.constructType(type));
    }
}
