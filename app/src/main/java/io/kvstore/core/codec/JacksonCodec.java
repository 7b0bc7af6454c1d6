package io.kvstore.core.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import io.kvstore.core.error.DecodeException;

import java.io.IOException;
import java.util.Objects;

/**
 * Structured value encoding backed by a Jackson {@link ObjectMapper}. The
 * data format is whatever the mapper's factory writes (JSON, CBOR, ...).
 */
abstract class JacksonCodec<T> implements ValueCodec<T> {
    private final JavaType type;
    private final ObjectReader reader;
    private final ObjectWriter writer;
    private final String format;

    JacksonCodec(ObjectMapper mapper, JavaType type, String format) {
        this.type = Objects.requireNonNull(type, "type");
        this.reader = mapper.readerFor(type);
        this.writer = mapper.writerFor(type);
        this.format = format;
    }

    @Override
    public byte[] toBytes(T value) {
        try {
            return writer.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode " + type.getTypeName() + " as " + format, e);
        }
    }

    @Override
    public T fromBytes(byte[] bytes) {
        try {
            T value = reader.readValue(bytes);
            if (value == null) {
                throw new DecodeException("Stored " + format + " is null, expected " + type.getTypeName());
            }
            return value;
        } catch (IOException e) {
            throw new DecodeException("Stored bytes are not valid " + format + " for " + type.getTypeName(), e);
        }
    }

    public JavaType type() {
        return type;
    }
}
