package io.kvstore.core.codec;

import com.fasterxml.jackson.core.type.TypeReference;
import io.kvstore.core.error.DecodeException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CborCodecTest {

    record Reading(String sensor, double value, List<Integer> samples) {}

    @Test
    void roundTripsRecord() {
        CborCodec<Reading> codec = Codecs.cbor(Reading.class);
        Reading reading = new Reading("t1", 21.5, List.of(1, 2, 3));
        byte[] encoded = codec.toBytes(reading);
        // CBOR map header, not a JSON brace
        assertNotEquals('{', encoded[0]);
        assertEquals(reading, codec.fromBytes(encoded));
    }

    @Test
    void rejectsGarbage() {
        CborCodec<Reading> codec = Codecs.cbor(Reading.class);
        assertThrows(DecodeException.class, () -> codec.fromBytes(new byte[] {(byte) 0xFF, 0x00, 0x13}));
    }

    @Test
    void roundTripsGenericType() {
        CborCodec<Map<String, List<Long>>> codec = Codecs.cbor(new TypeReference<Map<String, List<Long>>>() {});
        Map<String, List<Long>> value = Map.of("a", List.of(1L, 2L), "b", List.of());
        assertEquals(value, codec.fromBytes(codec.toBytes(value)));
    }
}
