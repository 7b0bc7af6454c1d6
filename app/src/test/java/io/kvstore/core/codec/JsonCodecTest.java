package io.kvstore.core.codec;

import com.fasterxml.jackson.core.type.TypeReference;
import io.kvstore.core.error.DecodeException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonCodecTest {

    record Account(String owner, long balance, List<String> tags) {}

    private final JsonCodec<Account> codec = JsonCodec.of(Account.class);

    @Test
    void roundTripsRecord() {
        Account account = new Account("alice", 1_000L, List.of("a", "b"));
        byte[] encoded = codec.toBytes(account);
        assertTrue(new String(encoded, StandardCharsets.UTF_8).contains("\"owner\":\"alice\""));
        assertEquals(account, codec.fromBytes(encoded));
    }

    @Test
    void roundTripsGenericType() {
        JsonCodec<Map<String, Integer>> maps = Codecs.json(new TypeReference<Map<String, Integer>>() {});
        Map<String, Integer> value = Map.of("x", 1, "y", 2);
        assertEquals(value, maps.fromBytes(maps.toBytes(value)));
    }

    @Test
    void rejectsMalformedJson() {
        assertThrows(DecodeException.class, () -> codec.fromBytes(bytes("{\"owner\":")));
        assertThrows(DecodeException.class, () -> codec.fromBytes(bytes("not json")));
    }

    @Test
    void rejectsShapeMismatch() {
        assertThrows(DecodeException.class, () -> codec.fromBytes(bytes("{\"owner\":\"a\",\"extra\":1}")));
        assertThrows(DecodeException.class, () -> codec.fromBytes(bytes("{\"owner\":\"a\",\"balance\":\"lots\"}")));
        assertThrows(DecodeException.class, () -> codec.fromBytes(bytes("{\"owner\":\"a\"} {}")));
    }

    @Test
    void rejectsNull() {
        assertThrows(DecodeException.class, () -> codec.fromBytes(bytes("null")));
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
