package io.kvstore.core.codec;

import io.kvstore.core.error.DecodeException;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * UTF-8 strings. UTF-8 byte order equals code point order, so this is a valid
 * key codec.
 */
public final class StringCodec implements KeyCodec<String>, ValueCodec<String> {
    public static final StringCodec INSTANCE = new StringCodec();

    private StringCodec() {}

    @Override
    public byte[] toBytes(String value) {
        // unpaired surrogates would otherwise turn into '?' and collide with real keys
        CharsetEncoder encoder = StandardCharsets.UTF_8.newEncoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            ByteBuffer out = encoder.encode(CharBuffer.wrap(value));
            byte[] bytes = new byte[out.remaining()];
            out.get(bytes);
            return bytes;
        } catch (CharacterCodingException e) {
            throw new IllegalArgumentException("String is not valid Unicode (unpaired surrogate)", e);
        }
    }

    @Override
    public String fromBytes(byte[] bytes) {
        // a fresh decoder per call, CharsetDecoder is not thread safe
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return decoder.decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException e) {
            throw new DecodeException("Stored bytes are not valid UTF-8", e);
        }
    }
}
