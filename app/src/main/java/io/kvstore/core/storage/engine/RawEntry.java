package io.kvstore.core.storage.engine;

/** A key/value pair as the engine stores it. */
public record RawEntry(byte[] key, byte[] value) {
}
