package io.kvstore.core.storage;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Optional;

/**
 * Key prefix that carves one bucket out of the shared engine keyspace.
 *
 * Layout:
 *  - default bucket : 0x00
 *  - named bucket   : 0x01, name length (u16, big-endian), UTF-8 name
 *  - registry entry : 0xFF, UTF-8 name   (one per named bucket, empty value)
 *
 * The length field keeps prefixes of different buckets from nesting, so
 * "a" and "ab" never see each other's keys.
 */
public final class Subspace {
    static final byte DEFAULT_TAG = 0x00;
    static final byte NAMED_TAG = 0x01;
    static final byte REGISTRY_TAG = (byte) 0xFF;

    static final int MAX_NAME_BYTES = 0xFFFF;

    private static final Subspace DEFAULT = new Subspace(null, new byte[] {DEFAULT_TAG});

    private final String name;
    private final byte[] prefix;
    private final byte[] end;

    private Subspace(String name, byte[] prefix) {
        this.name = name;
        this.prefix = prefix;
        this.end = successor(prefix);
    }

    /** Subspace for {@code name}; {@code null} selects the default bucket. */
    public static Subspace of(String name) {
        if (name == null) {
            return DEFAULT;
        }
        byte[] utf8 = nameBytes(name);
        byte[] prefix = new byte[3 + utf8.length];
        prefix[0] = NAMED_TAG;
        prefix[1] = (byte) (utf8.length >>> 8);
        prefix[2] = (byte) utf8.length;
        System.arraycopy(utf8, 0, prefix, 3, utf8.length);
        return new Subspace(name, prefix);
    }

    public Optional<String> name() {
        return Optional.ofNullable(name);
    }

    /** Engine key for a bucket-relative key. */
    public byte[] pack(byte[] key) {
        byte[] out = Arrays.copyOf(prefix, prefix.length + key.length);
        System.arraycopy(key, 0, out, prefix.length, key.length);
        return out;
    }

    /** Bucket-relative key for an engine key of this subspace. */
    public byte[] unpack(byte[] engineKey) {
        if (!contains(engineKey)) {
            throw new IllegalArgumentException("Key does not belong to subspace " + this);
        }
        return Arrays.copyOfRange(engineKey, prefix.length, engineKey.length);
    }

    public boolean contains(byte[] engineKey) {
        return engineKey.length >= prefix.length
                && Arrays.equals(engineKey, 0, prefix.length, prefix, 0, prefix.length);
    }

    /** Inclusive lower bound of the subspace. */
    public byte[] start() {
        return prefix.clone();
    }

    /** Exclusive upper bound of the subspace. */
    public byte[] end() {
        return end.clone();
    }

    static byte[] registryKey(String name) {
        byte[] utf8 = nameBytes(name);
        byte[] key = new byte[1 + utf8.length];
        key[0] = REGISTRY_TAG;
        System.arraycopy(utf8, 0, key, 1, utf8.length);
        return key;
    }

    static byte[] registryStart() {
        return new byte[] {REGISTRY_TAG};
    }

    static String registryName(byte[] registryKey) {
        return new String(registryKey, 1, registryKey.length - 1, StandardCharsets.UTF_8);
    }

    /**
     * Smallest byte string greater than every string starting with
     * {@code prefix}, or {@code null} if there is none (all 0xFF).
     */
    static byte[] successor(byte[] prefix) {
        for (int i = prefix.length - 1; i >= 0; i--) {
            if (prefix[i] != (byte) 0xFF) {
                byte[] out = Arrays.copyOf(prefix, i + 1);
                out[i]++;
                return out;
            }
        }
        return null;
    }

    private static byte[] nameBytes(String name) {
        byte[] utf8 = name.getBytes(StandardCharsets.UTF_8);
        if (utf8.length > MAX_NAME_BYTES) {
            throw new IllegalArgumentException("Bucket name longer than " + MAX_NAME_BYTES + " bytes");
        }
        return utf8;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Subspace)) return false;
        return Arrays.equals(prefix, ((Subspace) o).prefix);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(prefix);
    }

    @Override
    public String toString() {
        return name == null ? "Subspace[default]" : "Subspace[" + name + "]";
    }
}
