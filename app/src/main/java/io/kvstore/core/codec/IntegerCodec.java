package io.kvstore.core.codec;

import io.kvstore.core.error.DecodeException;

import java.math.BigInteger;
import java.nio.ByteBuffer;

/**
 * Fixed-width big-endian integers. Signed widths flip the sign bit so that
 * negative numbers sort before positive ones; unsigned widths are written
 * as is. In every case ascending byte order equals ascending numeric order.
 */
public abstract class IntegerCodec<T extends Number> implements KeyCodec<T>, ValueCodec<T> {

    /** 32-bit signed. */
    public static final IntegerCodec<Integer> INT = new IntegerCodec<Integer>("int", Integer.BYTES) {
        @Override
        protected void encode(Integer value, ByteBuffer out) {
            out.putInt(value ^ Integer.MIN_VALUE);
        }

        @Override
        protected Integer decode(ByteBuffer in) {
            return in.getInt() ^ Integer.MIN_VALUE;
        }
    };

    /** 64-bit signed. */
    public static final IntegerCodec<Long> LONG = new IntegerCodec<Long>("long", Long.BYTES) {
        @Override
        protected void encode(Long value, ByteBuffer out) {
            out.putLong(value ^ Long.MIN_VALUE);
        }

        @Override
        protected Long decode(ByteBuffer in) {
            return in.getLong() ^ Long.MIN_VALUE;
        }
    };

    /** 64-bit unsigned, held in a {@code long} (compare with {@link Long#compareUnsigned}). */
    public static final IntegerCodec<Long> UNSIGNED_LONG = new IntegerCodec<Long>("unsigned long", Long.BYTES) {
        @Override
        protected void encode(Long value, ByteBuffer out) {
            out.putLong(value);
        }

        @Override
        protected Long decode(ByteBuffer in) {
            return in.getLong();
        }
    };

    /** 128-bit unsigned, any {@link BigInteger} in {@code [0, 2^128)}. */
    public static final IntegerCodec<BigInteger> UNSIGNED_128 = new IntegerCodec<BigInteger>("unsigned 128-bit", 16) {
        @Override
        protected void encode(BigInteger value, ByteBuffer out) {
            if (value.signum() < 0 || value.bitLength() > 128) {
                throw new IllegalArgumentException("Value out of unsigned 128-bit range: " + value);
            }
            byte[] raw = value.toByteArray();
            // toByteArray may carry a leading sign byte or be shorter than 16 bytes
            int copy = Math.min(raw.length, 16);
            out.position(16 - copy);
            out.put(raw, raw.length - copy, copy);
        }

        @Override
        protected BigInteger decode(ByteBuffer in) {
            byte[] data = new byte[16];
            in.get(data);
            return new BigInteger(1, data);
        }
    };

    private final String name;
    private final int width;

    private IntegerCodec(String name, int width) {
        this.name = name;
        this.width = width;
    }

    /** Encoded size in bytes. */
    public int width() {
        return width;
    }

    @Override
    public final byte[] toBytes(T value) {
        ByteBuffer out = ByteBuffer.allocate(width);
        encode(value, out);
        return out.array();
    }

    @Override
    public final T fromBytes(byte[] bytes) {
        if (bytes.length != width) {
            throw new DecodeException("Expected " + width + " bytes for " + name + " but got " + bytes.length);
        }
        return decode(ByteBuffer.wrap(bytes));
    }

    protected abstract void encode(T value, ByteBuffer out);

    protected abstract T decode(ByteBuffer in);

    @Override
    public String toString() {
        return "IntegerCodec[" + name + "]";
    }
}
