package com.questrail.bmux.header;

import java.nio.ByteBuffer;

/**
 * Kinds of field a {@link FixedLayoutSchema} can declare.
 *
 * <p>Only the 8/16/32-bit signed and unsigned integer kinds have a codec.
 * The remaining kinds may be declared so that a layout can describe an
 * existing header, but decoding one fails with
 * {@link com.questrail.bmux.error.HeaderDecodeException}.</p>
 */
public enum FieldKind
{
    UINT8(1, true),
    UINT16(2, true),
    UINT32(4, true),
    INT8(1, true),
    INT16(2, true),
    INT32(4, true),
    UINT64(8, false),
    INT64(8, false),
    FLOAT32(4, false),
    FLOAT64(8, false);

    private final int width;
    private final boolean decodable;

    FieldKind(int width, boolean decodable)
    {
        this.width = width;
        this.decodable = decodable;
    }

    /** Width on the wire, in bytes. */
    public int width()
    {
        return width;
    }

    public boolean decodable()
    {
        return decodable;
    }

    /**
     * Read one big-endian value, widened to {@code long}.
     * Unsigned kinds are zero-extended, signed kinds sign-extended.
     */
    long read(ByteBuffer buf)
    {
        return switch (this) {
            case UINT8 -> buf.get() & 0xFFL;
            case UINT16 -> buf.getShort() & 0xFFFFL;
            case UINT32 -> buf.getInt() & 0xFFFF_FFFFL;
            case INT8 -> buf.get();
            case INT16 -> buf.getShort();
            case INT32 -> buf.getInt();
            default -> throw new IllegalStateException("No codec for " + this);
        };
    }
}
