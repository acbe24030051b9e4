package com.questrail.bmux.codec;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Arrays;
import java.util.Objects;

/**
 * PacketEnvelope
 * =============================================================================
 * One length-prefixed frame of the bmux wire protocol.
 *
 * <pre>
 *   byte 0       : header length H (0..255)
 *   bytes 1-2    : body length L (0..65535), unsigned, big-endian
 *   bytes 3..3+H : header payload
 *   next L bytes : body payload
 * </pre>
 *
 * <p>The wire representation is always exactly {@code 3 + H + L} bytes.
 * Construction validates both lengths, so an oversize envelope is rejected
 * before any byte reaches a transport.</p>
 *
 * <p>The envelope carries bytes only. Interpreting the header is the job of
 * {@code com.questrail.bmux.header.HeaderDecoder}.</p>
 */
public record PacketEnvelope(byte[] head, byte[] body)
{
    /** Size of the fixed length prefix. */
    public static final int PREFIX_LENGTH = 3;

    public static final int MAX_HEAD_LENGTH = 0xFF;
    public static final int MAX_BODY_LENGTH = 0xFFFF;

    public PacketEnvelope
    {
        Objects.requireNonNull(head, "head");
        Objects.requireNonNull(body, "body");
        if (head.length > MAX_HEAD_LENGTH) {
            throw new IllegalArgumentException(
                    "Header length " + head.length + " exceeds " + MAX_HEAD_LENGTH + " bytes");
        }
        if (body.length > MAX_BODY_LENGTH) {
            throw new IllegalArgumentException(
                    "Body length " + body.length + " exceeds " + MAX_BODY_LENGTH + " bytes");
        }
    }

    public int headLength()
    {
        return head.length;
    }

    public int bodyLength()
    {
        return body.length;
    }

    /**
     * Total number of bytes this envelope occupies on the wire.
     */
    public int wireLength()
    {
        return PREFIX_LENGTH + head.length + body.length;
    }

    /**
     * Encode into a single wire-ready array.
     */
    public byte[] encode()
    {
        byte[] out = new byte[wireLength()];
        writePrefix(out, head.length, body.length);
        System.arraycopy(head, 0, out, PREFIX_LENGTH, head.length);
        System.arraycopy(body, 0, out, PREFIX_LENGTH + head.length, body.length);
        return out;
    }

    /**
     * Write the encoded envelope with one call to {@code out.write} and flush.
     */
    public void writeTo(OutputStream out) throws IOException
    {
        out.write(encode());
        out.flush();
    }

    static void writePrefix(byte[] dst, int headLength, int bodyLength)
    {
        dst[0] = (byte) headLength;
        dst[1] = (byte) (bodyLength >>> 8);
        dst[2] = (byte) bodyLength;
    }

    /**
     * Header length encoded in a prefix.
     */
    public static int headLengthOf(byte[] prefix)
    {
        return prefix[0] & 0xFF;
    }

    /**
     * Body length encoded in a prefix (big-endian, unsigned).
     */
    public static int bodyLengthOf(byte[] prefix)
    {
        return ((prefix[1] & 0xFF) << 8) | (prefix[2] & 0xFF);
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (!(o instanceof PacketEnvelope that)) return false;
        return Arrays.equals(head, that.head) && Arrays.equals(body, that.body);
    }

    @Override
    public int hashCode()
    {
        return 31 * Arrays.hashCode(head) + Arrays.hashCode(body);
    }

    @Override
    public String toString()
    {
        return "PacketEnvelope[headLen=" + head.length + ", bodyLen=" + body.length + "]";
    }
}
