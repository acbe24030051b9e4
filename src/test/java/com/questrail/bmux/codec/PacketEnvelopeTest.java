package com.questrail.bmux.codec;

import org.junit.jupiter.api.Test;

import java.io.BufferedOutputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

final class PacketEnvelopeTest
{
    @Test
    void encodeWritesBigEndianPrefixThenHeadThenBody()
    {
        byte[] head = { 0x0A, 0x0B };
        byte[] body = new byte[0x0102];
        body[0] = 0x55;

        byte[] wire = new PacketEnvelope(head, body).encode();

        assertEquals(3 + 2 + 0x0102, wire.length);
        assertEquals(2, wire[0]);
        assertEquals(0x01, wire[1]);
        assertEquals(0x02, wire[2]);
        assertEquals(0x0A, wire[3]);
        assertEquals(0x0B, wire[4]);
        assertEquals(0x55, wire[5]);
    }

    @Test
    void emptyHeadAndBodyEncodeToBarePrefix()
    {
        PacketEnvelope env = new PacketEnvelope(new byte[0], new byte[0]);

        assertArrayEquals(new byte[] { 0, 0, 0 }, env.encode());
        assertEquals(PacketEnvelope.PREFIX_LENGTH, env.wireLength());
    }

    @Test
    void maximumLengthsAreAccepted()
    {
        PacketEnvelope env = new PacketEnvelope(
                new byte[PacketEnvelope.MAX_HEAD_LENGTH],
                new byte[PacketEnvelope.MAX_BODY_LENGTH]);

        byte[] wire = env.encode();
        assertEquals((byte) 0xFF, wire[0]);
        assertEquals((byte) 0xFF, wire[1]);
        assertEquals((byte) 0xFF, wire[2]);
    }

    @Test
    void oversizeHeadIsRejectedBeforeAnythingIsWritten()
    {
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        assertThrows(IllegalArgumentException.class, () ->
                new PacketEnvelope(new byte[256], new byte[0]).writeTo(out));
        assertEquals(0, out.size());
    }

    @Test
    void writeToFlushesBufferedStreams() throws IOException
    {
        ByteArrayOutputStream wire = new ByteArrayOutputStream();
        BufferedOutputStream out = new BufferedOutputStream(wire, 1024);

        new PacketEnvelope(new byte[] { 1 }, new byte[] { 2, 3 }).writeTo(out);

        assertArrayEquals(new byte[] { 1, 0, 2, 1, 2, 3 }, wire.toByteArray());
    }

    @Test
    void oversizeBodyIsRejected()
    {
        assertThrows(IllegalArgumentException.class, () ->
                new PacketEnvelope(new byte[0], new byte[65536]));
    }

    @Test
    void lengthsAreReadFromPrefix()
    {
        byte[] prefix = { 7, (byte) 0xAB, (byte) 0xCD };

        assertEquals(7, PacketEnvelope.headLengthOf(prefix));
        assertEquals(0xABCD, PacketEnvelope.bodyLengthOf(prefix));
    }
}
