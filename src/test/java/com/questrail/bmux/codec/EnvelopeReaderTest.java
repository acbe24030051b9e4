package com.questrail.bmux.codec;

import com.questrail.bmux.error.FramingException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * EnvelopeReaderTest
 * -----------------------------------------------------------------------------
 * Exact-length reads, envelope boundaries, and short-read classification.
 */
final class EnvelopeReaderTest
{
    @Test
    void readsConsecutiveEnvelopesInOrder() throws IOException
    {
        ByteArrayOutputStream wire = new ByteArrayOutputStream();
        new PacketEnvelope(new byte[] { 1 }, new byte[] { 10, 11 }).writeTo(wire);
        new PacketEnvelope(new byte[] { 2, 2 }, new byte[0]).writeTo(wire);

        EnvelopeReader reader = new EnvelopeReader(new ByteArrayInputStream(wire.toByteArray()));

        PacketEnvelope first = reader.read();
        assertArrayEquals(new byte[] { 1 }, first.head());
        assertArrayEquals(new byte[] { 10, 11 }, first.body());

        PacketEnvelope second = reader.read();
        assertArrayEquals(new byte[] { 2, 2 }, second.head());
        assertEquals(0, second.bodyLength());
    }

    @Test
    void reassemblesEnvelopeFromOneByteReads()
    {
        byte[] wire = new PacketEnvelope(new byte[] { 9, 8, 7 }, new byte[] { 1, 2, 3, 4 }).encode();

        EnvelopeReader reader = new EnvelopeReader(new TricklingInputStream(wire));

        PacketEnvelope env = reader.read();
        assertArrayEquals(new byte[] { 9, 8, 7 }, env.head());
        assertArrayEquals(new byte[] { 1, 2, 3, 4 }, env.body());
    }

    @Test
    void eofBetweenEnvelopesIsAtBoundary()
    {
        EnvelopeReader reader = new EnvelopeReader(new ByteArrayInputStream(new byte[0]));

        FramingException e = assertThrows(FramingException.class, reader::read);
        assertTrue(e.atBoundary());
    }

    @Test
    void eofInsidePrefixIsNotAtBoundary()
    {
        EnvelopeReader reader = new EnvelopeReader(new ByteArrayInputStream(new byte[] { 1, 0 }));

        FramingException e = assertThrows(FramingException.class, reader::read);
        assertFalse(e.atBoundary());
        assertTrue(e.getMessage().contains("length prefix"));
    }

    @Test
    void eofInsideHeaderNamesHeaderStage()
    {
        // head length 4, body length 0, only 2 header bytes present
        EnvelopeReader reader = new EnvelopeReader(new ByteArrayInputStream(new byte[] { 4, 0, 0, 1, 2 }));

        FramingException e = assertThrows(FramingException.class, reader::read);
        assertFalse(e.atBoundary());
        assertTrue(e.getMessage().contains("header"));
    }

    @Test
    void eofInsideBodyNamesBodyStage()
    {
        EnvelopeReader reader = new EnvelopeReader(new ByteArrayInputStream(new byte[] { 0, 0, 5, 1 }));

        FramingException e = assertThrows(FramingException.class, reader::read);
        assertTrue(e.getMessage().contains("body"));
    }

    @Test
    void deadlineIsArmedOncePerStage()
    {
        byte[] wire = new PacketEnvelope(new byte[] { 1, 2 }, new byte[] { 3 }).encode();
        List<String> calls = new ArrayList<>();

        ReadDeadline recording = new ReadDeadline() {
            @Override public void arm() { calls.add("arm"); }
            @Override public void beforeRead() { calls.add("read"); }
        };

        new EnvelopeReader(new TricklingInputStream(wire), recording).read();

        assertEquals(3, calls.stream().filter("arm"::equals).count());
        assertEquals(wire.length, calls.stream().filter("read"::equals).count());
        assertEquals("arm", calls.get(0));
    }

    @Test
    void expiredDeadlineBecomesFramingException()
    {
        byte[] wire = new PacketEnvelope(new byte[] { 1 }, new byte[] { 2 }).encode();

        ReadDeadline expired = new ReadDeadline() {
            @Override public void arm() {}
            @Override public void beforeRead() throws IOException {
                throw new SocketTimeoutException("Read deadline exceeded");
            }
        };

        FramingException e = assertThrows(FramingException.class,
                () -> new EnvelopeReader(new ByteArrayInputStream(wire), expired).read());
        assertInstanceOf(SocketTimeoutException.class, e.getCause());
        assertFalse(e.atBoundary());
    }

    /** Delivers at most one byte per read call. */
    private static final class TricklingInputStream extends InputStream
    {
        private final byte[] data;
        private int pos;

        TricklingInputStream(byte[] data)
        {
            this.data = data;
        }

        @Override
        public int read()
        {
            return pos < data.length ? data[pos++] & 0xFF : -1;
        }

        @Override
        public int read(byte[] b, int off, int len)
        {
            if (pos >= data.length) {
                return -1;
            }
            if (len == 0) {
                return 0;
            }
            b[off] = data[pos++];
            return 1;
        }
    }
}
