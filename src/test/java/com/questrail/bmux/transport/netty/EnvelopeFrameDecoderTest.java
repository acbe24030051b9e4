package com.questrail.bmux.transport.netty;

import com.questrail.bmux.codec.PacketEnvelope;
import com.questrail.bmux.error.FramingException;

import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.DecoderException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * EnvelopeFrameDecoderTest
 * -----------------------------------------------------------------------------
 * Reassembly of envelopes from arbitrary TCP segmentation, using Netty's
 * {@link EmbeddedChannel}.
 */
final class EnvelopeFrameDecoderTest
{
    private static byte[] wire(byte[] head, byte[] body)
    {
        return new PacketEnvelope(head, body).encode();
    }

    @Test
    void emitsNothingUntilFrameIsComplete()
    {
        EmbeddedChannel ch = new EmbeddedChannel(new EnvelopeFrameDecoder(Duration.ZERO));
        byte[] frame = wire(new byte[] { 1, 2 }, new byte[] { 3, 4, 5 });

        assertFalse(ch.writeInbound(Unpooled.wrappedBuffer(Arrays.copyOfRange(frame, 0, 2))));
        assertFalse(ch.writeInbound(Unpooled.wrappedBuffer(Arrays.copyOfRange(frame, 2, 6))));
        assertTrue(ch.writeInbound(Unpooled.wrappedBuffer(Arrays.copyOfRange(frame, 6, frame.length))));

        PacketEnvelope env = ch.readInbound();
        assertArrayEquals(new byte[] { 1, 2 }, env.head());
        assertArrayEquals(new byte[] { 3, 4, 5 }, env.body());
        assertFalse(ch.finish());
    }

    @Test
    void splitsSeveralFramesFromOneSegment()
    {
        EmbeddedChannel ch = new EmbeddedChannel(new EnvelopeFrameDecoder(Duration.ZERO));
        byte[] a = wire(new byte[] { 1 }, new byte[0]);
        byte[] b = wire(new byte[0], new byte[] { 9 });
        byte[] c = wire(new byte[] { 2 }, new byte[] { 8 });

        byte[] joined = new byte[a.length + b.length + c.length];
        System.arraycopy(a, 0, joined, 0, a.length);
        System.arraycopy(b, 0, joined, a.length, b.length);
        System.arraycopy(c, 0, joined, a.length + b.length, c.length);

        assertTrue(ch.writeInbound(Unpooled.wrappedBuffer(joined)));

        assertEquals(new PacketEnvelope(new byte[] { 1 }, new byte[0]), ch.readInbound());
        assertEquals(new PacketEnvelope(new byte[0], new byte[] { 9 }), ch.readInbound());
        assertEquals(new PacketEnvelope(new byte[] { 2 }, new byte[] { 8 }), ch.readInbound());
        assertNull(ch.readInbound());
    }

    @Test
    void zeroLengthEnvelopeIsEmitted()
    {
        EmbeddedChannel ch = new EmbeddedChannel(new EnvelopeFrameDecoder(Duration.ZERO));

        assertTrue(ch.writeInbound(Unpooled.wrappedBuffer(new byte[] { 0, 0, 0 })));

        PacketEnvelope env = ch.readInbound();
        assertEquals(0, env.headLength());
        assertEquals(0, env.bodyLength());
    }

    @Test
    void closeWithPartialFrameIsAFramingError()
    {
        EmbeddedChannel ch = new EmbeddedChannel(new EnvelopeFrameDecoder(Duration.ZERO));
        ch.writeInbound(Unpooled.wrappedBuffer(new byte[] { 2, 0, 1, 7 }));

        DecoderException e = assertThrows(DecoderException.class, ch::finish);
        assertInstanceOf(FramingException.class, e.getCause());
        assertTrue(e.getCause().getMessage().contains("header"));
    }

    @Test
    void stalledPartialFrameFailsAfterReadTimeout() throws Exception
    {
        EmbeddedChannel ch = new EmbeddedChannel(new EnvelopeFrameDecoder(Duration.ofMillis(50)));
        ch.writeInbound(Unpooled.wrappedBuffer(new byte[] { 0, 0, 4, 1 }));

        TimeUnit.MILLISECONDS.sleep(120);
        ch.runPendingTasks();

        FramingException e = assertThrows(FramingException.class, ch::checkException);
        assertTrue(e.getMessage().contains("body"));
    }

    @Test
    void silentChannelFailsWhileAwaitingThePrefix() throws Exception
    {
        EmbeddedChannel ch = new EmbeddedChannel(new EnvelopeFrameDecoder(Duration.ofMillis(50)));

        TimeUnit.MILLISECONDS.sleep(120);
        ch.runPendingTasks();

        FramingException e = assertThrows(FramingException.class, ch::checkException);
        assertTrue(e.getMessage().contains("length prefix"));
    }

    @Test
    void completedFrameRestartsTheDeadline() throws Exception
    {
        EmbeddedChannel ch = new EmbeddedChannel(new EnvelopeFrameDecoder(Duration.ofMillis(200)));
        ch.writeInbound(Unpooled.wrappedBuffer(new byte[] { 0, 0, 1 }));

        TimeUnit.MILLISECONDS.sleep(120);
        ch.writeInbound(Unpooled.wrappedBuffer(new byte[] { 5 }));
        TimeUnit.MILLISECONDS.sleep(120);
        ch.runPendingTasks();

        ch.checkException();
        assertEquals(new PacketEnvelope(new byte[0], new byte[] { 5 }), ch.readInbound());

        TimeUnit.MILLISECONDS.sleep(150);
        ch.runPendingTasks();

        FramingException e = assertThrows(FramingException.class, ch::checkException);
        assertTrue(e.getMessage().contains("length prefix"));
    }
}
