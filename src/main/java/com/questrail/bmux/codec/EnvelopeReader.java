package com.questrail.bmux.codec;

import com.questrail.bmux.error.FramingException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * EnvelopeReader
 * -----------------------------------------------------------------------------
 * Blocking reader that cuts a byte stream into {@link PacketEnvelope}s.
 *
 * <p>Each call reads exactly one envelope:</p>
 * <ol>
 *   <li>3 prefix bytes</li>
 *   <li>exactly H header bytes</li>
 *   <li>exactly L body bytes</li>
 * </ol>
 *
 * <p>The {@link ReadDeadline} is re-armed before each of the three stages.
 * A short read at any stage (end of stream, or a timeout surfaced by the
 * stream) aborts the envelope with a {@link FramingException}. Nothing is
 * buffered between calls: after a failure the stream position is undefined
 * and the caller must stop reading.</p>
 *
 * <p>Instances are not thread-safe; a connection owns exactly one reader.</p>
 */
public final class EnvelopeReader
{
    private static final byte[] EMPTY = new byte[0];

    private final InputStream in;
    private final ReadDeadline deadline;

    public EnvelopeReader(InputStream in, ReadDeadline deadline)
    {
        this.in = Objects.requireNonNull(in, "in");
        this.deadline = Objects.requireNonNull(deadline, "deadline");
    }

    public EnvelopeReader(InputStream in)
    {
        this(in, ReadDeadline.NONE);
    }

    /**
     * Read the next envelope.
     *
     * @throws FramingException on a short read at any stage
     */
    public PacketEnvelope read()
    {
        byte[] prefix = readStage(Stage.PREFIX, PacketEnvelope.PREFIX_LENGTH);

        int headLength = PacketEnvelope.headLengthOf(prefix);
        int bodyLength = PacketEnvelope.bodyLengthOf(prefix);

        byte[] head = readStage(Stage.HEADER, headLength);
        byte[] body = readStage(Stage.BODY, bodyLength);

        return new PacketEnvelope(head, body);
    }

    private byte[] readStage(Stage stage, int length)
    {
        try {
            deadline.arm();
            if (length == 0) {
                return EMPTY;
            }
            byte[] buf = new byte[length];
            int off = 0;
            while (off < length) {
                deadline.beforeRead();
                int n = in.read(buf, off, length - off);
                if (n < 0) {
                    throw new FramingException(
                            "Stream closed while reading " + stage.label + " (" + off + "/" + length + " bytes)",
                            stage == Stage.PREFIX && off == 0);
                }
                off += n;
            }
            return buf;
        }
        catch (IOException e) {
            throw new FramingException("Failed to read " + stage.label + ": " + e.getMessage(), e);
        }
    }

    private enum Stage
    {
        PREFIX("length prefix"),
        HEADER("header"),
        BODY("body");

        private final String label;

        Stage(String label)
        {
            this.label = label;
        }
    }
}
