package com.questrail.bmux.codec;

import java.io.IOException;

/**
 * ReadDeadline
 * -----------------------------------------------------------------------------
 * Hook through which {@link EnvelopeReader} applies a read timeout.
 *
 * <p>The reader arms the deadline at the start of every framing stage (prefix,
 * header, body) and calls {@link #beforeRead()} before each blocking read inside
 * a stage. A slow peer can therefore be cut off in the middle of a frame.</p>
 */
public interface ReadDeadline
{
    /** Deadline that never expires. */
    ReadDeadline NONE = new ReadDeadline() {
        @Override public void arm() {}
        @Override public void beforeRead() {}
    };

    /**
     * Start a new stage deadline.
     */
    void arm() throws IOException;

    /**
     * Apply whatever remains of the current stage deadline to the next read.
     *
     * @throws java.net.SocketTimeoutException if the stage deadline has passed
     */
    void beforeRead() throws IOException;
}
