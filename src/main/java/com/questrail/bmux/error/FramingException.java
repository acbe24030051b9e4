package com.questrail.bmux.error;

/**
 * Indicates that an envelope could not be read in full.
 *
 * <p>Raised on a short read (peer closed the stream, or a read deadline
 * expired) at any of the three framing stages. There is no partial-frame
 * recovery: the connection that raised it is closed.</p>
 *
 * <p>{@link #atBoundary()} distinguishes a peer that closed cleanly between
 * envelopes from one that vanished mid-frame. Both end the connection; only
 * the latter is worth reporting.</p>
 */
public final class FramingException extends BmuxException
{
    private final boolean atBoundary;

    public FramingException(String message)
    {
        this(message, false);
    }

    public FramingException(String message, boolean atBoundary)
    {
        super(message);
        this.atBoundary = atBoundary;
    }

    public FramingException(String message, Throwable cause)
    {
        super(message, cause);
        this.atBoundary = false;
    }

    /**
     * {@code true} if the stream ended before the first byte of a new envelope.
     */
    public boolean atBoundary()
    {
        return atBoundary;
    }
}
